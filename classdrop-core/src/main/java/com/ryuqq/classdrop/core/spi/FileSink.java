package com.ryuqq.classdrop.core.spi;

import java.io.IOException;

/**
 * 호스트의 파일 저장 기능.
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public interface FileSink {

    /**
     * 파일 저장.
     *
     * @param pathHint 저장 경로 힌트 ({@code <folder>/<filename>})
     * @param bytes 파일 내용
     * @throws IOException 저장 실패
     */
    void save(String pathHint, byte[] bytes) throws IOException;
}
