package com.ryuqq.classdrop.core.spi;

import com.ryuqq.classdrop.core.error.ApiException;
import com.ryuqq.classdrop.core.model.ExportFormat;

import java.io.IOException;

/**
 * 원격 콘텐츠 API (파일 바이트 또는 변환본 조회).
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public interface ContentApi {

    /**
     * 원본 바이트 조회.
     *
     * @param itemId 파일 ID
     * @param token Bearer 토큰
     * @return 파일 바이트
     * @throws ApiException 2xx가 아닌 응답
     * @throws IOException 전송 실패 (타임아웃 포함)
     */
    byte[] fetchContent(String itemId, String token) throws ApiException, IOException;

    /**
     * Workspace 문서를 변환해서 조회.
     *
     * @param itemId 파일 ID
     * @param targetFormat 변환 포맷
     * @param token Bearer 토큰
     * @return 변환된 바이트
     * @throws ApiException 2xx가 아닌 응답
     * @throws IOException 전송 실패 (타임아웃 포함)
     */
    byte[] convertAndFetch(String itemId, ExportFormat targetFormat, String token) throws ApiException, IOException;
}
