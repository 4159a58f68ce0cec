package com.ryuqq.classdrop.core.spi;

import com.ryuqq.classdrop.core.error.ApiException;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.CollectionId;

import java.io.IOException;

/**
 * 원격 카탈로그 API (과제, 자료, 공지 레코드 조회).
 *
 * <p>호출은 항상 RateLimiter를 거칩니다. 429 응답은 Retry-After 헤더를 담은
 * {@link ApiException}으로 전달되어야 합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public interface CatalogApi {

    /**
     * 컬렉션 전체 레코드 조회.
     *
     * @param collectionId 컬렉션 ID
     * @param token Bearer 토큰
     * @return 카탈로그 스냅샷
     * @throws ApiException 2xx가 아닌 응답
     * @throws IOException 전송 실패
     */
    CatalogSnapshot fetchCollection(CollectionId collectionId, String token) throws ApiException, IOException;
}
