package com.ryuqq.classdrop.core.protection;

import com.ryuqq.classdrop.core.error.ApiException;

import java.io.IOException;

/**
 * Rate Limiter로 보호되는 원격 호출.
 *
 * @param <T> 응답 타입
 * @author ClassDrop Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteCall<T> {

    T call() throws ApiException, IOException;
}
