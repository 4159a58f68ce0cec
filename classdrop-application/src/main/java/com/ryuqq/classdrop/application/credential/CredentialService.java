package com.ryuqq.classdrop.application.credential;

import com.ryuqq.classdrop.core.error.CredentialException;

/**
 * Bearer 자격 증명 공급 포트.
 *
 * <p>다운로드 배치와 카탈로그 조회가 모두 이 포트로 토큰을 얻습니다.
 * 예상된 만료는 내부에서 처리하고, 호출자에게는 분류된
 * {@link CredentialException}만 전달합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public interface CredentialService {

    /**
     * 토큰 조회.
     *
     * <p>캐시된 토큰이 만료 전으로 추정되면 그대로 반환하고,
     * 아니면 제공자에게 새 토큰을 요청합니다.</p>
     *
     * @param interactive 사용자 프롬프트 허용 여부
     * @return Bearer 토큰
     * @throws CredentialException 토큰을 얻지 못한 경우
     */
    String getToken(boolean interactive) throws CredentialException;

    /**
     * 강제 갱신.
     *
     * <p>다른 갱신이 진행 중이면 새로 요청하지 않고 그 결과를 재사용합니다.</p>
     *
     * @param interactive 사용자 프롬프트 허용 여부
     * @return 갱신된 (또는 현재) 토큰
     * @throws CredentialException 토큰을 얻지 못한 경우
     */
    String refresh(boolean interactive) throws CredentialException;

    /**
     * 배치 시작 전 사전 검증.
     *
     * <p>남은 수명이 짧으면 배치 도중 만료되지 않도록 미리 갱신합니다.</p>
     *
     * @return 배치 동안 유효할 것으로 보이는 토큰
     * @throws CredentialException 유효한 토큰을 얻을 수 없는 경우 (배치 시작 불가)
     */
    String ensureValidForBatch() throws CredentialException;
}
