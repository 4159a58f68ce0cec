package com.ryuqq.classdrop.core.spi;

import com.ryuqq.classdrop.core.error.CredentialException;

import java.util.OptionalLong;

/**
 * 자격 증명 제공자.
 *
 * <p>Bearer 토큰을 발급하는 불투명한 호출이며, interactive 요청은
 * 사용자에게 로그인 창을 띄울 수 있습니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public interface CredentialProvider {

    /**
     * 토큰 요청.
     *
     * @param interactive 사용자 프롬프트 허용 여부
     * @return Bearer 토큰
     * @throws CredentialException 사용자 취소, 네트워크 오류, 설정 오류
     */
    String requestToken(boolean interactive) throws CredentialException;

    /**
     * 토큰 폐기 (best-effort).
     *
     * @param token 폐기할 토큰
     * @throws CredentialException 폐기 실패
     */
    void revokeToken(String token) throws CredentialException;

    /**
     * 토큰의 남은 수명 조회 (introspection).
     *
     * @param token 조회할 토큰
     * @return 남은 초, 토큰이 유효하지 않으면 empty
     * @throws CredentialException 조회 자체가 실패한 경우
     */
    OptionalLong remainingLifetimeSeconds(String token) throws CredentialException;
}
