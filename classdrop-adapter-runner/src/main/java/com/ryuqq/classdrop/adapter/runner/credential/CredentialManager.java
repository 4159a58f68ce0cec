package com.ryuqq.classdrop.adapter.runner.credential;

import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.application.credential.CredentialService;
import com.ryuqq.classdrop.core.error.CredentialException;
import com.ryuqq.classdrop.core.error.StorageException;
import com.ryuqq.classdrop.core.model.Credential;
import com.ryuqq.classdrop.core.spi.AlarmScheduler;
import com.ryuqq.classdrop.core.spi.CredentialProvider;
import com.ryuqq.classdrop.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bearer 자격 증명 관리자.
 *
 * <p>토큰을 {@value #CREDENTIAL_KEY}에 발급 시각과 함께 저장하고,
 * 추정 수명 안에서는 재사용합니다. 강제 갱신은 KV 저장소 기반 갱신 락으로
 * 직렬화되며, 동시에 들어온 갱신 요청은 하나의 제공자 요청으로 합쳐집니다.</p>
 *
 * <p><strong>갱신 합치기:</strong> refresh는 락을 기다리기 전에 발급 카운터를 기록합니다.
 * 락을 얻은 뒤 카운터가 달라졌다면 그 사이 다른 호출자가 새 토큰을 발급한 것이므로
 * 제공자에게 다시 요청하지 않고 저장된 토큰을 반환합니다.</p>
 *
 * <p><strong>선제 갱신:</strong> {@link #start()}가 {@value #PROACTIVE_ALARM} 알람을 등록합니다.
 * 알람 콜백의 실패는 로그만 남기고 삼킵니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CredentialManager credentials = new CredentialManager(
 *     provider, store, codec, alarms, new CredentialConfig(), Clock.systemUTC());
 * credentials.start();
 * String token = credentials.ensureValidForBatch();
 * </pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class CredentialManager implements CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

    public static final String CREDENTIAL_KEY = "gcr_auth_credential";
    public static final String PROACTIVE_ALARM = "gcr-proactive-token-refresh";

    private final CredentialProvider provider;
    private final KeyValueStore store;
    private final JsonCodec codec;
    private final AlarmScheduler alarms;
    private final CredentialConfig config;
    private final Clock clock;
    private final RefreshLockManager lockManager;
    private final AtomicLong issueCount = new AtomicLong();

    /**
     * 생성자.
     *
     * @param provider 자격 증명 제공자
     * @param store 영속 KV 저장소
     * @param codec JSON 직렬화기
     * @param alarms 알람 스케줄러
     * @param config 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CredentialManager(CredentialProvider provider, KeyValueStore store, JsonCodec codec,
                             AlarmScheduler alarms, CredentialConfig config, Clock clock) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (alarms == null) {
            throw new IllegalArgumentException("alarms cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.provider = provider;
        this.store = store;
        this.codec = codec;
        this.alarms = alarms;
        this.config = config;
        this.clock = clock;
        this.lockManager = new RefreshLockManager(store, codec, config, clock);
    }

    /**
     * 선제 갱신 알람 등록.
     */
    public void start() {
        scheduleProactiveRefresh();
        log.info("Credential manager started: proactive refresh every {} minutes", config.proactiveIntervalMinutes());
    }

    /**
     * 선제 갱신 알람 해제.
     */
    public void stop() {
        alarms.cancel(PROACTIVE_ALARM);
    }

    @Override
    public String getToken(boolean interactive) throws CredentialException {
        Optional<Credential> cached = storedCredential();
        if (cached.isPresent() && cached.get().ageMillis(clock.millis()) < config.trustedAgeMs()) {
            return cached.get().token();
        }
        log.debug("No trusted credential cached, requesting from provider: interactive={}", interactive);
        return issue(interactive);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>발급 카운터 기록 후 갱신 락 획득 시도 (최대 lockWaitMs)</li>
     *   <li>획득 실패: contentionPauseMs 대기 후 {@link #getToken(boolean)} 결과 반환</li>
     *   <li>그 사이 다른 호출자가 발급했다면 저장된 토큰 반환 (제공자 요청 없음)</li>
     *   <li>이전 토큰 폐기 (실패해도 계속), 새 토큰 요청, 다음 선제 갱신 예약</li>
     *   <li>락은 finally에서 해제</li>
     * </ol>
     */
    @Override
    public String refresh(boolean interactive) throws CredentialException {
        long issuedBefore = issueCount.get();
        String lockId = UUID.randomUUID().toString();

        boolean acquired;
        try {
            acquired = lockManager.acquire(lockId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CredentialException(CredentialException.Kind.CANCELLED, "Interrupted while waiting for refresh lock", e);
        }

        if (!acquired) {
            log.info("Another refresh is in flight, reusing the current credential");
            pause(config.contentionPauseMs());
            return getToken(interactive);
        }

        try {
            Optional<Credential> current = storedCredential();
            if (current.isPresent() && issueCount.get() != issuedBefore) {
                log.debug("Refresh coalesced with a concurrent refresh");
                return current.get().token();
            }

            current.ifPresent(credential -> revokeQuietly(credential.token()));
            store.remove(CREDENTIAL_KEY);

            String token = issue(interactive);
            scheduleProactiveRefresh();
            log.info("Credential refreshed: interactive={}", interactive);
            return token;
        } finally {
            lockManager.release(lockId);
        }
    }

    @Override
    public String ensureValidForBatch() throws CredentialException {
        String token = getToken(false);
        OptionalLong remaining = provider.remainingLifetimeSeconds(token);

        if (remaining.isEmpty()) {
            log.info("Credential failed introspection, refreshing before batch");
            return refresh(true);
        }
        if (remaining.getAsLong() < config.minRemainingLifetimeSeconds()) {
            log.info("Credential expires in {}s, refreshing before batch", remaining.getAsLong());
            return refresh(true);
        }

        log.debug("Credential valid for {}s, proceeding with batch", remaining.getAsLong());
        return token;
    }

    /**
     * 유효성을 확인한 토큰 조회.
     *
     * <p>만료 가능성이 있거나 조회 결과 유효하지 않으면 갱신합니다.</p>
     *
     * @param interactive 사용자 프롬프트 허용 여부
     * @return 유효한 토큰
     * @throws CredentialException 토큰을 얻지 못한 경우
     */
    public String getValidToken(boolean interactive) throws CredentialException {
        if (mightBeExpired()) {
            log.debug("Credential might be expired, refreshing");
            return refresh(interactive);
        }
        String token = getToken(interactive);
        if (provider.remainingLifetimeSeconds(token).isEmpty()) {
            log.info("Credential invalid on introspection, refreshing");
            return refresh(interactive);
        }
        return token;
    }

    /**
     * 사용자 프롬프트 없이 토큰을 얻을 수 있는지 여부.
     *
     * @return 인증되어 있으면 true
     */
    public boolean isAuthenticated() {
        try {
            getToken(false);
            return true;
        } catch (CredentialException e) {
            log.debug("Not authenticated: kind={}, message={}", e.getKind(), e.getMessage());
            return false;
        }
    }

    /**
     * 로그아웃: 토큰 폐기 후 저장된 자격 증명 삭제.
     *
     * @throws CredentialException 폐기 요청이 실패한 경우 (저장된 자격 증명은 이미 삭제됨)
     */
    public void signOut() throws CredentialException {
        Optional<Credential> current = storedCredential();
        store.remove(CREDENTIAL_KEY);
        stop();
        if (current.isPresent()) {
            provider.revokeToken(current.get().token());
        }
        log.info("Signed out");
    }

    /**
     * 알람 콜백. 실패는 로그만 남기고 삼킵니다.
     */
    void onProactiveAlarm() {
        if (storedCredential().isEmpty()) {
            log.debug("Proactive refresh skipped: no stored credential");
            return;
        }
        try {
            refresh(false);
        } catch (CredentialException e) {
            log.warn("Proactive refresh failed: kind={}, message={}", e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Proactive refresh failed unexpectedly", e);
        }
    }

    private boolean mightBeExpired() {
        return storedCredential()
            .map(credential -> credential.ageMillis(clock.millis()) >= config.trustedAgeMs())
            .orElse(true);
    }

    private String issue(boolean interactive) throws CredentialException {
        String token = provider.requestToken(interactive);
        if (token == null || token.isBlank()) {
            throw new CredentialException(CredentialException.Kind.UNAVAILABLE, "Credential provider returned no token");
        }
        issueCount.incrementAndGet();
        try {
            store.set(CREDENTIAL_KEY, codec.write(new Credential(token, clock.millis())));
        } catch (StorageException e) {
            log.warn("Failed to persist credential, it will be requested again next time: {}", e.getMessage());
        }
        return token;
    }

    private Optional<Credential> storedCredential() {
        return store.get(CREDENTIAL_KEY).flatMap(json -> codec.read(json, Credential.class));
    }

    private void revokeQuietly(String token) {
        try {
            provider.revokeToken(token);
        } catch (CredentialException e) {
            log.warn("Failed to revoke previous credential, continuing refresh: {}", e.getMessage());
        }
    }

    private void scheduleProactiveRefresh() {
        alarms.scheduleRecurring(PROACTIVE_ALARM, config.proactiveIntervalMinutes(), this::onProactiveAlarm);
    }

    private void pause(long millis) throws CredentialException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CredentialException(CredentialException.Kind.CANCELLED, "Interrupted during contention pause", e);
        }
    }
}
