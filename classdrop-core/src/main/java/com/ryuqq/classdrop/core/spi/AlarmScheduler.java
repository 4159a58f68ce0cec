package com.ryuqq.classdrop.core.spi;

/**
 * 호스트의 타이머/알람 기능.
 *
 * <p>프로세스가 잠들어 있어도 주기가 지나면 프로세스를 깨워 콜백을 호출합니다.
 * 같은 이름으로 다시 등록하면 기존 알람을 대체합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public interface AlarmScheduler {

    /**
     * 반복 알람 등록.
     *
     * @param name 알람 이름
     * @param intervalMinutes 주기 (분, 양수)
     * @param callback 알람 콜백
     */
    void scheduleRecurring(String name, long intervalMinutes, Runnable callback);

    /**
     * 알람 해제. 없는 알람이면 아무것도 하지 않습니다.
     *
     * @param name 알람 이름
     */
    void cancel(String name);
}
