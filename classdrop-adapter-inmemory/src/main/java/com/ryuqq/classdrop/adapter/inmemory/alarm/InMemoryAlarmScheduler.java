package com.ryuqq.classdrop.adapter.inmemory.alarm;

import com.ryuqq.classdrop.core.spi.AlarmScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link AlarmScheduler} SPI.
 *
 * <p>Alarms never fire on their own. Tests trigger them with {@link #fire(String)},
 * which keeps proactive refresh scenarios deterministic.</p>
 *
 * <p>Scheduling an existing name replaces the previous alarm.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class InMemoryAlarmScheduler implements AlarmScheduler {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAlarmScheduler.class);

    private final Map<String, Alarm> alarms = new ConcurrentHashMap<>();

    @Override
    public void scheduleRecurring(String name, long intervalMinutes, Runnable callback) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes must be positive (current: " + intervalMinutes + ")");
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        alarms.put(name, new Alarm(intervalMinutes, callback));
        log.debug("Alarm scheduled: name={}, intervalMinutes={}", name, intervalMinutes);
    }

    @Override
    public void cancel(String name) {
        if (alarms.remove(name) != null) {
            log.debug("Alarm cancelled: name={}", name);
        }
    }

    /**
     * Runs the callback of the named alarm on the calling thread.
     *
     * @param name alarm name
     * @return {@code true} if an alarm with that name was scheduled
     */
    public boolean fire(String name) {
        Alarm alarm = alarms.get(name);
        if (alarm == null) {
            return false;
        }
        alarm.callback.run();
        return true;
    }

    public boolean isScheduled(String name) {
        return alarms.containsKey(name);
    }

    public OptionalLong intervalOf(String name) {
        Alarm alarm = alarms.get(name);
        return alarm == null ? OptionalLong.empty() : OptionalLong.of(alarm.intervalMinutes);
    }

    private static final class Alarm {
        private final long intervalMinutes;
        private final Runnable callback;

        private Alarm(long intervalMinutes, Runnable callback) {
            this.intervalMinutes = intervalMinutes;
            this.callback = callback;
        }
    }
}
