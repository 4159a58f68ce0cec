package com.ryuqq.classdrop.adapter.runner.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * KV 저장소에 기록하는 모든 값의 JSON 직렬화기.
 *
 * <p>하나의 {@link ObjectMapper}를 공유합니다. 저장소에 남은 값이 깨져 있거나
 * 이전 버전 형식이면 {@link #read(String, Class)}는 경고를 남기고 빈 값을 반환하며,
 * 호출자는 해당 항목이 없는 것으로 취급합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class JsonCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonCodec.class);

    private final ObjectMapper mapper;

    public JsonCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * 값을 JSON 문자열로 직렬화.
     *
     * @param value 직렬화할 값
     * @return JSON 문자열
     * @throws IllegalStateException 직렬화할 수 없는 값인 경우
     */
    public String write(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * JSON 문자열을 역직렬화.
     *
     * @param json JSON 문자열 (null 허용)
     * @param type 대상 타입
     * @param <T> 대상 타입
     * @return 역직렬화된 값, 입력이 없거나 깨진 경우 빈 값
     */
    public <T> Optional<T> read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(json, type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Discarding unreadable {} document: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 직렬화된 JSON의 UTF-8 바이트 길이.
     *
     * @param json JSON 문자열
     * @return 바이트 길이
     */
    public static long byteSize(String json) {
        return json.getBytes(StandardCharsets.UTF_8).length;
    }
}
