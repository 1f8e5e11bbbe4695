package com.ryuqq.privatefm.application.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 체크포인트 메타데이터, 학습 메타데이터, Job 통계의 JSON 직렬화.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Jsons {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private Jsons() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * 값을 UTF-8 JSON 바이트로 직렬화.
     *
     * @param value 직렬화할 값
     * @return JSON 바이트
     * @throws IllegalStateException 직렬화 실패 시
     */
    public static byte[] toBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON", e);
        }
    }

    /**
     * JSON 바이트를 Map으로 역직렬화.
     *
     * @param bytes JSON 바이트
     * @return 필드 맵 (입력 순서 유지)
     * @throws IllegalStateException 역직렬화 실패 시
     */
    public static Map<String, Object> toMap(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, MAP_TYPE);
        } catch (java.io.IOException e) {
            throw new IllegalStateException(
                "Failed to parse JSON: " + new String(bytes, StandardCharsets.UTF_8), e);
        }
    }
}
