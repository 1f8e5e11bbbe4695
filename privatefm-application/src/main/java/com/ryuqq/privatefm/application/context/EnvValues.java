package com.ryuqq.privatefm.application.context;

import java.util.Map;

/**
 * 환경 변수 파싱 헬퍼.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnvValues {

    private EnvValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static int intValue(Map<String, String> env, String name, int defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer (current: " + raw + ")", e);
        }
    }

    public static double doubleValue(Map<String, String> env, String name, double defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number (current: " + raw + ")", e);
        }
    }

    /**
     * "true"/"false" (대소문자 무시) 파싱. 그 외 값은 기본값.
     */
    public static boolean booleanValue(Map<String, String> env, String name, boolean defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String normalized = raw.trim().toLowerCase();
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        return defaultValue;
    }
}
