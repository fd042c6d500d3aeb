package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

import java.util.List;

/**
 * resolution 병합 규칙: 값이 주어진 키만 덮어쓰고, 없는 키는 기존 값을 유지.
 */
final class Overrides {

    private Overrides() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String string(Details resolution, String key, String current) {
        return resolution.hasValue(key) ? resolution.getString(key) : current;
    }

    static Integer integer(Details resolution, String key, Integer current) {
        return resolution.hasValue(key) ? resolution.getInteger(key) : current;
    }

    static int integer(Details resolution, String key, int current) {
        return resolution.hasValue(key) ? resolution.getInteger(key) : current;
    }

    static Boolean bool(Details resolution, String key, Boolean current) {
        return resolution.hasValue(key) ? resolution.getBoolean(key) : current;
    }

    static boolean bool(Details resolution, String key, boolean current) {
        return resolution.hasValue(key) ? resolution.getBoolean(key) : current;
    }

    static List<String> names(Details resolution, String key, List<String> current) {
        return resolution.hasValue(key) ? resolution.getStringList(key) : current;
    }
}
