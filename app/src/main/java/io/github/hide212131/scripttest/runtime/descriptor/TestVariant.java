package io.github.hide212131.scripttest.runtime.descriptor;

import java.util.Locale;

/**
 * スクリプトテストの種別。{@link #SUPPRESSIBLE} は表示抑止フラグ付きで起動できる。
 */
public enum TestVariant {
    PLAIN, SUPPRESSIBLE;

    public static TestVariant parse(String value) {
        if (value == null || value.isBlank()) {
            return PLAIN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "plain" -> PLAIN;
        case "suppressible" -> SUPPRESSIBLE;
        default -> throw new IllegalArgumentException("不明なテスト種別です: " + value);
        };
    }
}
