package io.github.hide212131.scripttest.infra.config;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Optional;

/**
 * 実行結果のサマリを書き出すストリームの種別。
 */
public enum OutputTarget {
    NONE, OUT, ERROR;

    /**
     * 設定値を解釈する。未設定または不明な値は {@code fallback} を返す。
     */
    public static OutputTarget parse(String value, OutputTarget fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "none" -> NONE;
        case "out" -> OUT;
        case "error" -> ERROR;
        default -> fallback;
        };
    }

    public Optional<PrintStream> select(PrintStream out, PrintStream err) {
        return switch (this) {
        case NONE -> Optional.empty();
        case OUT -> Optional.of(out);
        case ERROR -> Optional.of(err);
        };
    }
}
