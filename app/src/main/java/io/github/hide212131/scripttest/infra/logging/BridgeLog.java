package io.github.hide212131.scripttest.infra.logging;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ブリッジ実行のフェーズ単位でログを出力する。
 */
@SuppressWarnings({ "PMD.GuardLogStatement", "PMD.AvoidDuplicateLiterals" })
public final class BridgeLog {

    private final Logger logger;

    public BridgeLog(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public static BridgeLog forClass(Class<?> type) {
        return new BridgeLog(Logger.getLogger(type.getName()));
    }

    public void debug(String phase, String script, String test, String message) {
        if (!logger.isLoggable(Level.FINE)) {
            return;
        }
        logger.log(Level.FINE, format(Level.FINE, phase, script, test, message, null));
    }

    public void info(String phase, String script, String test, String message) {
        if (!logger.isLoggable(Level.INFO)) {
            return;
        }
        logger.log(Level.INFO, format(Level.INFO, phase, script, test, message, null));
    }

    public void warn(String phase, String script, String test, String message, Throwable error) {
        if (!logger.isLoggable(Level.WARNING)) {
            return;
        }
        logger.log(Level.WARNING, format(Level.WARNING, phase, script, test, message, error), error);
    }

    public void error(String phase, String script, String test, String message, Throwable error) {
        if (!logger.isLoggable(Level.SEVERE)) {
            return;
        }
        logger.log(Level.SEVERE, format(Level.SEVERE, phase, script, test, message, error), error);
    }

    private static String format(Level level, String phase, String script, String test, String message,
            Throwable error) {
        String line = String.format(Locale.ROOT, "[phase=%s][level=%s][script=%s][test=%s] %s", dash(phase),
                level.getName(), dash(script), dash(test), Objects.toString(message, ""));
        if (error == null) {
            return line;
        }
        return line + " error=" + error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private static String dash(String value) {
        return value == null || value.isBlank() ? "-" : value.trim();
    }
}
