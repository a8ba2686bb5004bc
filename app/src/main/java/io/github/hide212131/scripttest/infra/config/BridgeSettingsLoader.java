package io.github.hide212131.scripttest.infra.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * システムプロパティ、環境変数、.env の順に設定を解決する。
 * 解釈できない値は例外にせず、各キーのデフォルトへフォールバックする。
 */
public final class BridgeSettingsLoader {

    public static final String SHOW_BROWSER_WINDOW = "ShowBrowserWindow";
    public static final String DELETE_TEMP_FILES_WHEN_FINISHED = "DeleteTempFilesWhenFinished";
    public static final String FAILURE_STREAM = "FailureStream";
    public static final String SUCCESS_STREAM = "SuccessStream";
    public static final String FAIL_MESSAGE_FROM_TEST_OUTPUT = "FailMessageFromTestOutput";
    public static final String INTERPRETER_COMMAND = "InterpreterCommand";
    public static final String DISPLAY_SUPPRESSION_FLAG = "DisplaySuppressionFlag";
    public static final String PROCESS_TIMEOUT_SECONDS = "ProcessTimeoutSeconds";

    private static final Logger LOGGER = Logger.getLogger(BridgeSettingsLoader.class.getName());

    private final Map<String, String> systemProperties;
    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public BridgeSettingsLoader() {
        this(System.getProperties(), System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    public BridgeSettingsLoader(Properties systemProperties, Map<String, String> environment, Dotenv dotenv) {
        this.systemProperties = copyStrings(Objects.requireNonNull(systemProperties, "systemProperties"));
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public BridgeSettings load() {
        BridgeSettings defaults = BridgeSettings.defaults();
        return new BridgeSettings(
                readBoolean(SHOW_BROWSER_WINDOW, defaults.showBrowserWindow()),
                readBoolean(DELETE_TEMP_FILES_WHEN_FINISHED, defaults.deleteTempFilesWhenFinished()),
                OutputTarget.parse(resolveWithPriority(FAILURE_STREAM), defaults.failureStream()),
                OutputTarget.parse(resolveWithPriority(SUCCESS_STREAM), defaults.successStream()),
                readBoolean(FAIL_MESSAGE_FROM_TEST_OUTPUT, defaults.failMessageFromTestOutput()),
                readString(INTERPRETER_COMMAND, defaults.interpreterCommand()),
                readString(DISPLAY_SUPPRESSION_FLAG, defaults.displaySuppressionFlag()),
                readTimeout(defaults.processTimeout()));
    }

    private boolean readBoolean(String key, boolean defaultValue) {
        String value = trimToNull(resolveWithPriority(key));
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        fallback(key, value, defaultValue);
        return defaultValue;
    }

    private String readString(String key, String defaultValue) {
        String value = trimToNull(resolveWithPriority(key));
        return value == null ? defaultValue : value;
    }

    private Duration readTimeout(Duration defaultValue) {
        String value = trimToNull(resolveWithPriority(PROCESS_TIMEOUT_SECONDS));
        if (value == null) {
            return defaultValue;
        }
        try {
            // int に収まらない値は既定値に戻す
            int seconds = Integer.parseInt(value);
            if (seconds >= 0) {
                return Duration.ofSeconds(seconds);
            }
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.FINEST, "数値として解釈できません", ex);
        }
        fallback(PROCESS_TIMEOUT_SECONDS, value, defaultValue);
        return defaultValue;
    }

    private String resolveWithPriority(String key) {
        if (systemProperties.containsKey(key)) {
            return systemProperties.get(key);
        }
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static void fallback(String key, String value, Object defaultValue) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(key + " の値を解釈できないためデフォルトを使用します: " + value + " -> " + defaultValue);
        }
    }

    private static Map<String, String> copyStrings(Properties properties) {
        Map<String, String> copy = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            copy.put(name, properties.getProperty(name));
        }
        return Map.copyOf(copy);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
