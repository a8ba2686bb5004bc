package io.github.hide212131.scripttest.runtime;

import org.junit.jupiter.api.Assertions;

/**
 * JUnit Jupiter の {@link Assertions#assertTrue(boolean, String)} で失敗を通知する。
 */
public final class JUnitAssertionSink implements AssertionSink {

    @Override
    public void check(boolean condition, String message) {
        Assertions.assertTrue(condition, message);
    }
}
