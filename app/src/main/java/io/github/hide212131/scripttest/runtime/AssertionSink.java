package io.github.hide212131.scripttest.runtime;

/**
 * ホストのテストフレームワークへ成否を通知する。
 */
@FunctionalInterface
public interface AssertionSink {

    void check(boolean condition, String message);
}
