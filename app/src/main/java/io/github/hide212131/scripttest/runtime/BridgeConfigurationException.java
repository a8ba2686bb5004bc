package io.github.hide212131.scripttest.runtime;

/**
 * テスト記述子の指定が不正な場合の例外。1 メソッドに複数のテスト記述子がある場合などに送出する。
 */
public class BridgeConfigurationException extends ScriptTestBridgeException {

    public BridgeConfigurationException(String message) {
        super(message);
    }

    public BridgeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
