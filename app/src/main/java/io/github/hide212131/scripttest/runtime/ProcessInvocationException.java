package io.github.hide212131.scripttest.runtime;

/**
 * 外部インタプリタを起動できない、または待機を完了できない場合の例外。
 */
public class ProcessInvocationException extends ScriptTestBridgeException {

    public ProcessInvocationException(String message) {
        super(message);
    }

    public ProcessInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
