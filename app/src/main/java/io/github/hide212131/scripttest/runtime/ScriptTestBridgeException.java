package io.github.hide212131.scripttest.runtime;

/**
 * テスト結果を得る前にブリッジ実行が中断された場合の例外の基底。
 */
public class ScriptTestBridgeException extends RuntimeException {

    public ScriptTestBridgeException(String message) {
        super(message);
    }

    public ScriptTestBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
