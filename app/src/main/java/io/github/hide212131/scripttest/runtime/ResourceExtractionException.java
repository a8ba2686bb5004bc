package io.github.hide212131.scripttest.runtime;

/**
 * スクリプトや補助ファイルをサンドボックスへ展開できなかった場合の例外。
 */
public class ResourceExtractionException extends ScriptTestBridgeException {

    public ResourceExtractionException(String message) {
        super(message);
    }

    public ResourceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
