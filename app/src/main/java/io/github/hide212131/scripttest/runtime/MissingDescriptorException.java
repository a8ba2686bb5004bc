package io.github.hide212131.scripttest.runtime;

/**
 * 呼び出し元にテスト記述子が見つからない場合の例外。
 */
public class MissingDescriptorException extends ScriptTestBridgeException {

    public MissingDescriptorException(String message) {
        super(message);
    }
}
