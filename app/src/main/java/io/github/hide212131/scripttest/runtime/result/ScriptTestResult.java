package io.github.hide212131.scripttest.runtime.result;

/**
 * 外部スクリプトテストの実行結果。
 *
 * @param testCount 実行したテスト数（1 以上）
 * @param assertionCount アサーション数
 * @param failureCount 失敗数
 * @param errorCount エラー数
 * @param rawMessage インタプリタの出力
 */
public record ScriptTestResult(int testCount, int assertionCount, int failureCount, int errorCount,
        String rawMessage) {

    public ScriptTestResult {
        if (testCount < 1) {
            throw new IllegalArgumentException("testCount は 1 以上である必要があります: " + testCount);
        }
        if (assertionCount < 0) {
            throw new IllegalArgumentException("assertionCount は 0 以上である必要があります: " + assertionCount);
        }
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount は 0 以上である必要があります: " + failureCount);
        }
        if (errorCount < 0) {
            throw new IllegalArgumentException("errorCount は 0 以上である必要があります: " + errorCount);
        }
        if (rawMessage == null) {
            rawMessage = "";
        }
    }

    public boolean success() {
        return failureCount == 0 && errorCount == 0;
    }
}
