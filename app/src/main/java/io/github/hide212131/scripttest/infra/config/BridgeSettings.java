package io.github.hide212131.scripttest.infra.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ブリッジ実行 1 回分の設定スナップショット。
 *
 * @param showBrowserWindow 表示抑止フラグを付けずに実行するか
 * @param deleteTempFilesWhenFinished 実行後にサンドボックスを削除するか
 * @param failureStream 失敗サマリの出力先
 * @param successStream 成功サマリの出力先
 * @param failMessageFromTestOutput アサーションメッセージにテスト出力を含めるか
 * @param interpreterCommand 外部インタプリタのコマンド
 * @param displaySuppressionFlag 表示抑止時に付与する引数
 * @param processTimeout プロセス待機の上限。{@link Duration#ZERO} は無制限
 */
public record BridgeSettings(boolean showBrowserWindow, boolean deleteTempFilesWhenFinished,
        OutputTarget failureStream, OutputTarget successStream, boolean failMessageFromTestOutput,
        String interpreterCommand, String displaySuppressionFlag, Duration processTimeout) {

    public static final String DEFAULT_INTERPRETER = "ruby";
    public static final String DEFAULT_SUPPRESSION_FLAG = "-b";

    public BridgeSettings {
        Objects.requireNonNull(failureStream, "failureStream");
        Objects.requireNonNull(successStream, "successStream");
        Objects.requireNonNull(interpreterCommand, "interpreterCommand");
        Objects.requireNonNull(displaySuppressionFlag, "displaySuppressionFlag");
        Objects.requireNonNull(processTimeout, "processTimeout");
        if (interpreterCommand.isBlank()) {
            throw new IllegalArgumentException("interpreterCommand は空にできません");
        }
        if (processTimeout.isNegative()) {
            throw new IllegalArgumentException("processTimeout は 0 以上である必要があります: " + processTimeout);
        }
    }

    public static BridgeSettings defaults() {
        return new BridgeSettings(false, true, OutputTarget.NONE, OutputTarget.OUT, true, DEFAULT_INTERPRETER,
                DEFAULT_SUPPRESSION_FLAG, Duration.ZERO);
    }

    public boolean suppressDisplay() {
        return !showBrowserWindow;
    }

    public boolean hasTimeout() {
        return !processTimeout.isZero();
    }

    public BridgeSettings withInterpreterCommand(String command) {
        return new BridgeSettings(showBrowserWindow, deleteTempFilesWhenFinished, failureStream, successStream,
                failMessageFromTestOutput, command, displaySuppressionFlag, processTimeout);
    }

    public BridgeSettings withDeleteTempFilesWhenFinished(boolean delete) {
        return new BridgeSettings(showBrowserWindow, delete, failureStream, successStream,
                failMessageFromTestOutput, interpreterCommand, displaySuppressionFlag, processTimeout);
    }

    public BridgeSettings withStreams(OutputTarget failure, OutputTarget success) {
        return new BridgeSettings(showBrowserWindow, deleteTempFilesWhenFinished, failure, success,
                failMessageFromTestOutput, interpreterCommand, displaySuppressionFlag, processTimeout);
    }

    public BridgeSettings withProcessTimeout(Duration timeout) {
        return new BridgeSettings(showBrowserWindow, deleteTempFilesWhenFinished, failureStream, successStream,
                failMessageFromTestOutput, interpreterCommand, displaySuppressionFlag, timeout);
    }
}
