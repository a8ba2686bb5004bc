package io.github.hide212131.scripttest.runtime.execution;

import io.github.hide212131.scripttest.runtime.descriptor.TestVariant;
import java.nio.file.Path;

/**
 * 外部インタプリタでスクリプトテストを 1 件実行し、標準出力を返す。
 */
@FunctionalInterface
public interface ProcessRunner {

    /**
     * @param scriptPath サンドボックスへ展開したスクリプト
     * @param testMethodName {@code --name=} に渡すテスト名
     * @param variant テスト種別
     * @param workingDirectory 作業ディレクトリ（サンドボックスのルート）
     * @param suppressDisplay {@link TestVariant#SUPPRESSIBLE} の場合に表示抑止フラグを付けるか
     * @return 標準出力の全文。終了コードは結果の判定に使わない
     * @throws io.github.hide212131.scripttest.runtime.ProcessInvocationException 起動できない場合
     */
    String run(Path scriptPath, String testMethodName, TestVariant variant, Path workingDirectory,
            boolean suppressDisplay);
}
