package io.github.hide212131.scripttest.runtime.descriptor;

/**
 * 呼び出し元の識別子から、実行するテスト記述子と補助ファイルを解決する。
 *
 * @param <K> 呼び出し元の識別子の型
 */
@FunctionalInterface
public interface DescriptorResolver<K> {

    /**
     * @throws io.github.hide212131.scripttest.runtime.MissingDescriptorException テスト記述子がない場合
     * @throws io.github.hide212131.scripttest.runtime.BridgeConfigurationException テスト記述子が複数ある場合
     */
    ResolvedScriptTest resolve(K caller);
}
