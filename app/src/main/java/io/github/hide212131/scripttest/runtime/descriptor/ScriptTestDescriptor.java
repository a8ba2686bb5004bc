package io.github.hide212131.scripttest.runtime.descriptor;

import java.util.Objects;
import java.util.Optional;

/**
 * 外部スクリプトで実装された 1 つのテストを表す。
 *
 * @param scriptLocator スクリプトのリソースパス
 * @param testMethodName インタプリタへ {@code --name=} として渡すテスト名
 * @param originReference リソースを取り出す origin。{@code null} は呼び出し元と同じ origin
 * @param variant テスト種別
 */
public record ScriptTestDescriptor(String scriptLocator, String testMethodName, String originReference,
        TestVariant variant) {

    public ScriptTestDescriptor {
        if (scriptLocator == null || scriptLocator.isBlank()) {
            throw new IllegalArgumentException("scriptLocator は空にできません");
        }
        if (testMethodName == null || testMethodName.isBlank()) {
            throw new IllegalArgumentException("testMethodName は空にできません");
        }
        Objects.requireNonNull(variant, "variant");
        if (originReference != null && originReference.isBlank()) {
            originReference = null;
        }
    }

    public static ScriptTestDescriptor plain(String scriptLocator, String testMethodName) {
        return new ScriptTestDescriptor(scriptLocator, testMethodName, null, TestVariant.PLAIN);
    }

    public static ScriptTestDescriptor suppressible(String scriptLocator, String testMethodName) {
        return new ScriptTestDescriptor(scriptLocator, testMethodName, null, TestVariant.SUPPRESSIBLE);
    }

    public Optional<String> origin() {
        return Optional.ofNullable(originReference);
    }

    public String describe() {
        return "Script [" + scriptLocator + "]; Test [" + testMethodName + "]";
    }
}
