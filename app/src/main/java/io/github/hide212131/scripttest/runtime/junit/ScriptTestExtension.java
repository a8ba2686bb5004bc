package io.github.hide212131.scripttest.runtime.junit;

import io.github.hide212131.scripttest.infra.config.BridgeSettingsLoader;
import io.github.hide212131.scripttest.runtime.ScriptTestBridge;
import java.util.Objects;
import java.util.function.Supplier;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

/**
 * テストメソッドの {@link BoundScriptTest} 引数を解決する JUnit 拡張。
 * ブリッジは拡張インスタンスごとに 1 度だけ生成し、ルートの {@link ExtensionContext.Store} に保持する。
 */
public final class ScriptTestExtension implements ParameterResolver {

    private final Supplier<ScriptTestBridge> bridgeFactory;

    public ScriptTestExtension() {
        this(() -> ScriptTestBridge.withDefaults(new BridgeSettingsLoader().load()));
    }

    public ScriptTestExtension(Supplier<ScriptTestBridge> bridgeFactory) {
        this.bridgeFactory = Objects.requireNonNull(bridgeFactory, "bridgeFactory");
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return parameterContext.getParameter().getType() == BoundScriptTest.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        if (extensionContext.getTestMethod().isEmpty()) {
            throw new ParameterResolutionException("BoundScriptTest はテストメソッドの引数としてのみ解決できます");
        }
        ExtensionContext.Store store = extensionContext.getRoot()
                .getStore(ExtensionContext.Namespace.create(ScriptTestExtension.class, this));
        ScriptTestBridge bridge = store.getOrComputeIfAbsent(ScriptTestBridge.class, key -> bridgeFactory.get(),
                ScriptTestBridge.class);
        return new BoundScriptTest(bridge, extensionContext.getRequiredTestMethod());
    }
}
