package io.github.hide212131.scripttest.runtime.descriptor;

import io.github.hide212131.scripttest.runtime.BridgeConfigurationException;
import io.github.hide212131.scripttest.runtime.MissingDescriptorException;
import io.github.hide212131.scripttest.runtime.resource.ClassResourceOrigin;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * テストメソッドに付与されたアノテーションから記述子を解決する。
 */
public final class AnnotationDescriptorResolver implements DescriptorResolver<Method> {

    @Override
    public ResolvedScriptTest resolve(Method caller) {
        Objects.requireNonNull(caller, "caller");
        List<ScriptTestDescriptor> candidates = new ArrayList<>();
        for (ScriptTest test : caller.getAnnotationsByType(ScriptTest.class)) {
            candidates.add(new ScriptTestDescriptor(test.script(), test.method(), test.origin(), TestVariant.PLAIN));
        }
        for (SuppressibleScriptTest test : caller.getAnnotationsByType(SuppressibleScriptTest.class)) {
            candidates.add(new ScriptTestDescriptor(test.script(), test.method(), test.origin(),
                    TestVariant.SUPPRESSIBLE));
        }
        if (candidates.isEmpty()) {
            throw new MissingDescriptorException(
                    "@ScriptTest が付与されていないメソッドから呼び出されました: " + qualifiedName(caller));
        }
        if (candidates.size() > 1) {
            throw new BridgeConfigurationException(
                    "1 つのメソッドに付与できる @ScriptTest / @SuppressibleScriptTest は 1 つだけです: "
                            + qualifiedName(caller));
        }
        List<SupportFileDescriptor> supportFiles = new ArrayList<>();
        for (SupportFile supportFile : caller.getAnnotationsByType(SupportFile.class)) {
            supportFiles.add(new SupportFileDescriptor(supportFile.source(), supportFile.target(),
                    supportFile.origin()));
        }
        return new ResolvedScriptTest(candidates.get(0), supportFiles,
                new ClassResourceOrigin(caller.getDeclaringClass()));
    }

    private static String qualifiedName(Method method) {
        return method.getDeclaringClass().getName() + "#" + method.getName();
    }
}
