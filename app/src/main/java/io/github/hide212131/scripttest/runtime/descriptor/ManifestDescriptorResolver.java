package io.github.hide212131.scripttest.runtime.descriptor;

import io.github.hide212131.scripttest.runtime.MissingDescriptorException;
import io.github.hide212131.scripttest.runtime.resource.ResourceOrigin;
import java.util.Objects;

/**
 * manifest のテスト ID から記述子を解決する。
 */
public final class ManifestDescriptorResolver implements DescriptorResolver<String> {

    private final ScriptTestManifest manifest;
    private final ResourceOrigin defaultOrigin;

    public ManifestDescriptorResolver(ScriptTestManifest manifest, ResourceOrigin defaultOrigin) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.defaultOrigin = Objects.requireNonNull(defaultOrigin, "defaultOrigin");
    }

    @Override
    public ResolvedScriptTest resolve(String testId) {
        Objects.requireNonNull(testId, "testId");
        ScriptTestManifest.Entry entry = manifest.find(testId)
                .orElseThrow(() -> new MissingDescriptorException("manifest にテストが定義されていません: " + testId));
        return new ResolvedScriptTest(entry.test(), entry.supportFiles(), defaultOrigin);
    }
}
