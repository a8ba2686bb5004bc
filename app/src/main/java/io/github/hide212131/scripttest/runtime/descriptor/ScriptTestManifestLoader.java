package io.github.hide212131.scripttest.runtime.descriptor;

import io.github.hide212131.scripttest.runtime.BridgeConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * YAML の manifest からテスト記述子を読み込む。
 *
 * <pre>
 * tests:
 *   ruby-valid:
 *     script: scripts/RubyTest.rb
 *     method: test_Valid
 *     variant: plain
 *     supportFiles:
 *       - source: scripts/supportfile.txt
 *         target: supportfile.txt
 * </pre>
 */
public final class ScriptTestManifestLoader {

    private ScriptTestManifestLoader() {
    }

    public static ScriptTestManifest load(Path manifestPath) {
        Objects.requireNonNull(manifestPath, "manifestPath");
        if (!Files.exists(manifestPath)) {
            throw new BridgeConfigurationException("manifest が見つかりません: " + manifestPath);
        }
        try (Reader reader = Files.newBufferedReader(manifestPath, StandardCharsets.UTF_8)) {
            return parse(reader, manifestPath.toString());
        } catch (IOException ex) {
            throw new BridgeConfigurationException("manifest の読み込みに失敗しました: " + manifestPath, ex);
        }
    }

    public static ScriptTestManifest load(Class<?> anchor, String resourceName) {
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(resourceName, "resourceName");
        InputStream stream = anchor.getResourceAsStream(resourceName);
        if (stream == null) {
            throw new BridgeConfigurationException("manifest リソースが見つかりません: " + resourceName);
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return parse(reader, resourceName);
        } catch (IOException ex) {
            throw new BridgeConfigurationException("manifest の読み込みに失敗しました: " + resourceName, ex);
        }
    }

    static ScriptTestManifest parse(Reader reader, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        Object loaded;
        try {
            loaded = yaml.load(reader);
        } catch (YAMLException ex) {
            throw new BridgeConfigurationException("manifest の形式が不正です: " + source + " (" + ex.getMessage() + ")",
                    ex);
        }
        if (!(loaded instanceof Map<?, ?> root)) {
            throw new BridgeConfigurationException("manifest の形式が不正です: " + source);
        }
        Object tests = root.get("tests");
        if (!(tests instanceof Map<?, ?> testMap)) {
            throw new BridgeConfigurationException("tests が未定義、またはマップではありません: " + source);
        }
        Map<String, ScriptTestManifest.Entry> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> test : testMap.entrySet()) {
            String testId = String.valueOf(test.getKey());
            if (!(test.getValue() instanceof Map<?, ?> definition)) {
                throw new BridgeConfigurationException("テスト定義はマップである必要があります: " + testId);
            }
            entries.put(testId, toEntry(testId, definition));
        }
        return new ScriptTestManifest(entries);
    }

    private static ScriptTestManifest.Entry toEntry(String testId, Map<?, ?> definition) {
        try {
            ScriptTestDescriptor descriptor = new ScriptTestDescriptor(text(definition, "script"),
                    text(definition, "method"), text(definition, "origin"),
                    TestVariant.parse(text(definition, "variant")));
            return new ScriptTestManifest.Entry(descriptor, supportFiles(testId, definition.get("supportFiles")));
        } catch (IllegalArgumentException ex) {
            throw new BridgeConfigurationException("テスト定義が不正です: " + testId + " (" + ex.getMessage() + ")", ex);
        }
    }

    private static List<SupportFileDescriptor> supportFiles(String testId, Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new BridgeConfigurationException("supportFiles は配列である必要があります: " + testId);
        }
        List<SupportFileDescriptor> results = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> supportFile)) {
                throw new BridgeConfigurationException("supportFiles の要素はマップである必要があります: " + testId);
            }
            results.add(new SupportFileDescriptor(text(supportFile, "source"), text(supportFile, "target"),
                    text(supportFile, "origin")));
        }
        return results;
    }

    private static String text(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value == null ? null : String.valueOf(value);
    }
}
