package io.github.hide212131.scripttest.runtime.descriptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * テスト ID と記述子の対応表。
 */
public final class ScriptTestManifest {

    private final Map<String, Entry> entries;

    public ScriptTestManifest(Map<String, Entry> entries) {
        Objects.requireNonNull(entries, "entries");
        this.entries = new LinkedHashMap<>(entries);
    }

    public Optional<Entry> find(String testId) {
        return Optional.ofNullable(entries.get(testId));
    }

    public List<String> testIds() {
        return List.copyOf(entries.keySet());
    }

    public record Entry(ScriptTestDescriptor test, List<SupportFileDescriptor> supportFiles) {

        public Entry {
            Objects.requireNonNull(test, "test");
            supportFiles = List.copyOf(Objects.requireNonNull(supportFiles, "supportFiles"));
        }
    }
}
