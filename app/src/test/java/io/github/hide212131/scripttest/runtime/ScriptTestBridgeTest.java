package io.github.hide212131.scripttest.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.scripttest.infra.config.BridgeSettings;
import io.github.hide212131.scripttest.infra.config.OutputTarget;
import io.github.hide212131.scripttest.infra.logging.BridgeLog;
import io.github.hide212131.scripttest.runtime.descriptor.AnnotationDescriptorResolver;
import io.github.hide212131.scripttest.runtime.descriptor.ScriptTest;
import io.github.hide212131.scripttest.runtime.descriptor.SupportFile;
import io.github.hide212131.scripttest.runtime.descriptor.SuppressibleScriptTest;
import io.github.hide212131.scripttest.runtime.descriptor.TestVariant;
import io.github.hide212131.scripttest.runtime.execution.ProcessRunner;
import io.github.hide212131.scripttest.runtime.result.ScriptTestResult;
import io.github.hide212131.scripttest.runtime.result.ScriptTestResultParser;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@SuppressWarnings({ "PMD.JUnitTestContainsTooManyAsserts", "PMD.TooManyMethods" })
class ScriptTestBridgeTest {

    private static final String VALID_OUTPUT = "Loaded suite __ScriptTest\n1 tests, 1 assertions, 0 failures, 0 errors\n";
    private static final String FAILED_OUTPUT = "1) Failure: test_Invalid\n1 tests, 1 assertions, 1 failures, 0 errors\n";
    private static final String SCRIPT = "scripts/BridgeTest.sh";
    private static final String SCRIPT_RESOURCE = "/io/github/hide212131/scripttest/runtime/scripts/BridgeTest.sh";
    private static final String SANDBOX_MESSAGE = "サンドボックスへ展開します: ";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final RecordingSink sink = new RecordingSink();
    private final List<String> logMessages = new ArrayList<>();
    private BridgeLog log;

    @BeforeEach
    void setUp() {
        Logger logger = Logger.getLogger("script-test-bridge-" + UUID.randomUUID());
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        logger.addHandler(new Handler() {
            @Override
            public void publish(LogRecord logRecord) {
                logMessages.add(logRecord.getMessage());
            }

            @Override
            public void flush() {
                // メモリ上に保持するだけ
            }

            @Override
            public void close() {
                logMessages.clear();
            }
        });
        log = new BridgeLog(logger);
    }

    @Test
    @DisplayName("成功したテストはサマリを標準出力へ出し、成功としてアサートし、サンドボックスを削除する")
    void successfulRunReportsAndCleansUp() throws IOException {
        RecordingRunner runner = new RecordingRunner(VALID_OUTPUT);

        ScriptTestResult result = bridge(BridgeSettings.defaults(), runner).execute(method("valid"));

        assertThat(result.success()).isTrue();
        assertThat(result.testCount()).isEqualTo(1);
        assertThat(runner.scriptPath.getFileName().toString()).isEqualTo("__ScriptTest.sh");
        assertThat(runner.scriptPath.getParent()).isEqualTo(runner.workingDirectory);
        assertThat(runner.scriptBytes).isEqualTo(resourceBytes(SCRIPT_RESOURCE));
        assertThat(runner.testMethodName).isEqualTo("test_Valid");
        assertThat(runner.variant).isEqualTo(TestVariant.PLAIN);
        assertThat(runner.workingDirectory).doesNotExist();
        assertThat(sink.conditions).containsExactly(true);
        assertThat(out.toString(StandardCharsets.UTF_8))
                .startsWith("Script [scripts/BridgeTest.sh]; Test [test_Valid]: SUCCESS")
                .contains("1 tests, 1 assertions, 0 failures, 0 errors")
                .contains("----------");
        assertThat(err.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(logMessages).anyMatch(message -> message.contains("[phase=done]"));
    }

    @Test
    @DisplayName("\\ 区切りのスクリプトも展開して実行する")
    void backslashScriptLocatorIsExtracted() throws IOException {
        RecordingRunner runner = new RecordingRunner(VALID_OUTPUT);

        ScriptTestResult result = bridge(BridgeSettings.defaults(), runner).execute(method("backslashScript"));

        assertThat(result.success()).isTrue();
        assertThat(runner.scriptPath.getFileName().toString()).isEqualTo("__ScriptTest.sh");
        assertThat(runner.scriptBytes).isEqualTo(resourceBytes(SCRIPT_RESOURCE));
    }

    @Test
    @DisplayName("補助ファイルは実行前に宣言されたパスへ展開される")
    void supportFilesAreInPlaceBeforeRun() {
        RecordingRunner runner = new RecordingRunner(VALID_OUTPUT);

        bridge(BridgeSettings.defaults(), runner).execute(method("withSupportFiles"));

        assertThat(runner.filesAtRun).containsEntry("supportfile.txt", "root support\n")
                .containsEntry("SubFolder1/supportfile1.txt", "first level\n")
                .containsEntry("SubFolder1/SubFolder2/supportfile2.txt", "second level\n");
        assertThat(runner.workingDirectory).doesNotExist();
    }

    @Test
    @DisplayName("失敗したテストは出力を含むメッセージでアサーション失敗を通知する")
    void failedRunAssertsWithOutput() {
        ScriptTestResult result = bridge(BridgeSettings.defaults(), new RecordingRunner(FAILED_OUTPUT))
                .execute(method("valid"));

        assertThat(result.success()).isFalse();
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(sink.conditions).containsExactly(false);
        assertThat(sink.messages).containsExactly("Script [scripts/BridgeTest.sh]; Test [test_Valid]: FAILED\n"
                + FAILED_OUTPUT + "\n----------\n");
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(err.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    @DisplayName("FailMessageFromTestOutput が false ならメッセージに出力を含めない")
    void failureMessageWithoutOutput() {
        BridgeSettings settings = new BridgeSettings(false, true, OutputTarget.ERROR, OutputTarget.OUT, false,
                "sh", "-b", Duration.ZERO);

        bridge(settings, new RecordingRunner(FAILED_OUTPUT)).execute(method("valid"));

        assertThat(sink.messages).containsExactly("Script [scripts/BridgeTest.sh]; Test [test_Valid]: FAILED");
        assertThat(err.toString(StandardCharsets.UTF_8))
                .startsWith("Script [scripts/BridgeTest.sh]; Test [test_Valid]: FAILED");
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    @DisplayName("makeAssertions と displayOutput が false なら通知も出力もしない")
    void silentExecution() {
        ScriptTestResult result = bridge(BridgeSettings.defaults(), new RecordingRunner(FAILED_OUTPUT))
                .execute(method("valid"), false, false);

        assertThat(result.success()).isFalse();
        assertThat(sink.conditions).isEmpty();
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    @DisplayName("解析できない出力はエラー 1 件の結果として返し、例外にしない")
    void unparseableOutputBecomesFailSafeResult() {
        ScriptTestResult result = bridge(BridgeSettings.defaults(), new RecordingRunner("segmentation fault"))
                .execute(method("valid"), false, true);

        assertThat(result.testCount()).isEqualTo(1);
        assertThat(result.assertionCount()).isZero();
        assertThat(result.failureCount()).isZero();
        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(result.rawMessage()).isEqualTo(ScriptTestResultParser.UNPARSEABLE_PREFIX + "segmentation fault");
    }

    @Test
    @DisplayName("空の出力も解析できない結果として失敗側へ出力する")
    void emptyOutputIsReportedAsFailure() {
        BridgeSettings settings = BridgeSettings.defaults().withStreams(OutputTarget.ERROR, OutputTarget.OUT);

        ScriptTestResult result = bridge(settings, new RecordingRunner("")).execute(method("valid"), false, true);

        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Unable to parse output");
    }

    @Test
    @DisplayName("SuppressibleScriptTest は表示抑止の指定とともに実行される")
    void suppressibleVariantPassesDisplaySetting() {
        RecordingRunner runner = new RecordingRunner(VALID_OUTPUT);
        BridgeSettings shown = new BridgeSettings(true, true, OutputTarget.NONE, OutputTarget.NONE, true, "sh",
                "-b", Duration.ZERO);

        bridge(BridgeSettings.defaults(), runner).execute(method("suppressible"));
        assertThat(runner.variant).isEqualTo(TestVariant.SUPPRESSIBLE);
        assertThat(runner.suppressDisplay).isTrue();

        bridge(shown, runner).execute(method("suppressible"));
        assertThat(runner.suppressDisplay).isFalse();
    }

    @Test
    @DisplayName("DeleteTempFilesWhenFinished が false ならサンドボックスを残す")
    void retainsSandboxWhenConfigured() throws IOException {
        RecordingRunner runner = new RecordingRunner(VALID_OUTPUT);
        try {
            bridge(BridgeSettings.defaults().withDeleteTempFilesWhenFinished(false), runner)
                    .execute(method("withSupportFiles"));

            assertThat(runner.workingDirectory.resolve("__ScriptTest.sh")).exists();
            assertThat(runner.workingDirectory.resolve("SubFolder1/SubFolder2/supportfile2.txt")).exists();
        } finally {
            deleteRecursively(runner.workingDirectory);
        }
    }

    @Test
    @DisplayName("補助ファイルの展開に失敗したら実行せず、展開済みのファイルも削除する")
    void extractionFailureCleansUpPartialSandbox() {
        RecordingRunner runner = new RecordingRunner(VALID_OUTPUT);
        ScriptTestBridge bridge = bridge(BridgeSettings.defaults(), runner);

        assertThatThrownBy(() -> bridge.execute(method("escapingSupportFile")))
                .isInstanceOf(ResourceExtractionException.class);
        assertThatThrownBy(() -> bridge.execute(method("missingSupportFile")))
                .isInstanceOf(ResourceExtractionException.class)
                .hasMessageContaining("scripts/missing.txt");

        assertThat(runner.calls).isZero();
        assertThat(sink.conditions).isEmpty();
        assertThat(sandboxesFromLog()).hasSize(2).allSatisfy(sandbox -> assertThat(sandbox).doesNotExist());
        assertThat(logMessages).anyMatch(message -> message.contains("[phase=faulted]"))
                .noneMatch(message -> message.contains("[phase=done]"));
    }

    @Test
    @DisplayName("プロセス起動の失敗は送出し、サンドボックスを削除する")
    void processFailurePropagates() {
        ProcessRunner failing = (script, name, variant, workingDirectory, suppress) -> {
            throw new ProcessInvocationException("cannot start");
        };

        assertThatThrownBy(() -> bridge(BridgeSettings.defaults(), failing).execute(method("valid")))
                .isInstanceOf(ProcessInvocationException.class);
        assertThat(sandboxesFromLog()).singleElement().satisfies(sandbox -> assertThat(sandbox).doesNotExist());
    }

    @Test
    @DisplayName("記述子がない、または複数あるメソッドからは実行しない")
    void rejectsInvalidDescriptors() {
        RecordingRunner runner = new RecordingRunner(VALID_OUTPUT);
        ScriptTestBridge bridge = bridge(BridgeSettings.defaults(), runner);

        assertThatThrownBy(() -> bridge.execute(method("notAScriptTest")))
                .isInstanceOf(MissingDescriptorException.class);
        assertThatThrownBy(() -> bridge.execute(method("bothKinds")))
                .isInstanceOf(BridgeConfigurationException.class);
        assertThat(runner.calls).isZero();
        assertThat(sandboxesFromLog()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "scripts/RubyTest.rb, __ScriptTest.rb",
            "scripts\\nested\\WatirTest.rb, __ScriptTest.rb",
            "BridgeTest.sh, __ScriptTest.sh",
            "scripts/archive.tar.gz, __ScriptTest.gz",
            "scripts/noext, __ScriptTest",
            "scripts.d/noext, __ScriptTest",
            "scripts/.hidden, __ScriptTest",
            "scripts/trailing., __ScriptTest"
    })
    @DisplayName("スクリプトの展開名は __ScriptTest に元の拡張子を付ける")
    void scriptFileNameKeepsExtension(String locator, String expected) {
        assertThat(ScriptTestBridge.scriptFileName(locator)).isEqualTo(expected);
    }

    private ScriptTestBridge bridge(BridgeSettings settings, ProcessRunner runner) {
        return new ScriptTestBridge(settings, runner, sink, new AnnotationDescriptorResolver(),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8),
                log);
    }

    private List<Path> sandboxesFromLog() {
        List<Path> sandboxes = new ArrayList<>();
        for (String message : logMessages) {
            int index = message.indexOf(SANDBOX_MESSAGE);
            if (index >= 0) {
                sandboxes.add(Path.of(message.substring(index + SANDBOX_MESSAGE.length()).trim()));
            }
        }
        return sandboxes;
    }

    private static Method method(String name) {
        try {
            return Fixtures.class.getDeclaredMethod(name);
        } catch (NoSuchMethodException ex) {
            throw new IllegalStateException(ex);
        }
    }

    private static byte[] resourceBytes(String resource) throws IOException {
        try (InputStream input = ScriptTestBridgeTest.class.getResourceAsStream(resource)) {
            assertThat(input).isNotNull();
            return input.readAllBytes();
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }

    private static final class RecordingSink implements AssertionSink {

        private final List<Boolean> conditions = new ArrayList<>();
        private final List<String> messages = new ArrayList<>();

        @Override
        public void check(boolean condition, String message) {
            conditions.add(condition);
            if (!condition) {
                messages.add(message);
            }
        }
    }

    private static final class RecordingRunner implements ProcessRunner {

        private final String output;
        private final Map<String, String> filesAtRun = new ConcurrentHashMap<>();
        private int calls;
        private Path scriptPath;
        private byte[] scriptBytes;
        private String testMethodName;
        private TestVariant variant;
        private Path workingDirectory;
        private boolean suppressDisplay;

        private RecordingRunner(String output) {
            this.output = output;
        }

        @Override
        public String run(Path scriptPath, String testMethodName, TestVariant variant, Path workingDirectory,
                boolean suppressDisplay) {
            calls++;
            this.scriptPath = scriptPath;
            this.testMethodName = testMethodName;
            this.variant = variant;
            this.workingDirectory = workingDirectory;
            this.suppressDisplay = suppressDisplay;
            try {
                scriptBytes = Files.readAllBytes(scriptPath);
                try (Stream<Path> files = Files.walk(workingDirectory)) {
                    for (Path file : files.filter(Files::isRegularFile).toList()) {
                        String relative = workingDirectory.relativize(file).toString().replace('\\', '/');
                        filesAtRun.put(relative, Files.readString(file, StandardCharsets.UTF_8));
                    }
                }
            } catch (IOException ex) {
                throw new IllegalStateException(ex);
            }
            return output;
        }
    }

    @SuppressWarnings("unused")
    static final class Fixtures {

        @ScriptTest(script = SCRIPT, method = "test_Valid")
        void valid() {
        }

        @ScriptTest(script = "scripts\\BridgeTest.sh", method = "test_Valid")
        void backslashScript() {
        }

        @ScriptTest(script = SCRIPT, method = "test_SupportFile")
        @SupportFile(source = "scripts/supportfile.txt", target = "supportfile.txt")
        @SupportFile(source = "scripts/SubFolder1/supportfile1.txt", target = "SubFolder1\\supportfile1.txt")
        @SupportFile(source = "scripts/SubFolder1/SubFolder2/supportfile2.txt",
                target = "SubFolder1/SubFolder2/supportfile2.txt")
        void withSupportFiles() {
        }

        @ScriptTest(script = SCRIPT, method = "test_Valid")
        @SupportFile(source = "scripts/supportfile.txt", target = "supportfile.txt")
        @SupportFile(source = "scripts/supportfile.txt", target = "../escape.txt")
        void escapingSupportFile() {
        }

        @ScriptTest(script = SCRIPT, method = "test_Valid")
        @SupportFile(source = "scripts/supportfile.txt", target = "supportfile.txt")
        @SupportFile(source = "scripts/missing.txt", target = "missing.txt")
        void missingSupportFile() {
        }

        @SuppressibleScriptTest(script = SCRIPT, method = "test_Browser")
        void suppressible() {
        }

        @ScriptTest(script = SCRIPT, method = "test_Valid")
        @SuppressibleScriptTest(script = SCRIPT, method = "test_Valid")
        void bothKinds() {
        }

        void notAScriptTest() {
        }
    }
}
