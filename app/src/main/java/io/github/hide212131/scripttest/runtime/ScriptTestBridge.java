package io.github.hide212131.scripttest.runtime;

import io.github.hide212131.scripttest.infra.config.BridgeSettings;
import io.github.hide212131.scripttest.infra.config.OutputTarget;
import io.github.hide212131.scripttest.infra.logging.BridgeLog;
import io.github.hide212131.scripttest.runtime.descriptor.AnnotationDescriptorResolver;
import io.github.hide212131.scripttest.runtime.descriptor.DescriptorResolver;
import io.github.hide212131.scripttest.runtime.descriptor.ResolvedScriptTest;
import io.github.hide212131.scripttest.runtime.descriptor.ScriptTestDescriptor;
import io.github.hide212131.scripttest.runtime.descriptor.SupportFileDescriptor;
import io.github.hide212131.scripttest.runtime.execution.InterpreterProcessRunner;
import io.github.hide212131.scripttest.runtime.execution.ProcessRunner;
import io.github.hide212131.scripttest.runtime.result.ScriptTestResult;
import io.github.hide212131.scripttest.runtime.result.ScriptTestResultParser;
import io.github.hide212131.scripttest.runtime.sandbox.ResourceExtractor;
import io.github.hide212131.scripttest.runtime.sandbox.Sandbox;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * 外部スクリプトのテストを 1 件実行し、結果を JUnit のテスト結果として扱えるようにする。
 *
 * <p>
 * 実行順序は、記述子の解決、サンドボックス作成、スクリプト展開、補助ファイル展開、インタプリタ実行、
 * 出力の解析、サマリ出力、アサーション、後片付けの順。後片付けは例外の有無にかかわらず必ず行う。
 * 結果を得る前に発生した例外はそのまま呼び出し元へ送出し、失敗したテスト結果は例外にしない
 * （{@code makeAssertions} の場合のみ {@link AssertionSink} で失敗を通知する）。
 * </p>
 */
public final class ScriptTestBridge {

    static final String SCRIPT_FILE_PREFIX = "__ScriptTest";

    private final BridgeSettings settings;
    private final ProcessRunner processRunner;
    private final AssertionSink assertionSink;
    private final DescriptorResolver<Method> methodResolver;
    private final PrintStream out;
    private final PrintStream err;
    private final BridgeLog log;

    @SuppressWarnings("checkstyle:ParameterNumber")
    public ScriptTestBridge(BridgeSettings settings, ProcessRunner processRunner, AssertionSink assertionSink,
            DescriptorResolver<Method> methodResolver, PrintStream out, PrintStream err, BridgeLog log) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
        this.assertionSink = Objects.requireNonNull(assertionSink, "assertionSink");
        this.methodResolver = Objects.requireNonNull(methodResolver, "methodResolver");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.log = Objects.requireNonNull(log, "log");
    }

    public static ScriptTestBridge withDefaults(BridgeSettings settings) {
        return new ScriptTestBridge(settings, InterpreterProcessRunner.from(settings), new JUnitAssertionSink(),
                new AnnotationDescriptorResolver(), System.out, System.err, BridgeLog.forClass(ScriptTestBridge.class));
    }

    public ScriptTestResult execute(Method caller) {
        return execute(caller, true, true);
    }

    public ScriptTestResult execute(Method caller, boolean makeAssertions, boolean displayOutput) {
        Objects.requireNonNull(caller, "caller");
        String callerName = caller.getDeclaringClass().getSimpleName() + "#" + caller.getName();
        log.debug(BridgePhase.RESOLVING.label(), null, callerName, "テスト記述子を解決します");
        ResolvedScriptTest resolved;
        try {
            resolved = methodResolver.resolve(caller);
        } catch (ScriptTestBridgeException ex) {
            log.error(BridgePhase.FAULTED.label(), null, callerName, "テスト記述子を解決できません", ex);
            throw ex;
        }
        return execute(resolved, makeAssertions, displayOutput);
    }

    public ScriptTestResult execute(ResolvedScriptTest resolved, boolean makeAssertions, boolean displayOutput) {
        Objects.requireNonNull(resolved, "resolved");
        ScriptTestDescriptor test = resolved.test();
        String script = test.scriptLocator();
        String name = test.testMethodName();
        Sandbox sandbox = Sandbox.create(!settings.deleteTempFilesWhenFinished());
        BridgePhase phase = BridgePhase.EXTRACTING;
        boolean completed = false;
        try {
            log.debug(phase.label(), script, name, "サンドボックスへ展開します: " + sandbox.basePath());
            ResourceExtractor extractor = new ResourceExtractor(sandbox.basePath());
            Path scriptPath = extractor.extract(resolved.scriptOrigin(), script,
                    sandbox.basePath().resolve(scriptFileName(script)));
            sandbox.track(scriptPath);
            for (SupportFileDescriptor supportFile : resolved.supportFiles()) {
                Path destination = supportFileDestination(sandbox, supportFile);
                sandbox.track(extractor.extract(resolved.originOf(supportFile), supportFile.sourceLocator(),
                        destination));
            }

            phase = BridgePhase.RUNNING;
            log.debug(phase.label(), script, name, "インタプリタを起動します: " + settings.interpreterCommand());
            String output = processRunner.run(scriptPath, name, test.variant(), sandbox.basePath(),
                    settings.suppressDisplay());

            phase = BridgePhase.PARSING;
            ScriptTestResult result = ScriptTestResultParser.parse(output);
            log.info(phase.label(), script, name,
                    String.format(Locale.ROOT, "tests=%d assertions=%d failures=%d errors=%d", result.testCount(),
                            result.assertionCount(), result.failureCount(), result.errorCount()));

            phase = BridgePhase.REPORTING;
            report(test, result, makeAssertions, displayOutput);
            completed = true;
            return result;
        } catch (ScriptTestBridgeException ex) {
            log.error(BridgePhase.FAULTED.label(), script, name, phase.label() + " で中断しました", ex);
            throw ex;
        } finally {
            log.debug(BridgePhase.CLEANING_UP.label(), script, name,
                    sandbox.retain() ? "サンドボックスを保持します" : "サンドボックスを削除します");
            sandbox.close();
            if (completed) {
                log.debug(BridgePhase.DONE.label(), script, name, "完了しました");
            }
        }
    }

    public BridgeSettings settings() {
        return settings;
    }

    private void report(ScriptTestDescriptor test, ScriptTestResult result, boolean makeAssertions,
            boolean displayOutput) {
        String description = test.describe();
        if (displayOutput && !result.rawMessage().isEmpty()) {
            OutputTarget target = result.success() ? settings.successStream() : settings.failureStream();
            target.select(out, err).ifPresent(stream -> {
                stream.println(ResultSummaryFormatter.summary(description, result));
                stream.flush();
            });
        }
        if (makeAssertions) {
            assertionSink.check(result.success(), ResultSummaryFormatter.failureMessage(description, result,
                    settings.failMessageFromTestOutput()));
        }
    }

    private static Path supportFileDestination(Sandbox sandbox, SupportFileDescriptor supportFile) {
        try {
            return sandbox.basePath().resolve(supportFile.targetRelativePath());
        } catch (InvalidPathException ex) {
            throw new ResourceExtractionException("補助ファイルの展開先が不正です: " + supportFile.targetRelativePath(), ex);
        }
    }

    static String scriptFileName(String scriptLocator) {
        String normalized = scriptLocator.replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return SCRIPT_FILE_PREFIX;
        }
        return SCRIPT_FILE_PREFIX + fileName.substring(dot);
    }
}
