package io.github.hide212131.scripttest.app.cli;

import io.github.hide212131.scripttest.infra.config.BridgeSettings;
import io.github.hide212131.scripttest.infra.config.BridgeSettingsLoader;
import io.github.hide212131.scripttest.runtime.ScriptTestBridge;
import io.github.hide212131.scripttest.runtime.ScriptTestBridgeException;
import io.github.hide212131.scripttest.runtime.descriptor.ManifestDescriptorResolver;
import io.github.hide212131.scripttest.runtime.descriptor.ResolvedScriptTest;
import io.github.hide212131.scripttest.runtime.descriptor.ScriptTestManifest;
import io.github.hide212131.scripttest.runtime.descriptor.ScriptTestManifestLoader;
import io.github.hide212131.scripttest.runtime.resource.DirectoryResourceOrigin;
import io.github.hide212131.scripttest.runtime.result.ScriptTestResult;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * manifest に定義したスクリプトテストをテストランナーの外から実行する CLI。
 */
@Command(name = "script-test", mixinStandardHelpOptions = true,
        description = "Run externally scripted unit tests declared in a manifest")
public final class ScriptTestCliApp implements Runnable {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_TEST_FAILED = 1;
    static final int EXIT_BRIDGE_FAULT = 2;

    public static void main(String[] args) {
        int exitCode = commandLineInstance().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance() {
        return commandLineInstance(() -> new BridgeSettingsLoader().load());
    }

    static CommandLine commandLineInstance(Supplier<BridgeSettings> settingsSupplier) {
        CommandLine cmd = new CommandLine(new ScriptTestCliApp());
        cmd.addSubcommand("run", new RunCommand(settingsSupplier));
        return cmd;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    @Command(name = "run", description = "Run one test from a manifest")
    static final class RunCommand implements Callable<Integer> {

        @Option(names = "--manifest", required = true, description = "Path to the YAML manifest")
        Path manifest;

        @Option(names = "--test", required = true, description = "Test id defined in the manifest")
        String testId;

        @Option(names = "--resource-root", description = "Directory that scripts and support files are read from "
                + "(defaults to the manifest directory)")
        Path resourceRoot;

        @Option(names = "--interpreter", description = "Interpreter command (overrides InterpreterCommand)")
        String interpreter;

        @Option(names = "--keep-sandbox", description = "Keep the sandbox directory after the run")
        boolean keepSandbox;

        @Option(names = "--quiet", description = "Print only the result line")
        boolean quiet;

        @Spec
        CommandSpec commandSpec;

        private final Supplier<BridgeSettings> settingsSupplier;

        RunCommand(Supplier<BridgeSettings> settingsSupplier) {
            this.settingsSupplier = Objects.requireNonNull(settingsSupplier, "settingsSupplier");
        }

        @Override
        public Integer call() {
            PrintWriter out = commandSpec.commandLine().getOut();
            PrintWriter err = commandSpec.commandLine().getErr();
            try {
                ScriptTestManifest loaded = ScriptTestManifestLoader.load(manifest);
                Path root = resourceRoot != null ? resourceRoot : manifestDirectory();
                ResolvedScriptTest resolved = new ManifestDescriptorResolver(loaded, new DirectoryResourceOrigin(root))
                        .resolve(testId);
                ScriptTestResult result = ScriptTestBridge.withDefaults(settings()).execute(resolved, false, false);
                out.println(resultLine(resolved, result));
                if (!quiet && !result.rawMessage().isBlank()) {
                    out.println(result.rawMessage().strip());
                }
                out.flush();
                return result.success() ? EXIT_SUCCESS : EXIT_TEST_FAILED;
            } catch (ScriptTestBridgeException ex) {
                err.println("Error: " + ex.getMessage());
                err.flush();
                return EXIT_BRIDGE_FAULT;
            }
        }

        private BridgeSettings settings() {
            BridgeSettings settings = settingsSupplier.get();
            if (interpreter != null && !interpreter.isBlank()) {
                settings = settings.withInterpreterCommand(interpreter.trim());
            }
            if (keepSandbox) {
                settings = settings.withDeleteTempFilesWhenFinished(false);
            }
            return settings;
        }

        private Path manifestDirectory() {
            Path parent = manifest.toAbsolutePath().getParent();
            return parent != null ? parent : Path.of("").toAbsolutePath();
        }

        private static String resultLine(ResolvedScriptTest resolved, ScriptTestResult result) {
            return String.format(Locale.ROOT, "%s: %s (tests=%d, assertions=%d, failures=%d, errors=%d)",
                    resolved.test().describe(), result.success() ? "SUCCESS" : "FAILED", result.testCount(),
                    result.assertionCount(), result.failureCount(), result.errorCount());
        }
    }
}
