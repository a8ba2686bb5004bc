package io.github.hide212131.scripttest.runtime.execution;

import io.github.hide212131.scripttest.infra.config.BridgeSettings;
import io.github.hide212131.scripttest.runtime.ProcessInvocationException;
import io.github.hide212131.scripttest.runtime.descriptor.TestVariant;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * {@link ProcessBuilder} でインタプリタを起動する {@link ProcessRunner}。
 * 標準エラーはホストプロセスへそのまま流す。
 */
@SuppressWarnings("PMD.CloseResource")
public final class InterpreterProcessRunner implements ProcessRunner {

    static final String NAME_OPTION = "--name=";

    private static final Duration MAX_WAIT = Duration.ofMillis(Long.MAX_VALUE);
    private static final Logger LOGGER = Logger.getLogger(InterpreterProcessRunner.class.getName());

    private final String interpreterCommand;
    private final String displaySuppressionFlag;
    private final Duration timeout;

    public InterpreterProcessRunner(String interpreterCommand, String displaySuppressionFlag, Duration timeout) {
        this.interpreterCommand = Objects.requireNonNull(interpreterCommand, "interpreterCommand");
        this.displaySuppressionFlag = Objects.requireNonNull(displaySuppressionFlag, "displaySuppressionFlag");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public static InterpreterProcessRunner from(BridgeSettings settings) {
        Objects.requireNonNull(settings, "settings");
        return new InterpreterProcessRunner(settings.interpreterCommand(), settings.displaySuppressionFlag(),
                settings.processTimeout());
    }

    @Override
    public String run(Path scriptPath, String testMethodName, TestVariant variant, Path workingDirectory,
            boolean suppressDisplay) {
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        List<String> command = buildCommand(scriptPath, testMethodName, variant, suppressDisplay);
        String logicalCommand = String.join(" ", command);
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workingDirectory.toFile());
        builder.redirectError(ProcessBuilder.Redirect.INHERIT);
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new ProcessInvocationException("インタプリタの起動に失敗しました: " + logicalCommand, ex);
        }
        if (timeout.isZero()) {
            return runToCompletion(process, logicalCommand);
        }
        return runWithTimeout(process, logicalCommand);
    }

    List<String> buildCommand(Path scriptPath, String testMethodName, TestVariant variant, boolean suppressDisplay) {
        Objects.requireNonNull(scriptPath, "scriptPath");
        Objects.requireNonNull(testMethodName, "testMethodName");
        Objects.requireNonNull(variant, "variant");
        List<String> command = new ArrayList<>();
        command.add(interpreterCommand);
        command.add(scriptPath.toAbsolutePath().toString());
        command.add(NAME_OPTION + testMethodName);
        if (variant == TestVariant.SUPPRESSIBLE && suppressDisplay && !displaySuppressionFlag.isBlank()) {
            command.add(displaySuppressionFlag);
        }
        return List.copyOf(command);
    }

    private String runToCompletion(Process process, String logicalCommand) {
        String stdout;
        try {
            stdout = readStream(process.getInputStream());
        } catch (IOException ex) {
            destroyProcessTree(process);
            throw new ProcessInvocationException("標準出力の取得に失敗しました: " + logicalCommand, ex);
        }
        int exitCode = waitForProcess(process, logicalCommand);
        logExit(logicalCommand, exitCode);
        return stdout;
    }

    private String runWithTimeout(Process process, String logicalCommand) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> stdoutFuture = executor.submit(() -> readStream(process.getInputStream()));
            boolean finished;
            try {
                finished = process.waitFor(waitMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                destroyProcessTree(process);
                throw new ProcessInvocationException("インタプリタの実行が中断されました: " + logicalCommand, ex);
            }
            if (!finished) {
                destroyProcessTree(process);
                throw new ProcessInvocationException(
                        "インタプリタが " + timeout.toSeconds() + " 秒以内に終了しませんでした: " + logicalCommand);
            }
            String stdout = getFuture(stdoutFuture, logicalCommand);
            logExit(logicalCommand, process.exitValue());
            return stdout;
        } finally {
            shutdownExecutor(executor);
        }
    }

    private long waitMillis() {
        return timeout.compareTo(MAX_WAIT) > 0 ? Long.MAX_VALUE : timeout.toMillis();
    }

    /**
     * 子孫プロセスも停止する。子孫が標準出力を開いたままだと読み取りスレッドが終わらない。
     */
    private static void destroyProcessTree(Process process) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
    }

    private static String readStream(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static int waitForProcess(Process process, String logicalCommand) {
        try {
            return process.waitFor();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            destroyProcessTree(process);
            throw new ProcessInvocationException("インタプリタの実行が中断されました: " + logicalCommand, ex);
        }
    }

    private static String getFuture(Future<String> future, String logicalCommand) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProcessInvocationException("標準出力の取得が中断されました: " + logicalCommand, ex);
        } catch (ExecutionException ex) {
            throw new ProcessInvocationException("標準出力の取得に失敗しました: " + logicalCommand, ex.getCause());
        }
    }

    private static void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(3, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static void logExit(String logicalCommand, int exitCode) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("インタプリタが終了しました: exit=" + exitCode + " cmd=" + logicalCommand);
        }
    }
}
