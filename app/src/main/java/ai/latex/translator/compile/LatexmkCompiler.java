package ai.latex.translator.compile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@code latexmk} in the source directory and waits at most the configured timeout.
 */
public class LatexmkCompiler implements LatexCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(LatexmkCompiler.class);
    static final Duration EXIT_WAIT = Duration.ofSeconds(5);

    private final String executable;

    public LatexmkCompiler() {
        this("latexmk");
    }

    public LatexmkCompiler(String executable) {
        this.executable = Objects.requireNonNull(executable, "executable");
    }

    @Override
    public CompileOutcome compile(CompileSetting setting) {
        Objects.requireNonNull(setting, "setting");
        Path directory = setting.sourceDirectory();
        Path target = directory.resolve(setting.targetFileName());
        if (!Files.isRegularFile(target)) {
            return CompileOutcome.failure(CompileErrorType.COMPILE_ERROR, "Target file not found: " + target, "");
        }
        List<String> command = command(setting);
        LOGGER.info("Compiling {} with {}", setting.targetFileName(), setting.engine());
        LOGGER.debug("Executing command: {}", command);

        Path output = null;
        Process process = null;
        try {
            output = Files.createTempFile("latexmk-", ".out");
            ProcessBuilder builder = new ProcessBuilder(command)
                    .directory(directory.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile());
            process = builder.start();
            boolean finished = process.waitFor(setting.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroy(process);
                LOGGER.error("Timeout compiling {} after {} seconds", setting.targetFileName(), setting.timeout().toSeconds());
                String log = readLog(directory, setting);
                return CompileOutcome.failure(CompileErrorType.COMPILE_TIMEOUT,
                        CompileLogAnalyzer.extractCriticalErrors(log), log);
            }
            int exitCode = process.exitValue();
            LOGGER.debug("latexmk output:\n{}", Files.readString(output, StandardCharsets.UTF_8));
            String log = readLog(directory, setting);
            if (exitCode != 0) {
                LOGGER.warn("latexmk exited with code {} for {}", exitCode, setting.targetFileName());
                return CompileOutcome.failure(CompileErrorType.COMPILE_ERROR,
                        CompileLogAnalyzer.extractCriticalErrors(log), log);
            }
            Path pdf = directory.resolve(setting.targetWithExtension(".pdf"));
            if (!Files.isRegularFile(pdf)) {
                return CompileOutcome.failure(CompileErrorType.COMPILE_ERROR,
                        "Compile was successful, but PDF file was not generated: " + pdf, log);
            }
            LOGGER.info("Compiled {}", setting.targetFileName());
            return CompileOutcome.success(pdf);
        } catch (IOException ex) {
            if (process != null) {
                destroy(process);
            }
            LOGGER.error("Failed to run {}: {}", executable, ex.getMessage());
            return CompileOutcome.failure(CompileErrorType.COMPILE_ERROR, "Failed to run " + executable + ": " + ex.getMessage(), "");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            if (process != null) {
                destroy(process);
            }
            LOGGER.warn("Compilation of {} interrupted", setting.targetFileName());
            return CompileOutcome.failure(CompileErrorType.COMPILE_ERROR, "Compilation interrupted", "");
        } finally {
            if (output != null) {
                deleteQuietly(output);
            }
        }
    }

    List<String> command(CompileSetting setting) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add(setting.engine().latexmkFlag());
        command.add("-f");
        command.add("-interaction=nonstopmode");
        command.add("-file-line-error");
        if (setting.useBibtex()) {
            command.add("-bibtex");
        }
        command.add(setting.targetFileName());
        return command;
    }

    /**
     * Kills latexmk and the engine processes it spawned, then waits up to {@link #EXIT_WAIT} for them to
     * exit so the caller can remove the build directory.
     */
    void destroy(Process process) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        descendants.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        long deadline = System.nanoTime() + EXIT_WAIT.toNanos();
        try {
            if (!process.waitFor(EXIT_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("{} (pid {}) did not exit within {} ms of being killed", executable, process.pid(),
                        EXIT_WAIT.toMillis());
            }
            for (ProcessHandle child : descendants) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                child.onExit().get(remaining, TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for {} to exit", executable);
        } catch (ExecutionException | TimeoutException ex) {
            LOGGER.warn("Child process of {} still running after kill: {}", executable, ex.toString());
        }
    }

    private String readLog(Path directory, CompileSetting setting) {
        Path log = directory.resolve(setting.targetWithExtension(".log"));
        if (!Files.isRegularFile(log)) {
            return "";
        }
        try {
            // Malformed bytes are replaced rather than rejected.
            return new String(Files.readAllBytes(log), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.warn("Could not read compile log {}: {}", log, ex.getMessage());
            return "";
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            LOGGER.debug("Could not delete {}: {}", file, ex.getMessage());
        }
    }
}
