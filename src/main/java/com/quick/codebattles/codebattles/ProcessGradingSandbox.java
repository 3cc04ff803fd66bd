package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Grades a submission in a child interpreter process.
 * <p>
 * The child runs a fixed runner script; code and test cases travel as one JSON document on
 * its stdin and results come back as a single marked JSON line on stdout. The process gets
 * a fresh temporary working directory and is killed when the wall-clock limit passes.
 */
@Component
public class ProcessGradingSandbox implements GradingSandbox {

    static final String RESULT_MARKER = "__CODEBATTLES_RESULTS__";
    private static final String RUNNER_RESOURCE = "sandbox/runner.py";
    private static final Logger log = LoggerFactory.getLogger(ProcessGradingSandbox.class);

    private final ObjectMapper objectMapper;
    private final String command;
    private final long timeoutMs;
    private final String debugMarker;
    private final int maxOutputChars;
    private final String runnerSource;

    @Autowired
    public ProcessGradingSandbox(ObjectMapper objectMapper,
                                 @Value("${codebattles.sandbox.command:python3}") String command,
                                 @Value("${codebattles.sandbox.timeout-ms:10000}") long timeoutMs,
                                 @Value("${codebattles.sandbox.debug-marker:# DEBUG: Auto-complete}") String debugMarker,
                                 @Value("${codebattles.sandbox.max-output-chars:4000}") int maxOutputChars) {
        this(objectMapper, command, timeoutMs, debugMarker, maxOutputChars, loadRunner());
    }

    ProcessGradingSandbox(ObjectMapper objectMapper, String command, long timeoutMs,
                          String debugMarker, int maxOutputChars, String runnerSource) {
        this.objectMapper = objectMapper;
        this.command = command;
        this.timeoutMs = timeoutMs;
        this.debugMarker = debugMarker;
        this.maxOutputChars = maxOutputChars;
        this.runnerSource = runnerSource;
    }

    @Override
    public GradingReport execute(String code, FunctionSignature signature, List<TestCase> testCases) {
        String source = code == null ? "" : code;
        if (debugMarker != null && !debugMarker.isEmpty() && source.contains(debugMarker)) {
            return GradingReport.autoPass();
        }

        Path workDir = null;
        Process process = null;
        try {
            workDir = Files.createTempDirectory("codebattles-grading-");
            Path stdout = workDir.resolve("stdout.log");
            Path stderr = workDir.resolve("stderr.log");

            ProcessBuilder builder = new ProcessBuilder(command, "-I", "-c", runnerSource)
                    .directory(workDir.toFile())
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            process = builder.start();
            writeRequest(process, buildRequest(source, signature, testCases));

            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                log.warn("grading-timeout function={} timeoutMs={}", signature.name(), timeoutMs);
                return GradingReport.failure(timeoutMessage());
            }
            if (process.exitValue() != 0) {
                String diagnostics = truncate(readOutput(stderr).strip());
                log.debug("grading-nonzero-exit function={} exit={}", signature.name(), process.exitValue());
                return GradingReport.failure(diagnostics.isEmpty() ? "Execution failed" : diagnostics);
            }
            return parseResults(readOutput(stdout));
        } catch (IOException e) {
            log.warn("grading-unavailable command={} reason={}", command, e.getMessage());
            return GradingReport.failure("Grading sandbox unavailable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GradingReport.failure("Grading interrupted");
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(workDir);
        }
    }

    GradingReport parseResults(String stdout) {
        String payload = null;
        String[] lines = stdout.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (lines[i].startsWith(RESULT_MARKER)) {
                payload = lines[i].substring(RESULT_MARKER.length());
                break;
            }
        }
        if (payload == null) {
            return GradingReport.failure("Could not parse test results");
        }
        try {
            RunnerOutput output = objectMapper.readValue(payload, RunnerOutput.class);
            return GradingReport.of(output.results());
        } catch (JsonProcessingException e) {
            return GradingReport.failure("Could not parse test results");
        }
    }

    private RunnerRequest buildRequest(String code, FunctionSignature signature, List<TestCase> testCases) {
        List<RunnerCase> cases = new ArrayList<>(testCases.size());
        for (TestCase testCase : testCases) {
            cases.add(new RunnerCase(testCase.input(), testCase.expectedOutput()));
        }
        return new RunnerRequest(code, signature.name(), signature.parameterNames(), cases);
    }

    private void writeRequest(Process process, RunnerRequest request) throws IOException {
        byte[] body = objectMapper.writeValueAsBytes(request);
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(body);
        } catch (IOException e) {
            // the runner may exit before reading everything; its exit status reports why
            log.debug("grading-stdin-closed reason={}", e.getMessage());
        }
    }

    // submissions may write arbitrary bytes; undecodable ones become U+FFFD
    private static String readOutput(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private String timeoutMessage() {
        if (timeoutMs % 1000 == 0) {
            return "Code execution timed out (" + (timeoutMs / 1000) + " seconds max)";
        }
        return "Code execution timed out (" + timeoutMs + " ms max)";
    }

    private String truncate(String text) {
        return text.length() <= maxOutputChars ? text : text.substring(0, maxOutputChars) + "...";
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("grading-cleanup-failed dir={} reason={}", dir, e.getMessage());
        }
    }

    private static String loadRunner() {
        try (InputStream in = new ClassPathResource(RUNNER_RESOURCE).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Missing grading runner " + RUNNER_RESOURCE, e);
        }
    }

    record RunnerRequest(String code, String function, List<String> parameters, List<RunnerCase> cases) {
    }

    record RunnerCase(Map<String, Object> input, Object expected) {
    }

    record RunnerOutput(List<TestCaseResult> results) {
    }
}
