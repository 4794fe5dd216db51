package com.phillippitts.ttsbatch.service.synthesis;

import com.phillippitts.ttsbatch.config.tts.PiperConfig;
import com.phillippitts.ttsbatch.exception.SynthesisException;
import com.phillippitts.ttsbatch.exception.SynthesisExceptionBuilder;
import com.phillippitts.ttsbatch.util.ProcessTimeouts;
import com.phillippitts.ttsbatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the external {@code piper} binary for one synthesis.
 *
 * <p>Responsibilities:
 * - Build the CLI from {@link PiperConfig} and the voice files
 * - Write the text to stdin, read raw PCM from stdout and diagnostics from stderr concurrently
 * - Enforce a timeout and an output cap, terminating runaway processes
 * - Provide structured error context in {@link SynthesisException}
 *
 * <p>Each call owns its process and reader threads, so one instance serves concurrent callers.
 */
@Component
public class PiperProcessManager {

    private static final Logger LOG = LogManager.getLogger(PiperProcessManager.class);

    static final int STDERR_MAX_CHARS = 8 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 512;

    private final ProcessFactory processFactory;

    public PiperProcessManager() {
        this(new DefaultProcessFactory());
    }

    PiperProcessManager(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Holds process execution state including process reference and reader threads.
     */
    private record ProcessExecution(
            Process process,
            Thread outReader,
            Thread errReader,
            PcmSink stdout,
            StringBuilder stderr
    ) {}

    /**
     * Synthesizes {@code text} with {@code voice}.
     *
     * <p>CLI contract:
     *   <pre>
     *   ${binary} --model ${id}.onnx --config ${id}.onnx.json --output-raw
     *   </pre>
     *
     * @return raw PCM produced on stdout (may be empty; the engine validates it)
     * @throws SynthesisException on timeout, non-zero exit, output overflow or I/O error
     */
    public byte[] synthesize(PiperVoice voice, String text, PiperConfig cfg) {
        Objects.requireNonNull(voice, "voice");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(cfg, "cfg");

        List<String> command = buildCommand(cfg, voice);
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = start(command, voice, cfg);
            writeStdin(exec.process(), text);

            boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw piperError("Timeout after " + cfg.timeoutSeconds() + "s", cfg, voice, -1, exec.stderr(),
                        startTime, null);
            }
            joinQuietly(exec.outReader(), ProcessTimeouts.READER_FLUSH_TIMEOUT);
            joinQuietly(exec.errReader(), ProcessTimeouts.READER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw piperError("Non-zero exit: " + exitCode, cfg, voice, exitCode, exec.stderr(), startTime, null);
            }
            if (exec.stdout().overflowed()) {
                throw piperError("Output exceeded " + cfg.maxOutputBytes() + " bytes", cfg, voice, exitCode,
                        exec.stderr(), startTime, null);
            }
            byte[] pcm = exec.stdout().toByteArray();
            LOG.debug("Piper produced {} bytes in {} ms", pcm.length, TimeUtils.elapsedMillis(startTime));
            return pcm;
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw piperError("I/O failure: " + e.getMessage(), cfg, voice, -1,
                    exec == null ? null : exec.stderr(), startTime, e);
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    List<String> buildCommand(PiperConfig cfg, PiperVoice voice) {
        List<String> cmd = new ArrayList<>();
        cmd.add(cfg.binaryPath());
        cmd.add("--model");
        cmd.add(voice.modelFile().toAbsolutePath().toString());
        cmd.add("--config");
        cmd.add(voice.configFile().toAbsolutePath().toString());
        cmd.add("--output-raw");
        return cmd;
    }

    private ProcessExecution start(List<String> command, PiperVoice voice, PiperConfig cfg) throws IOException {
        Path workingDir = voice.modelFile().toAbsolutePath().getParent();
        Process process = processFactory.start(command, workingDir);

        // Readers start before stdin is written so a chatty process cannot fill its pipes and stall
        PcmSink stdout = new PcmSink(cfg.maxOutputBytes());
        StringBuilder stderr = new StringBuilder();
        Thread outReader = startReader(() -> stdout.drain(process.getInputStream()), "piper-out");
        Thread errReader = startReader(() -> gobbleText(process.getErrorStream(), stderr), "piper-err");
        return new ProcessExecution(process, outReader, errReader, stdout, stderr);
    }

    private static void writeStdin(Process process, String text) throws IOException {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(text.getBytes(StandardCharsets.UTF_8));
            stdin.write('\n');
            stdin.flush();
        }
    }

    private static Thread startReader(Runnable body, String name) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Accumulates stdout up to a cap, then keeps draining without storing so the process never
     * blocks on a full pipe.
     */
    private static final class PcmSink {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final int maxBytes;
        private final AtomicBoolean overflowed = new AtomicBoolean();

        PcmSink(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        void drain(InputStream in) {
            byte[] chunk = new byte[8192];
            try (InputStream stream = in) {
                int n;
                while ((n = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        int room = maxBytes - buffer.size();
                        if (n > room) {
                            buffer.write(chunk, 0, Math.max(0, room));
                            if (overflowed.compareAndSet(false, true)) {
                                LOG.warn("Piper stdout reached {}B cap; discarding further output", maxBytes);
                            }
                        } else {
                            buffer.write(chunk, 0, n);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Piper stdout reader stopped: {}", e.toString());
            }
        }

        boolean overflowed() {
            return overflowed.get();
        }

        byte[] toByteArray() {
            synchronized (buffer) {
                return buffer.toByteArray();
            }
        }
    }

    private static void gobbleText(InputStream in, StringBuilder sink) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                synchronized (sink) {
                    if (sink.length() >= STDERR_MAX_CHARS) {
                        continue;
                    }
                    if (!sink.isEmpty()) {
                        sink.append('\n');
                    }
                    sink.append(line, 0, Math.min(line.length(), STDERR_MAX_CHARS - sink.length()));
                }
            }
        } catch (IOException e) {
            LOG.debug("Piper stderr reader stopped: {}", e.toString());
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outReader(), ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errReader(), ProcessTimeouts.READER_CLEANUP_TIMEOUT);
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    private SynthesisException piperError(String msg, PiperConfig cfg, PiperVoice voice, int exitCode,
                                          StringBuilder stderr, long startNano, Throwable cause) {
        String stderrSnippet;
        if (stderr == null) {
            stderrSnippet = "";
        } else {
            synchronized (stderr) {
                stderrSnippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }
        SynthesisExceptionBuilder builder = SynthesisExceptionBuilder.create(msg)
                .engine(PiperSynthesisEngine.ENGINE)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("binaryPath", cfg.binaryPath())
                .metadata("modelId", voice.modelId())
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
