package com.cheader.extractor.parser.clang;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cheader.extractor.parser.HeaderParserOptions;
import com.cheader.extractor.parser.exception.HeaderParseException;
import com.cheader.extractor.parser.exception.ToolInvocationException;
import com.cheader.extractor.parser.exception.ToolLaunchException;

/**
 * Runs the clang binary as an external process.
 *
 * Standard error is drained on a background thread while standard output is
 * read on the calling thread, so a child that fills either pipe buffer can
 * never block on the other one.
 */
public class ClangInvoker implements FrontendRunner {
    private static final Logger log = LoggerFactory.getLogger(ClangInvoker.class);

    @Override
    public String run(HeaderParserOptions options, ClangMode mode) {
        List<String> command = buildCommand(options, mode);
        String tool = options.getClangBinary();

        log.debug("Running: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ToolLaunchException(tool, e);
        }

        StreamCollector stderr = new StreamCollector(process.getErrorStream(), "clang-stderr");
        stderr.start();

        String stdout;
        String errorText;
        int exitCode;
        try {
            process.getOutputStream().close();
            stdout = readFully(process.getInputStream());
            exitCode = process.waitFor();
            errorText = stderr.await();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new HeaderParseException("Failed to read output of " + tool + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new HeaderParseException("Interrupted while waiting for " + tool, e);
        }

        if (exitCode != 0) {
            throw new ToolInvocationException(tool, exitCode, errorText);
        }

        log.debug("{} completed ({}), output: {} bytes", tool, mode, stdout.length());
        return stdout;
    }

    /**
     * Builds {@code <clang> -I.. -D.. <extra args> <mode flags> <header>}.
     */
    public List<String> buildCommand(HeaderParserOptions options, ClangMode mode) {
        List<String> command = new ArrayList<>();
        command.add(options.getClangBinary());
        for (String includePath : options.getIncludePaths()) {
            command.add("-I" + includePath);
        }
        for (String define : options.getDefines()) {
            command.add("-D" + define);
        }
        command.addAll(options.getExtraArgs());
        command.addAll(mode.getFlags());
        command.add(options.getHeaderFile().toString());
        return command;
    }

    private static String readFully(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Reads a stream to exhaustion on its own daemon thread.
     */
    private static final class StreamCollector {
        private final InputStream in;
        private final Thread thread;
        private volatile String text = "";
        private volatile IOException failure;

        StreamCollector(InputStream in, String name) {
            this.in = in;
            this.thread = new Thread(this::drain, name);
            this.thread.setDaemon(true);
        }

        void start() {
            thread.start();
        }

        private void drain() {
            try {
                text = readFully(in);
            } catch (IOException e) {
                failure = e;
            }
        }

        String await() throws IOException, InterruptedException {
            thread.join();
            if (failure != null) {
                throw failure;
            }
            return text;
        }
    }
}
