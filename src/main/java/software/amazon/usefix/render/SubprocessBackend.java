/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.render;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;
import software.amazon.smithy.utils.IoUtils;

/**
 * Formats declarations by piping them through an external command, like
 * {@code rustfmt --emit stdout}.
 *
 * <p>The canonical text is written to the command's stdin from a separate
 * thread while its stdout is read to completion on the calling thread, so
 * neither side can block on a full pipe. The command's stderr goes to ours.
 * Output that isn't valid UTF-8 is an error. There is no timeout.
 */
public final class SubprocessBackend implements FormattingBackend {
    private static final Logger LOGGER = Logger.getLogger(SubprocessBackend.class.getName());

    private final List<String> command;

    /**
     * @param command The command and its arguments
     */
    public SubprocessBackend(List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Formatter command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public String format(String text) {
        String commandLine = String.join(" ", command);
        LOGGER.fine(() -> "Running " + commandLine);

        Process process;
        try {
            process = new ProcessBuilder()
                    .command(command)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .redirectOutput(ProcessBuilder.Redirect.PIPE)
                    .redirectInput(ProcessBuilder.Redirect.PIPE)
                    .start();
        } catch (IOException e) {
            throw new BackendException("Failed to start `" + commandLine + "`: " + e.getMessage(), e);
        }

        try {
            InputWriter writer = new InputWriter(process.getOutputStream(), text);
            Thread thread = new Thread(writer, "WriteFormatterInput");
            thread.start();

            byte[] output = IoUtils.toByteArray(process.getInputStream());
            int result = process.waitFor();
            thread.join();

            if (result != 0) {
                throw new BackendException("`" + commandLine + "` returned " + result);
            }
            if (writer.failure != null) {
                throw new BackendException("Failed to write to `" + commandLine + "`: "
                                           + writer.failure.getMessage(), writer.failure);
            }
            return decode(output, commandLine);
        } catch (UncheckedIOException e) {
            throw new BackendException("Failed to read from `" + commandLine + "`: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while running `" + commandLine + "`", e);
        } finally {
            process.destroy();
        }
    }

    private static String decode(byte[] output, String commandLine) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(output))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new BackendException("`" + commandLine + "` produced output that isn't valid UTF-8", e);
        }
    }

    @Override
    public String toString() {
        return "subprocess " + command;
    }

    private static final class InputWriter implements Runnable {
        private final OutputStream stdin;
        private final String text;
        private volatile IOException failure;

        InputWriter(OutputStream stdin, String text) {
            this.stdin = stdin;
            this.text = text;
        }

        @Override
        public void run() {
            try (OutputStream out = stdin) {
                out.write(text.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                failure = e;
            }
        }
    }
}
