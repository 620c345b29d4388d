package com.errorbuddy.service.logtail;

import com.errorbuddy.config.ReporterProperties;
import com.errorbuddy.model.FailureKind;
import com.errorbuddy.model.LogTail;
import com.errorbuddy.service.diagnostics.ReporterDiagnostics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Reads the last lines of a log file by walking backwards from EOF in fixed
 * size chunks.
 * <p>
 * Memory stays proportional to the bytes needed for the requested lines, and
 * the total amount read is capped by {@code log-tail.max-bytes} no matter how
 * large the file is. Missing or unreadable files give an empty tail.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LogTailReader {

    private static final byte NEWLINE = '\n';

    private final ReporterProperties properties;
    private final ReporterDiagnostics diagnostics;

    /**
     * Tail of the configured debug log, or an empty tail when the feature is
     * off or no path is configured.
     */
    public LogTail readDebugLog() {
        ReporterProperties.LogTail config = properties.getLogTail();
        if (!config.isEnabled() || config.getPath() == null || config.getPath().isBlank()) {
            return LogTail.empty();
        }
        return tail(Path.of(config.getPath()), config.getLines());
    }

    public LogTail tail(Path path, int lineCount) {
        if (path == null || lineCount <= 0) {
            return LogTail.empty();
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            log.debug("Log file not accessible: {}", path);
            return LogTail.empty();
        }

        try (SeekableByteChannel channel = openChannel(path)) {
            return readTail(channel, lineCount);
        } catch (IOException | RuntimeException e) {
            diagnostics.record(FailureKind.LOG_READ, "Log tail read failed for " + path, e);
            return LogTail.empty();
        }
    }

    /**
     * Opens the file for reading. Overridable so tests can observe read calls.
     */
    protected SeekableByteChannel openChannel(Path path) throws IOException {
        return Files.newByteChannel(path, StandardOpenOption.READ);
    }

    private LogTail readTail(SeekableByteChannel channel, int lineCount) throws IOException {
        long fileSize = channel.size();
        if (fileSize == 0) {
            return LogTail.empty();
        }

        int chunkSize = Math.max(1, properties.getLogTail().getChunkBytes());
        // The tail is assembled in a single array
        long ceiling = Math.min(Integer.MAX_VALUE, Math.max(1, properties.getLogTail().getMaxBytes()));

        Deque<byte[]> chunks = new ArrayDeque<>();
        long position = fileSize;
        long bytesRead = 0;
        int newlines = 0;
        boolean trailingNewline = false;

        while (position > 0 && bytesRead < ceiling) {
            int readSize = (int) Math.min(Math.min(chunkSize, position), ceiling - bytesRead);
            position -= readSize;

            byte[] chunk = readChunk(channel, position, readSize);
            if (chunks.isEmpty()) {
                trailingNewline = chunk[chunk.length - 1] == NEWLINE;
            }
            chunks.addFirst(chunk);
            bytesRead += readSize;
            newlines += countNewlines(chunk);

            // Everything after the first newline in the buffer is made of whole lines
            int completeLines = newlines - (trailingNewline ? 1 : 0);
            if (completeLines >= lineCount) {
                break;
            }
        }

        return extractLastLines(join(chunks, bytesRead), position > 0, lineCount);
    }

    private byte[] readChunk(SeekableByteChannel channel, long position, int size) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(size);
        channel.position(position);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                throw new EOFException("Log file shrank while reading at offset " + position);
            }
        }
        return buffer.array();
    }

    private static LogTail extractLastLines(byte[] content, boolean startsMidFile, int lineCount) {
        String text = new String(content, StandardCharsets.UTF_8);
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));

        // The first segment is a fragment unless we reached the start of the file
        if (startsMidFile) {
            lines.remove(0);
        }
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        if (lines.size() > lineCount) {
            lines = lines.subList(lines.size() - lineCount, lines.size());
        }
        return LogTail.of(lines);
    }

    private static byte[] join(Deque<byte[]> chunks, long totalBytes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) totalBytes);
        for (byte[] chunk : chunks) {
            out.write(chunk, 0, chunk.length);
        }
        return out.toByteArray();
    }

    private static int countNewlines(byte[] chunk) {
        int count = 0;
        for (byte b : chunk) {
            if (b == NEWLINE) {
                count++;
            }
        }
        return count;
    }
}
