package com.ryuqq.ledger.adapter.file;

import com.ryuqq.ledger.core.exception.CorruptRecordException;
import com.ryuqq.ledger.core.exception.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Newline-delimited append-only file.
 *
 * <p>Each record is written as one UTF-8 line at the current end of file. A write
 * either lands completely (and is forced to disk when {@code fsync} is on) or the
 * file is truncated back to its previous size, so no partial record survives a
 * failed append.</p>
 *
 * <p>Not thread-safe: callers serialize {@link #appendLine}.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
final class AppendOnlyFile implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(AppendOnlyFile.class);
    private static final byte NEWLINE = '\n';

    private final Path path;
    private final boolean fsync;
    private final FileChannel channel;

    /**
     * Opens (creating if needed) the file and its parent directories.
     *
     * @throws StorageFailureException if the file cannot be opened
     */
    AppendOnlyFile(Path path, boolean fsync) {
        this.path = path;
        this.fsync = fsync;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageFailureException("Cannot open log file " + path, e);
        }
    }

    /**
     * Reads every line currently in the file.
     *
     * <p>A final line without a trailing newline is returned as well; callers decide
     * whether it is a torn write. Each line is decoded on its own, so invalid UTF-8 in
     * one record marks only that line as malformed.</p>
     *
     * @return lines in file order
     * @throws StorageFailureException if the file cannot be read
     */
    List<Line> readLines() {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new StorageFailureException("Cannot read log file " + path, e);
        }

        List<Line> lines = new ArrayList<>();
        int start = 0;
        long number = 1;
        while (start < content.length) {
            int end = indexOfNewline(content, start);
            boolean terminated = end >= 0;
            if (!terminated) {
                end = content.length;
            }
            lines.add(decode(number++, content, start, end - start, terminated));
            start = end + 1;
        }
        return lines;
    }

    private static int indexOfNewline(byte[] content, int from) {
        for (int i = from; i < content.length; i++) {
            if (content[i] == NEWLINE) {
                return i;
            }
        }
        return -1;
    }

    private static Line decode(long number, byte[] content, int offset, int length, boolean terminated) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(content, offset, length)).toString();
            return new Line(number, text, terminated, null);
        } catch (CharacterCodingException e) {
            // keep a lossy rendering for reporting
            String lossy = new String(content, offset, length, StandardCharsets.UTF_8);
            return new Line(number, lossy, terminated, e);
        }
    }

    /**
     * Appends one record followed by a newline.
     *
     * <p>If the file ends with an unterminated line, a newline is written first so the
     * new record starts on its own line.</p>
     *
     * @param record single-line record text
     * @throws StorageFailureException if the record cannot be written durably
     */
    void appendLine(String record) {
        long sizeBefore;
        try {
            sizeBefore = channel.size();
        } catch (IOException e) {
            throw new StorageFailureException("Cannot stat log file " + path, e);
        }

        try {
            byte[] bytes = record.getBytes(StandardCharsets.UTF_8);
            boolean needsSeparator = sizeBefore > 0 && lastByte(sizeBefore) != NEWLINE;
            ByteBuffer buffer = ByteBuffer.allocate(bytes.length + (needsSeparator ? 2 : 1));
            if (needsSeparator) {
                buffer.put(NEWLINE);
            }
            buffer.put(bytes).put(NEWLINE).flip();

            long position = sizeBefore;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
            if (fsync) {
                channel.force(false);
            }
        } catch (IOException e) {
            rollback(sizeBefore, e);
            throw new StorageFailureException("Cannot append to log file " + path, e);
        }
    }

    private byte lastByte(long size) throws IOException {
        ByteBuffer one = ByteBuffer.allocate(1);
        channel.read(one, size - 1);
        return one.get(0);
    }

    private void rollback(long size, IOException cause) {
        try {
            channel.truncate(size);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.error("Failed to truncate {} back to {} bytes after a failed append", path, size, e);
        }
    }

    Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    /**
     * One physical line of the file.
     *
     * @param number 1-based line number
     * @param text line content without the newline (lossy if the bytes were not valid UTF-8)
     * @param terminated whether the line ends with a newline
     * @param decodingError why the bytes could not be decoded, or null
     */
    record Line(long number, String text, boolean terminated, CharacterCodingException decodingError) {

        boolean isBlank() {
            return decodingError == null && text.isBlank();
        }

        /**
         * Returns the decoded text.
         *
         * @throws CorruptRecordException if the line is not valid UTF-8
         */
        String requireText() {
            if (decodingError != null) {
                throw new CorruptRecordException("Line " + number + ": invalid UTF-8", number, decodingError);
            }
            return text;
        }
    }
}
