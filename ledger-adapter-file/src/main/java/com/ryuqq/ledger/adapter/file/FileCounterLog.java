package com.ryuqq.ledger.adapter.file;

import com.ryuqq.ledger.core.exception.CorruptRecordException;
import com.ryuqq.ledger.core.exception.StorageFailureException;
import com.ryuqq.ledger.core.spi.CounterLog;
import com.ryuqq.ledger.core.spi.CounterRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Durable {@link CounterLog} backed by a newline-delimited JSON file.
 *
 * <p>Identifier uniqueness depends on this log, so unreadable content is fatal: any
 * undecodable line fails the open with {@link StorageFailureException}. The only
 * exception is a final line without a trailing newline, which is what a crash during
 * append leaves behind; it is skipped with a WARN since its counter was never handed out.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public class FileCounterLog implements CounterLog, Closeable {

    private static final Logger log = LoggerFactory.getLogger(FileCounterLog.class);

    private final JsonRecordCodec codec = new JsonRecordCodec();
    private final AppendOnlyFile file;
    private final CopyOnWriteArrayList<CounterRecord> records = new CopyOnWriteArrayList<>();
    private volatile long lastCounter;

    /**
     * Opens the counter log and replays it.
     *
     * @param config file store configuration
     * @throws StorageFailureException if the file cannot be opened, read or decoded
     */
    public FileCounterLog(FileStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.file = new AppendOnlyFile(config.counterLogPath(), config.fsync());
        try {
            load();
        } catch (RuntimeException e) {
            try {
                file.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        log.info("Opened counter log {} (last counter {})", file.path(), lastCounter);
    }

    private void load() {
        for (AppendOnlyFile.Line line : file.readLines()) {
            if (line.isBlank()) {
                continue;
            }
            try {
                CounterRecord record = codec.decodeCounter(line.requireText(), line.number());
                records.add(record);
                lastCounter = Math.max(lastCounter, record.counter());
            } catch (CorruptRecordException e) {
                if (!line.terminated()) {
                    log.warn("Ignoring torn counter record at {}:{} ({})", file.path(), line.number(), e.getMessage());
                    continue;
                }
                throw new StorageFailureException(
                    "Counter log " + file.path() + " is unreadable at line " + line.number(), e);
            }
        }
    }

    @Override
    public long lastCounter() {
        return lastCounter;
    }

    @Override
    public synchronized void append(CounterRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (record.counter() <= lastCounter) {
            throw new IllegalArgumentException(
                "Counter must advance: " + record.counter() + " is not greater than " + lastCounter);
        }
        file.appendLine(codec.encodeCounter(record));
        records.add(record);
        lastCounter = record.counter();
    }

    @Override
    public List<CounterRecord> readAll() {
        return List.copyOf(records);
    }

    @Override
    public void close() throws IOException {
        file.close();
    }
}
