package com.ryuqq.ledger.adapter.file;

import com.ryuqq.ledger.core.event.EventDraft;
import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.exception.CorruptRecordException;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.AppendResult;
import com.ryuqq.ledger.core.spi.CorruptRecord;
import com.ryuqq.ledger.core.spi.EventStore;
import com.ryuqq.ledger.core.spi.LogReplay;
import com.ryuqq.ledger.core.store.EventLogIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable {@link EventStore} backed by a newline-delimited JSON file.
 *
 * <p>The file is the single source of truth. On open the whole log is replayed into an
 * {@link EventLogIndex}; afterwards reads are served from the index. {@link #replayAll()}
 * goes back to the file, which is what audits use.</p>
 *
 * <p><strong>Append Flow:</strong></p>
 * <pre>
 * appendLock
 *   1. precheck (duplicate / conflict / timestamp) against the index
 *   2. assign eventSeq
 *   3. write one line (+ fsync); on IOException truncate and throw StorageFailureException
 *   4. publish to the index
 * unlock
 * </pre>
 *
 * <p><strong>Corrupt Records:</strong> with {@code strictReads=false} an undecodable line is
 * skipped, logged at WARN and reported through {@link #corruptRecords()}. With
 * {@code strictReads=true} opening the store fails with {@link CorruptRecordException}.</p>
 *
 * <p>A single global lock serializes appends across shipments.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public class FileEventStore implements EventStore, Closeable {

    private static final Logger log = LoggerFactory.getLogger(FileEventStore.class);

    private final FileStoreConfig config;
    private final JsonRecordCodec codec = new JsonRecordCodec();
    private final EventLogIndex index = new EventLogIndex();
    private final ReentrantLock appendLock = new ReentrantLock();
    private final AppendOnlyFile file;
    private final List<CorruptRecord> corruptRecords;

    /**
     * Opens the event log and replays it.
     *
     * @param config file store configuration
     * @throws IllegalArgumentException if config is null
     * @throws com.ryuqq.ledger.core.exception.StorageFailureException if the file cannot be opened or read
     * @throws CorruptRecordException if {@code strictReads} is on and a line cannot be decoded
     */
    public FileEventStore(FileStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.file = new AppendOnlyFile(config.eventLogPath(), config.fsync());
        try {
            this.corruptRecords = List.copyOf(load());
        } catch (RuntimeException e) {
            closeQuietly(e);
            throw e;
        }
        log.info("Opened event log {} ({} events, {} shipments, {} corrupt records)",
            file.path(), index.size(), index.shipmentIds().size(), corruptRecords.size());
    }

    private List<CorruptRecord> load() {
        LogReplay replay = decode(file.readLines());
        replay.events().forEach(index::restore);
        return replay.corruptRecords();
    }

    private LogReplay decode(List<AppendOnlyFile.Line> lines) {
        List<ShipmentEvent> events = new ArrayList<>();
        List<CorruptRecord> corrupt = new ArrayList<>();
        for (AppendOnlyFile.Line line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(codec.decodeEvent(line.requireText(), line.number()));
            } catch (CorruptRecordException e) {
                if (config.strictReads()) {
                    throw e;
                }
                log.warn("Skipping corrupt record at {}:{} ({})", file.path(), line.number(), e.getMessage());
                corrupt.add(new CorruptRecord(line.number(), line.text(), e.getMessage()));
            }
        }
        return new LogReplay(events, corrupt);
    }

    @Override
    public AppendResult append(EventDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }

        appendLock.lock();
        try {
            Optional<AppendResult> rejected = index.precheck(draft);
            if (rejected.isPresent()) {
                return rejected.get();
            }

            ShipmentEvent event = index.nextEvent(draft);
            file.appendLine(codec.encodeEvent(event));
            index.add(event);
            log.debug("Appended {} #{} {}", event.shipmentId(), event.eventSeq(), event.eventType());
            return new AppendResult.Appended(event);
        } finally {
            appendLock.unlock();
        }
    }

    @Override
    public List<ShipmentEvent> readAll() {
        return index.all();
    }

    @Override
    public List<ShipmentEvent> readFor(ShipmentId shipmentId) {
        if (shipmentId == null) {
            throw new IllegalArgumentException("shipmentId cannot be null");
        }
        return index.eventsFor(shipmentId);
    }

    @Override
    public Optional<ShipmentEvent> findEvent(EventId eventId) {
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        return index.find(eventId);
    }

    @Override
    public List<ShipmentId> shipmentIds() {
        return index.shipmentIds();
    }

    @Override
    public long lastSequence(ShipmentId shipmentId) {
        if (shipmentId == null) {
            throw new IllegalArgumentException("shipmentId cannot be null");
        }
        return index.lastSequence(shipmentId);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Collected once, while the log was replayed on open.</p>
     */
    @Override
    public List<CorruptRecord> corruptRecords() {
        return corruptRecords;
    }

    /**
     * Re-reads the file instead of serving the in-memory index, so records written to the
     * file by anything other than this store are audited too. Appends are held off while
     * the file is read.
     *
     * @throws CorruptRecordException if {@code strictReads} is on and a line cannot be decoded
     */
    @Override
    public LogReplay replayAll() {
        appendLock.lock();
        try {
            return decode(file.readLines());
        } finally {
            appendLock.unlock();
        }
    }

    public FileStoreConfig config() {
        return config;
    }

    @Override
    public void close() throws IOException {
        file.close();
    }

    private void closeQuietly(RuntimeException cause) {
        try {
            file.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
