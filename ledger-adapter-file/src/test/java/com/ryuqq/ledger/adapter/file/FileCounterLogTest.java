package com.ryuqq.ledger.adapter.file;

import com.ryuqq.ledger.core.exception.StorageFailureException;
import com.ryuqq.ledger.core.id.CounterLogIdGenerator;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.CounterRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FileCounterLog 복구 테스트.
 *
 * @author Ledger Team
 * @since 1.0.0
 */
class FileCounterLogTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path directory;

    @Test
    @DisplayName("재시작 후에도 이미 발급한 ID는 다시 발급되지 않는다")
    void restart_neverReusesIds() throws Exception {
        FileStoreConfig config = FileStoreConfig.in(directory);
        ShipmentId last;
        try (FileCounterLog counterLog = new FileCounterLog(config)) {
            CounterLogIdGenerator generator = new CounterLogIdGenerator(counterLog, CLOCK);
            generator.nextId();
            generator.nextId();
            last = generator.nextId();
        }

        try (FileCounterLog counterLog = new FileCounterLog(config)) {
            CounterLogIdGenerator generator = new CounterLogIdGenerator(counterLog, CLOCK);
            ShipmentId next = generator.nextId();

            assertEquals("SHP-0000000003", last.getValue());
            assertEquals("SHP-0000000004", next.getValue());
            assertEquals(4, counterLog.readAll().size());
        }
    }

    @Test
    @DisplayName("개행 없는 마지막 줄(중단된 쓰기)은 무시된다")
    void tornFinalLine_isIgnored() throws Exception {
        FileStoreConfig config = FileStoreConfig.in(directory);
        Files.createDirectories(directory);
        Files.writeString(config.counterLogPath(),
            "{\"counter\":1,\"timestamp\":\"2024-01-15T09:00:00Z\",\"action\":\"ID_GENERATED\"}\n{\"counter\":2,\"tim",
            StandardCharsets.UTF_8);

        try (FileCounterLog counterLog = new FileCounterLog(config)) {
            assertEquals(1L, counterLog.lastCounter());

            counterLog.append(CounterRecord.issued(2L, CLOCK.instant()));
        }
        try (FileCounterLog counterLog = new FileCounterLog(config)) {
            assertEquals(2L, counterLog.lastCounter());
        }
    }

    @Test
    @DisplayName("중간의 손상된 줄은 치명적 오류다")
    void corruptMiddleLine_isFatal() throws Exception {
        FileStoreConfig config = FileStoreConfig.in(directory);
        Files.createDirectories(directory);
        Files.writeString(config.counterLogPath(),
            "not-json\n{\"counter\":2,\"timestamp\":\"2024-01-15T09:00:00Z\",\"action\":\"ID_GENERATED\"}\n",
            StandardCharsets.UTF_8);

        assertThrows(StorageFailureException.class, () -> new FileCounterLog(config));
    }

    @Test
    @DisplayName("원본 형식(오프셋 없는 timestamp)의 카운터 레코드를 읽는다")
    void legacyTimestamp_isReadAsUtc() throws Exception {
        FileStoreConfig config = FileStoreConfig.in(directory);
        Files.createDirectories(directory);
        Files.writeString(config.counterLogPath(),
            "{\"counter\": 41, \"timestamp\": \"2024-01-15T09:00:00.500000\", \"action\": \"ID_GENERATED\"}\n",
            StandardCharsets.UTF_8);

        try (FileCounterLog counterLog = new FileCounterLog(config)) {
            assertEquals(41L, counterLog.lastCounter());
            assertEquals(Instant.parse("2024-01-15T09:00:00.500Z"), counterLog.readAll().get(0).timestamp());
        }
    }
}
