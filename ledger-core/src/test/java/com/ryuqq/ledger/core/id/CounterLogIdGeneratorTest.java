package com.ryuqq.ledger.core.id;

import com.ryuqq.ledger.core.exception.StorageFailureException;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.CounterLog;
import com.ryuqq.ledger.core.spi.CounterRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * CounterLogIdGenerator 유닛 테스트.
 *
 * @author Ledger Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CounterLogIdGenerator 테스트")
class CounterLogIdGeneratorTest {

    private static final Instant NOW = Instant.parse("2024-01-15T09:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private CounterLog counterLog;

    @Test
    @DisplayName("마지막 카운터 다음 값을 기록한 뒤 반환한다")
    void nextId_appendsBeforeReturning() {
        // given
        when(counterLog.lastCounter()).thenReturn(41L);
        CounterLogIdGenerator generator = new CounterLogIdGenerator(counterLog, CLOCK);

        // when
        ShipmentId id = generator.nextId();

        // then
        assertEquals("SHP-0000000042", id.getValue());
        ArgumentCaptor<CounterRecord> captor = ArgumentCaptor.forClass(CounterRecord.class);
        verify(counterLog).append(captor.capture());
        assertEquals(42L, captor.getValue().counter());
        assertEquals(NOW, captor.getValue().timestamp());
        assertEquals(CounterRecord.ID_GENERATED, captor.getValue().action());
        assertEquals(42L, generator.lastIssued());
    }

    @Test
    @DisplayName("기록 실패 시 예외가 전파되고 카운터는 증가하지 않는다")
    void nextId_failedAppend_doesNotAdvance() {
        // given
        when(counterLog.lastCounter()).thenReturn(0L);
        doThrow(new StorageFailureException("disk full"))
            .doNothing()
            .when(counterLog).append(any());
        CounterLogIdGenerator generator = new CounterLogIdGenerator(counterLog, CLOCK);

        // when & then
        assertThrows(StorageFailureException.class, generator::nextId);
        assertEquals(0L, generator.lastIssued());

        ShipmentId retried = generator.nextId();
        assertEquals("SHP-0000000001", retried.getValue());

        InOrder inOrder = inOrder(counterLog);
        inOrder.verify(counterLog, times(2)).append(any());
    }

    @Test
    @DisplayName("카운터 로그를 읽을 수 없으면 생성 시점에 실패한다")
    void constructor_unreadableLog_fails() {
        when(counterLog.lastCounter()).thenThrow(new StorageFailureException("unreadable"));

        assertThrows(StorageFailureException.class, () -> new CounterLogIdGenerator(counterLog, CLOCK));
    }

    @Test
    @DisplayName("동시에 호출해도 중복 없이 연속된 ID가 발급된다")
    void nextId_concurrentCallers_getUniqueIds() throws Exception {
        // given
        RecordingCounterLog recording = new RecordingCounterLog();
        CounterLogIdGenerator generator = new CounterLogIdGenerator(recording, CLOCK);
        int callers = 100;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);

        // when
        List<Future<ShipmentId>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return generator.nextId();
            }));
        }
        start.countDown();
        Set<ShipmentId> ids = new HashSet<>();
        for (Future<ShipmentId> future : futures) {
            ids.add(future.get(10, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // then
        assertEquals(callers, ids.size());
        assertEquals(callers, generator.lastIssued());
        List<Long> appended = recording.counters();
        for (int i = 0; i < appended.size(); i++) {
            assertEquals(i + 1L, appended.get(i), "counter log must be strictly increasing");
        }
    }

    @Test
    void constructor_rejectsNulls() {
        assertThrows(IllegalArgumentException.class, () -> new CounterLogIdGenerator(null, CLOCK));
        assertThrows(IllegalArgumentException.class, () -> new CounterLogIdGenerator(new RecordingCounterLog(), null));
    }

    private static final class RecordingCounterLog implements CounterLog {

        private final List<CounterRecord> records = Collections.synchronizedList(new ArrayList<>());

        @Override
        public long lastCounter() {
            synchronized (records) {
                return records.isEmpty() ? 0L : records.get(records.size() - 1).counter();
            }
        }

        @Override
        public void append(CounterRecord record) {
            records.add(record);
        }

        @Override
        public List<CounterRecord> readAll() {
            synchronized (records) {
                return List.copyOf(records);
            }
        }

        List<Long> counters() {
            return readAll().stream().map(CounterRecord::counter).toList();
        }
    }
}
