package com.ryuqq.ledger.core.id;

import com.ryuqq.ledger.core.exception.StorageFailureException;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.CounterLog;
import com.ryuqq.ledger.core.spi.CounterRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link CounterLog} 기반 식별자 발급기.
 *
 * <p>발급할 카운터를 먼저 카운터 로그에 append한 뒤에 ID를 반환합니다.
 * 증가와 사용 사이에 크래시가 발생해도 해당 값은 이미 기록되어 있으므로
 * 재시작 후 같은 값이 다시 발급되지 않습니다 (건너뛴 값은 영구 결번).</p>
 *
 * <p><strong>발급 흐름:</strong></p>
 * <pre>
 * lock
 *   1. next = max(lastIssued, counterLog.lastCounter()) + 1
 *   2. counterLog.append({counter: next, timestamp, action: ID_GENERATED})  (durable)
 *   3. lastIssued = next
 * unlock
 * return SHP-{next:010d}
 * </pre>
 *
 * <p><strong>실패 처리:</strong> 카운터 로그를 읽거나 쓸 수 없으면
 * {@link StorageFailureException}을 그대로 전파하며, 내부 카운터는 증가하지 않습니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class CounterLogIdGenerator implements ShipmentIdGenerator {

    private static final Logger log = LoggerFactory.getLogger(CounterLogIdGenerator.class);

    private final CounterLog counterLog;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private long lastIssued;

    /**
     * 생성자.
     *
     * <p>생성 시점에 카운터 로그의 마지막 값을 읽습니다.</p>
     *
     * @param counterLog 카운터 로그
     * @param clock 발급 시각 기록용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws StorageFailureException 카운터 로그를 읽을 수 없는 경우
     */
    public CounterLogIdGenerator(CounterLog counterLog, Clock clock) {
        if (counterLog == null) {
            throw new IllegalArgumentException("counterLog cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.counterLog = counterLog;
        this.clock = clock;
        this.lastIssued = counterLog.lastCounter();
        log.info("Shipment id generator resumed at counter {}", lastIssued);
    }

    @Override
    public ShipmentId nextId() {
        lock.lock();
        try {
            long next = Math.addExact(Math.max(lastIssued, counterLog.lastCounter()), 1L);
            try {
                counterLog.append(CounterRecord.issued(next, clock.instant()));
            } catch (StorageFailureException e) {
                log.error("Failed to persist shipment counter {}; issuance aborted", next, e);
                throw e;
            }
            lastIssued = next;
            return ShipmentId.fromCounter(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 마지막으로 발급한 카운터.
     *
     * @return 마지막 카운터 (발급 이력이 없으면 0)
     */
    public long lastIssued() {
        lock.lock();
        try {
            return lastIssued;
        } finally {
            lock.unlock();
        }
    }
}
