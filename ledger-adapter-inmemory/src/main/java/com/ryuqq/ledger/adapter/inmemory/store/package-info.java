/**
 * In-memory storage adapter package.
 *
 * <p>Reference implementations of the ledger storage SPI, used by tests and by callers
 * that embed the ledger without durability requirements.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.ledger.adapter.inmemory.store.InMemoryEventStore}:
 *       per-shipment locked implementation of {@link com.ryuqq.ledger.core.spi.EventStore}</li>
 *   <li>{@link com.ryuqq.ledger.adapter.inmemory.store.InMemoryCounterLog}:
 *       implementation of {@link com.ryuqq.ledger.core.spi.CounterLog}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.ledger.core.spi.EventStore
 * @see com.ryuqq.ledger.core.spi.CounterLog
 * @author Ledger Team
 * @since 1.0.0
 */
package com.ryuqq.ledger.adapter.inmemory.store;
