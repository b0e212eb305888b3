/**
 * Storage SPI of the shipment ledger.
 *
 * <p>The validator, projector and audit logic only see these interfaces, so any
 * durable log can be plugged in.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.ledger.core.spi.EventStore} - append-only event log</li>
 *   <li>{@link com.ryuqq.ledger.core.spi.CounterLog} - append-only identifier counter log</li>
 * </ul>
 *
 * @see com.ryuqq.ledger.core.store.EventLogIndex
 * @author Ledger Team
 * @since 1.0.0
 */
package com.ryuqq.ledger.core.spi;
