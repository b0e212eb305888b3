/**
 * Durable storage adapter: newline-delimited JSON append files.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.ledger.adapter.file.FileEventStore}: event log ({@code shipments.jsonl})</li>
 *   <li>{@link com.ryuqq.ledger.adapter.file.FileCounterLog}: identifier counter log ({@code shipment_counter.jsonl})</li>
 *   <li>{@link com.ryuqq.ledger.adapter.file.FileStoreConfig}: locations, fsync and read strictness</li>
 * </ul>
 *
 * <p>Records are encoded with Jackson; instants are written as ISO-8601 strings.</p>
 *
 * @see com.ryuqq.ledger.core.spi.EventStore
 * @see com.ryuqq.ledger.core.spi.CounterLog
 * @author Ledger Team
 * @since 1.0.0
 */
package com.ryuqq.ledger.adapter.file;
