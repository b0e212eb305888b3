/**
 * Core value objects of the shipment ledger.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ledger.core.model.ShipmentId} - Shipment identifier issued from the counter log</li>
 *   <li>{@link com.ryuqq.ledger.core.model.EventId} - Globally unique event identifier (idempotency key)</li>
 *   <li>{@link com.ryuqq.ledger.core.model.Payload} - Read-only key/value data attached to an event</li>
 *   <li>{@link com.ryuqq.ledger.core.model.EventType} - Canonical event catalog</li>
 *   <li>{@link com.ryuqq.ledger.core.model.Role} - Actor capability that emits events</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Ledger Team
 */
package com.ryuqq.ledger.core.model;
