/**
 * Shipment identifier issuance backed by a durable counter log.
 *
 * @since 1.0.0
 * @author Ledger Team
 */
package com.ryuqq.ledger.core.id;
