/**
 * Read model of the ledger: shipment state reconstructed by folding events.
 *
 * @since 1.0.0
 * @author Ledger Team
 */
package com.ryuqq.ledger.core.projection;
