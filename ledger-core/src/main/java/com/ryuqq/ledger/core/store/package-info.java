/**
 * Building blocks shared by event store adapters.
 *
 * @since 1.0.0
 * @author Ledger Team
 */
package com.ryuqq.ledger.core.store;
