/**
 * Reusable contract tests for storage adapters.
 *
 * <p>Each adapter module extends {@link com.ryuqq.ledger.testkit.contract.AbstractEventStoreContractTest}
 * and {@link com.ryuqq.ledger.testkit.contract.AbstractCounterLogContractTest} from its own test
 * sources, supplying a fresh store per test.</p>
 *
 * @since 1.0.0
 * @author Ledger Team
 */
package com.ryuqq.ledger.testkit.contract;
