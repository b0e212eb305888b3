/**
 * Lifecycle engine: the write path and read operations of the shipment ledger.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.ledger.application.engine.LifecycleEngine}: facade used by callers</li>
 *   <li>{@link com.ryuqq.ledger.application.engine.DefaultLifecycleEngine}: validate, append, project</li>
 *   <li>{@link com.ryuqq.ledger.application.engine.TransitionResult}: accepted or rejected outcome</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Ledger Team
 */
package com.ryuqq.ledger.application.engine;
