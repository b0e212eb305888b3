/**
 * Shipment lifecycle state machine package.
 *
 * <p>This package holds the static lifecycle tables and the validator that
 * decides whether a proposed event may be appended.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ledger.core.statemachine.LifecycleState} - Lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.ledger.core.statemachine.LifecycleGraph} - (state, event) → state lookup table</li>
 *   <li>{@link com.ryuqq.ledger.core.statemachine.AuthorityMatrix} - (state, role) → permitted events</li>
 *   <li>{@link com.ryuqq.ledger.core.statemachine.TransitionValidator} - Graph check, then authority check</li>
 *   <li>{@link com.ryuqq.ledger.core.statemachine.Verdict} - Accept / Reject result</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TransitionValidator validator = TransitionValidator.standard();
 * Verdict verdict = validator.validate(shipmentId, EventType.MANAGER_APPROVED,
 *         Role.SENDER_MANAGER, LifecycleState.CREATED);
 *
 * if (verdict instanceof Accept accept) {
 *     // accept.newState() == MANAGER_APPROVED
 * }
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Closed world:</strong> Any (state, event) pair not defined is forbidden</li>
 *   <li><strong>State-bound authority:</strong> Authority is a pure function of the current state</li>
 *   <li><strong>Values, not exceptions:</strong> Rejections are returned, never thrown</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Ledger Team
 */
package com.ryuqq.ledger.core.statemachine;
