/**
 * Whole-log integrity audit and operational summary.
 *
 * <p>The audit never throws on the first error: every violation is collected into an
 * {@link com.ryuqq.ledger.core.audit.AuditReport}.</p>
 *
 * @since 1.0.0
 * @author Ledger Team
 */
package com.ryuqq.ledger.core.audit;
