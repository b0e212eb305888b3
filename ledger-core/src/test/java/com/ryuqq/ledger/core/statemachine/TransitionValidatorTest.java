package com.ryuqq.ledger.core.statemachine;

import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransitionValidator 테스트")
class TransitionValidatorTest {

    private final TransitionValidator validator = TransitionValidator.standard();
    private final ShipmentId id = ShipmentId.fromCounter(1);

    @Test
    @DisplayName("그래프와 권한을 모두 만족하면 Accept(newState)")
    void validTransition_isAccepted() {
        Verdict verdict = validator.validate(id, EventType.SUPERVISOR_APPROVED, Role.SENDER_SUPERVISOR, LifecycleState.MANAGER_APPROVED);

        assertTrue(verdict.isAccepted());
        assertEquals(LifecycleState.SUPERVISOR_APPROVED, ((Accept) verdict).newState());
    }

    @Test
    @DisplayName("그래프에 없는 전이는 권한과 무관하게 INVALID_TRANSITION")
    void invalidTransition_isCheckedFirst() {
        Verdict verdict = validator.validate(id, EventType.DELIVERED, Role.SENDER, LifecycleState.CREATED);

        assertTrue(verdict.isRejected());
        assertEquals(RejectReason.INVALID_TRANSITION, ((Reject) verdict).reason());
        assertTrue(((Reject) verdict).message().contains(id.getValue()));
    }

    @Test
    @DisplayName("그래프에 있지만 Role이 소유자가 아니면 UNAUTHORIZED")
    void wrongRole_isUnauthorized() {
        Verdict verdict = validator.validate(id, EventType.SUPERVISOR_APPROVED, Role.SENDER_MANAGER, LifecycleState.MANAGER_APPROVED);

        assertEquals(RejectReason.UNAUTHORIZED, ((Reject) verdict).reason());
    }

    @Test
    @DisplayName("최초 생성은 SENDER만 가능하다")
    void creation_requiresSender() {
        assertTrue(validator.validate(id, EventType.CREATED, Role.SENDER, null).isAccepted());
        assertEquals(RejectReason.UNAUTHORIZED,
            ((Reject) validator.validate(id, EventType.CREATED, Role.SYSTEM, null)).reason());
    }

    @Test
    @DisplayName("필수 인자가 null이면 IllegalArgumentException")
    void nullArguments_areRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> validator.validate(null, EventType.CREATED, Role.SENDER, null));
        assertThrows(IllegalArgumentException.class,
            () -> validator.validate(id, null, Role.SENDER, null));
        assertThrows(IllegalArgumentException.class,
            () -> validator.validate(id, EventType.CREATED, null, null));
    }
}
