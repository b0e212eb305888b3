package com.ryuqq.ledger.core.projection;

import com.ryuqq.ledger.core.event.ShipmentEvent;

import java.util.Optional;

/**
 * Projector fold의 누적값.
 *
 * <ul>
 *   <li>{@link NotCreated}: 아직 이벤트를 하나도 접지 않음</li>
 *   <li>{@link Created}: 하나 이상의 이벤트가 반영된 프로젝션 보유</li>
 * </ul>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
sealed interface ProjectionAccumulator permits ProjectionAccumulator.NotCreated, ProjectionAccumulator.Created {

    ProjectionAccumulator fold(ShipmentEvent event);

    Optional<ShipmentProjection> projection();

    static ProjectionAccumulator empty() {
        return NotCreated.INSTANCE;
    }

    enum NotCreated implements ProjectionAccumulator {
        INSTANCE;

        @Override
        public ProjectionAccumulator fold(ShipmentEvent event) {
            return new Created(ShipmentProjection.start(event));
        }

        @Override
        public Optional<ShipmentProjection> projection() {
            return Optional.empty();
        }
    }

    record Created(ShipmentProjection current) implements ProjectionAccumulator {

        @Override
        public ProjectionAccumulator fold(ShipmentEvent event) {
            return new Created(current.apply(event));
        }

        @Override
        public Optional<ShipmentProjection> projection() {
            return Optional.of(current);
        }
    }
}
