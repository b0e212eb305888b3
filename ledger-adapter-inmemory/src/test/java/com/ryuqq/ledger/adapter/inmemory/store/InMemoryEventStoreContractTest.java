package com.ryuqq.ledger.adapter.inmemory.store;

import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.AppendResult;
import com.ryuqq.ledger.core.spi.EventStore;
import com.ryuqq.ledger.testkit.contract.AbstractEventStoreContractTest;
import com.ryuqq.ledger.testkit.contract.TestEvents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Tests for {@link InMemoryEventStore}.
 *
 * @author Ledger Team
 * @since 1.0.0
 */
class InMemoryEventStoreContractTest extends AbstractEventStoreContractTest {

    @Override
    protected EventStore createStore() {
        return new InMemoryEventStore();
    }

    @Test
    @DisplayName("서로 다른 Shipment에 동시에 append해도 각자 1부터 순번이 할당된다")
    void concurrentAppends_acrossShipments_areIndependent() throws Exception {
        // when
        List<AppendResult> results = runConcurrently(40,
            i -> () -> store.append(TestEvents.created(TestEvents.shipment(i + 1))));

        // then
        assertTrue(results.stream().allMatch(AppendResult::isAppended));
        assertEquals(40, store.shipmentIds().size());
        for (ShipmentId id : store.shipmentIds()) {
            assertEquals(1L, store.lastSequence(id));
        }
    }

    @Test
    @DisplayName("clear() 후에는 비어 있고 corruptRecords는 항상 비어 있다")
    void clear_resetsStore() {
        InMemoryEventStore inMemory = (InMemoryEventStore) store;
        inMemory.append(TestEvents.created(TestEvents.shipment(1)));
        assertEquals(1, inMemory.size());

        inMemory.clear();

        assertEquals(0, inMemory.size());
        assertTrue(inMemory.shipmentIds().isEmpty());
        assertTrue(inMemory.corruptRecords().isEmpty());
    }
}
