package dk.cloudcreate.essentials.fmodel.specification.test_data;

import dk.cloudcreate.essentials.fmodel.domain.Identifier;

import java.util.List;

public sealed interface OrderEvent extends Identifier {
    long orderId();

    @Override
    default String identifier() {
        return String.valueOf(orderId());
    }

    record OrderCreated(long orderId, String customerName, List<String> items) implements OrderEvent {
    }

    record OrderUpdated(long orderId, List<String> updatedItems) implements OrderEvent {
    }

    record OrderCancelled(long orderId) implements OrderEvent {
    }
}
