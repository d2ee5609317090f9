package dk.cloudcreate.essentials.fmodel.domain.test_data;

import dk.cloudcreate.essentials.fmodel.domain.Identifier;

import java.util.List;

public sealed interface OrderCommand extends Identifier {
    long orderId();

    @Override
    default String identifier() {
        return String.valueOf(orderId());
    }

    record CreateOrder(long orderId, String customerName, List<String> items) implements OrderCommand {
    }

    record UpdateOrder(long orderId, List<String> newItems) implements OrderCommand {
    }

    record CancelOrder(long orderId) implements OrderCommand {
    }
}
