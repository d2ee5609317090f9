package dk.cloudcreate.essentials.fmodel.inmemory.test_data;

import dk.cloudcreate.essentials.fmodel.domain.*;
import dk.cloudcreate.essentials.fmodel.inmemory.test_data.OrderCommand.*;
import dk.cloudcreate.essentials.fmodel.inmemory.test_data.OrderEvent.*;

import java.util.List;

public final class OrderDecider {
    private OrderDecider() {
    }

    public static Decider<OrderCommand, OrderState, OrderEvent, OrderError> create() {
        return Decider.of(OrderDecider::decide,
                          OrderDecider::evolve,
                          () -> OrderState.INITIAL);
    }

    static Result<List<OrderEvent>, OrderError> decide(OrderCommand command, OrderState state) {
        if (command instanceof CreateOrder create) {
            return Result.success(List.of(new OrderCreated(create.orderId(), create.customerName(), create.items())));
        }
        if (state.orderId() != command.orderId()) {
            // Not our order
            return Result.success(List.of());
        }
        if (state.isCancelled()) {
            return Result.failure(new OrderError(command.orderId(), "Order is already cancelled"));
        }
        if (command instanceof UpdateOrder update) {
            return Result.success(List.of(new OrderUpdated(update.orderId(), update.newItems())));
        }
        if (command instanceof CancelOrder cancel) {
            return Result.success(List.of(new OrderCancelled(cancel.orderId())));
        }
        throw new IllegalStateException("Unsupported command " + command);
    }

    static OrderState evolve(OrderState state, OrderEvent event) {
        if (event instanceof OrderCreated created) {
            return new OrderState(created.orderId(), created.customerName(), created.items(), false);
        }
        if (event instanceof OrderUpdated updated) {
            return new OrderState(state.orderId(), state.customerName(), updated.updatedItems(), state.isCancelled());
        }
        if (event instanceof OrderCancelled) {
            return new OrderState(state.orderId(), state.customerName(), state.items(), true);
        }
        throw new IllegalStateException("Unsupported event " + event);
    }
}
