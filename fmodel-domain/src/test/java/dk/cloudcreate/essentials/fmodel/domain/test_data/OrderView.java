package dk.cloudcreate.essentials.fmodel.domain.test_data;

import dk.cloudcreate.essentials.fmodel.domain.View;
import dk.cloudcreate.essentials.fmodel.domain.test_data.OrderEvent.*;

public final class OrderView {
    private OrderView() {
    }

    public static View<OrderViewState, OrderEvent> create() {
        return View.of(OrderView::evolve, () -> OrderViewState.INITIAL);
    }

    static OrderViewState evolve(OrderViewState state, OrderEvent event) {
        if (event instanceof OrderCreated created) {
            return new OrderViewState(created.orderId(), created.customerName(), created.items(), false);
        }
        if (event instanceof OrderUpdated updated) {
            return new OrderViewState(state.orderId(), state.customerName(), updated.updatedItems(), state.isCancelled());
        }
        if (event instanceof OrderCancelled) {
            return new OrderViewState(state.orderId(), state.customerName(), state.items(), true);
        }
        throw new IllegalStateException("Unsupported event " + event);
    }
}
