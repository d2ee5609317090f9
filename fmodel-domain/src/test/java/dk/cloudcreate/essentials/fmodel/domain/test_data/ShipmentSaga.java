package dk.cloudcreate.essentials.fmodel.domain.test_data;

import dk.cloudcreate.essentials.fmodel.domain.Saga;
import dk.cloudcreate.essentials.fmodel.domain.test_data.OrderCommand.UpdateOrder;

import java.util.List;

/**
 * Marks the shipped items on the order
 */
public final class ShipmentSaga {
    private ShipmentSaga() {
    }

    public static Saga<ShipmentEvent, OrderCommand> create() {
        return Saga.of(event -> List.of(new UpdateOrder(((ShipmentEvent.ShipmentCreated) event).orderId(),
                                                        List.of("Shipped"))));
    }
}
