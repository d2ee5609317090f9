package dk.cloudcreate.essentials.fmodel.domain.test_data;

import java.util.List;

public record ShipmentState(long shipmentId, long orderId, String customerName, List<String> items) {
    public static final ShipmentState INITIAL = new ShipmentState(0, 0, "", List.of());
}
