package dk.cloudcreate.essentials.fmodel.specification.test_data;

import java.util.List;

public record OrderState(long orderId, String customerName, List<String> items, boolean isCancelled) {
    public static final OrderState INITIAL = new OrderState(0, "", List.of(), false);
}
