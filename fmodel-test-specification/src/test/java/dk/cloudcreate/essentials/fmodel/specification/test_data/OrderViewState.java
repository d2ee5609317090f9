package dk.cloudcreate.essentials.fmodel.specification.test_data;

import java.util.List;

public record OrderViewState(long orderId, String customerName, List<String> items, boolean isCancelled) {
    public static final OrderViewState INITIAL = new OrderViewState(0, "", List.of(), false);
}
