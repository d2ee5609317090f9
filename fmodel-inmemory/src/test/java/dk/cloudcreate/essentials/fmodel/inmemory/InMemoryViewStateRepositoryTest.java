package dk.cloudcreate.essentials.fmodel.inmemory;

import dk.cloudcreate.essentials.fmodel.application.*;
import dk.cloudcreate.essentials.fmodel.application.types.Version;
import dk.cloudcreate.essentials.fmodel.inmemory.test_data.*;
import dk.cloudcreate.essentials.fmodel.inmemory.test_data.OrderEvent.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import org.junit.jupiter.api.*;
import reactor.test.StepVerifier;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class InMemoryViewStateRepositoryTest {
    private InMemoryViewStateRepository<OrderEvent, OrderViewState>  repository;
    private MaterializedView<OrderViewState, OrderEvent, Version> materializedView;

    @BeforeEach
    void setup() {
        repository = InMemoryViewStateRepository.usingIdentifiers();
        materializedView = MaterializedView.from(OrderView.create(), repository);
    }

    @Test
    void events_are_projected_into_the_view_state_of_their_order() {
        // When
        StepVerifier.create(materializedView.handle(new OrderCreated(1, "John Doe", List.of("Item 1", "Item 2"))))
                    // Then
                    .expectNext(new Pair<>(new OrderViewState(1, "John Doe", List.of("Item 1", "Item 2"), false), Version.of(0)))
                    .verifyComplete();

        // When
        materializedView.handle(new OrderUpdated(1, List.of("Item 3", "Item 4"))).block();
        StepVerifier.create(materializedView.handle(new OrderCancelled(1)))
                    // Then
                    .expectNext(new Pair<>(new OrderViewState(1, "John Doe", List.of("Item 3", "Item 4"), true), Version.of(2)))
                    .verifyComplete();
    }

    @Test
    void view_states_of_different_orders_are_kept_apart() {
        // When
        materializedView.handle(new OrderCreated(1, "John Doe", List.of("Item 1"))).block();
        materializedView.handle(new OrderCreated(2, "Jane Doe", List.of("Item 2"))).block();
        materializedView.handle(new OrderCancelled(2)).block();

        // Then
        assertThat(repository.findState("1")).contains(new Pair<>(new OrderViewState(1, "John Doe", List.of("Item 1"), false), Version.of(0)));
        assertThat(repository.findState("2")).contains(new Pair<>(new OrderViewState(2, "Jane Doe", List.of("Item 2"), true), Version.of(1)));
    }

    @Test
    void events_for_orders_without_a_view_state_are_saved_under_the_identity_of_the_event() {
        // When
        StepVerifier.create(materializedView.handle(new OrderUpdated(5, List.of("Item 1"))))
                    // Then
                    .expectNext(new Pair<>(new OrderViewState(0, "", List.of("Item 1"), false), Version.FIRST_VERSION))
                    .verifyComplete();

        // When
        StepVerifier.create(materializedView.handle(new OrderCancelled(6)))
                    // Then
                    .expectNext(new Pair<>(new OrderViewState(0, "", List.of(), true), Version.FIRST_VERSION))
                    .verifyComplete();

        assertThat(repository.findState("0")).isEmpty();
        assertThat(repository.findState("5")).isPresent();
        assertThat(repository.findState("6")).isPresent();
    }

    @Test
    void saving_a_view_state_with_a_stale_version_fails() {
        // Given
        var viewState = new OrderViewState(1, "John Doe", List.of("Item 1"), false);
        repository.save(viewState, Optional.empty()).block();

        // When
        StepVerifier.create(repository.save(viewState, Optional.empty()))
                    // Then
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(OptimisticConcurrencyException.class);
                        var conflict = (OptimisticConcurrencyException) error;
                        assertThat(conflict.identity).isEqualTo("1");
                        assertThat(conflict.expectedVersion).isEqualTo(Optional.empty());
                        assertThat(conflict.actualVersion).isEqualTo(Optional.of(Version.FIRST_VERSION));
                    })
                    .verify();

        assertThat(repository.findState("1")).contains(new Pair<>(viewState, Version.FIRST_VERSION));
    }
}
