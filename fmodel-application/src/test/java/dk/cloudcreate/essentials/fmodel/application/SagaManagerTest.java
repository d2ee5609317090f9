package dk.cloudcreate.essentials.fmodel.application;

import dk.cloudcreate.essentials.fmodel.application.test_data.*;
import dk.cloudcreate.essentials.fmodel.application.test_data.CounterCommand.*;
import dk.cloudcreate.essentials.fmodel.application.test_data.CounterEvent.*;
import dk.cloudcreate.essentials.fmodel.domain.Saga;
import org.junit.jupiter.api.*;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class SagaManagerTest {
    /**
     * Mirrors every increment of counter-1 onto counter-2
     */
    private final Saga<CounterEvent, CounterCommand> mirrorSaga = Saga.of(event -> {
        if (event instanceof Incremented incremented && incremented.counterId().equals("counter-1")) {
            return List.of(new Increment("counter-2", incremented.amount()));
        }
        return List.of();
    });

    private List<CounterCommand> published;

    @BeforeEach
    void setup() {
        published = new ArrayList<>();
    }

    @Test
    void the_actions_computed_by_the_saga_are_published() {
        // Given
        var sagaManager = SagaManager.from(mirrorSaga, actions -> {
            published.addAll(actions);
            return Mono.just(actions);
        });

        // When
        StepVerifier.create(sagaManager.handle(new Incremented("counter-1", 4)))
                    // Then
                    .expectNext(List.of(new Increment("counter-2", 4)))
                    .verifyComplete();

        assertThat(published).containsExactly(new Increment("counter-2", 4));
    }

    @Test
    void an_action_result_without_reaction_publishes_nothing() {
        // Given
        var sagaManager = SagaManager.from(mirrorSaga, actions -> {
            published.addAll(actions);
            return Mono.just(actions);
        });

        // When
        StepVerifier.create(sagaManager.handle(new Decremented("counter-1", 4)))
                    // Then
                    .expectNext(List.of())
                    .verifyComplete();

        assertThat(published).isEmpty();
        assertThat(sagaManager.computeNewActions(new Incremented("counter-3", 1))).isEmpty();
    }

    @Test
    void a_publish_failure_is_passed_through_unchanged() {
        // Given
        var failure     = new AggregateException("Broker unavailable");
        var sagaManager = SagaManager.<CounterEvent, CounterCommand>from(mirrorSaga, actions -> Mono.error(failure));

        // When
        StepVerifier.create(sagaManager.handle(new Incremented("counter-1", 4)))
                    // Then
                    .expectErrorSatisfies(error -> assertThat(error).isSameAs(failure))
                    .verify();
    }
}
