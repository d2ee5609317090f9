package dk.cloudcreate.essentials.fmodel.specification;

import dk.cloudcreate.essentials.fmodel.domain.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static org.assertj.core.api.Assertions.*;

/**
 * Given/When/Then test specification for a {@link Decider}.<br>
 * Event sourced style, where the current state is the result of folding the given events:
 * <pre>{@code
 * DeciderTestSpecification.forDecider(orderDecider)
 *                         .given(new OrderCreated(1, "John Doe", List.of("Item 1")))
 *                         .when(new CancelOrder(1))
 *                         .then(new OrderCancelled(1));
 * }</pre>
 * State stored style, where the current state is given directly:
 * <pre>{@code
 * DeciderTestSpecification.forDecider(orderDecider)
 *                         .givenState(new OrderState(1, "John Doe", List.of("Item 1"), false))
 *                         .when(new CancelOrder(1))
 *                         .thenState(new OrderState(1, "John Doe", List.of("Item 1"), true));
 * }</pre>
 * Use {@link #thenError(Object)} to specify that the command must be rejected.
 *
 * @param <C>     the command type
 * @param <S>     the state type
 * @param <E>     the event type
 * @param <ERROR> the domain error type
 */
public final class DeciderTestSpecification<C, S, E, ERROR> {
    private final Decider<C, S, E, ERROR> decider;
    private final List<E>                 givenEvents = new ArrayList<>();
    private       Optional<S>             givenState  = Optional.empty();
    private       C                       command;

    public static <C, S, E, ERROR> DeciderTestSpecification<C, S, E, ERROR> forDecider(Decider<C, S, E, ERROR> decider) {
        return new DeciderTestSpecification<>(decider);
    }

    private DeciderTestSpecification(Decider<C, S, E, ERROR> decider) {
        this.decider = requireNonNull(decider, "You must supply a Decider");
    }

    /**
     * The events that have already happened. Can't be combined with {@link #givenState(Object)}
     */
    public DeciderTestSpecification<C, S, E, ERROR> given(List<? extends E> events) {
        requireNonNull(events, "No events provided");
        if (givenState.isPresent()) {
            throw new IllegalStateException("Specify either the given events or the given state, not both");
        }
        givenEvents.addAll(events);
        return this;
    }

    @SafeVarargs
    public final DeciderTestSpecification<C, S, E, ERROR> given(E... events) {
        return given(Arrays.asList(events));
    }

    /**
     * The current state. Can't be combined with {@link #given(List)}
     */
    public DeciderTestSpecification<C, S, E, ERROR> givenState(S state) {
        requireNonNull(state, "No state provided");
        if (!givenEvents.isEmpty()) {
            throw new IllegalStateException("Specify either the given events or the given state, not both");
        }
        givenState = Optional.of(state);
        return this;
    }

    public DeciderTestSpecification<C, S, E, ERROR> when(C command) {
        this.command = requireNonNull(command, "No command provided");
        return this;
    }

    /**
     * Assert that the command results in exactly the <code>expectedEvents</code> (in order)
     */
    public void then(List<? extends E> expectedEvents) {
        requireNonNull(expectedEvents, "No expectedEvents provided");
        var result = decide();
        if (result.isFailure()) {
            fail(msg("Expected command '{}' to result in events {} but it was rejected with error '{}'", command, expectedEvents, result.error()));
        }
        assertThat(result.value()).as("Events decided for command '%s'", command)
                                  .containsExactlyElementsOf(expectedEvents);
    }

    @SafeVarargs
    public final void then(E... expectedEvents) {
        then(Arrays.asList(expectedEvents));
    }

    /**
     * Assert that applying the events the command results in to the current state gives the <code>expectedState</code>
     */
    public void thenState(S expectedState) {
        var result = decide();
        if (result.isFailure()) {
            fail(msg("Expected command '{}' to result in state '{}' but it was rejected with error '{}'", command, expectedState, result.error()));
        }
        var newState = decider.evolveAll(currentState(), result.value());
        assertThat(newState).as("State after command '%s'", command)
                            .isEqualTo(expectedState);
    }

    /**
     * Assert that the command is rejected with the <code>expectedError</code>
     */
    public void thenError(ERROR expectedError) {
        requireNonNull(expectedError, "No expectedError provided");
        var result = decide();
        if (result.isSuccess()) {
            fail(msg("Expected command '{}' to be rejected with error '{}' but it resulted in events {}", command, expectedError, result.value()));
        }
        assertThat(result.error()).as("Error for command '%s'", command)
                                  .isEqualTo(expectedError);
    }

    private Result<List<E>, ERROR> decide() {
        if (command == null) {
            throw new IllegalStateException("You must specify the command using when(command) before specifying the expected outcome");
        }
        return decider.decide(command, currentState());
    }

    private S currentState() {
        return givenState.orElseGet(() -> decider.evolveAll(decider.initialState(), givenEvents));
    }
}
