package dk.cloudcreate.essentials.fmodel.domain;

import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.*;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A {@link View} represents the event handling algorithm of a read side projection.<br>
 * It is the {@link Decider} without the decision function: a view never produces events, it only consumes them.
 *
 * @param <S> the projected state type
 * @param <E> the event type
 */
public interface View<S, E> {
    static <S, E> View<S, E> of(BiFunction<? super S, ? super E, ? extends S> evolve,
                                Supplier<? extends S> initialState) {
        requireNonNull(evolve, "You must supply an evolve function");
        requireNonNull(initialState, "You must supply an initialState function");
        return new View<>() {
            @Override
            public S evolve(S state, E event) {
                requireNonNull(event, "No event provided");
                return evolve.apply(state, event);
            }

            @Override
            public S initialState() {
                return initialState.get();
            }
        };
    }

    /**
     * Apply the <code>event</code> on the <code>state</code>. MUST be total and deterministic.
     */
    S evolve(S state, E event);

    S initialState();

    default S evolveAll(S state, List<? extends E> events) {
        requireNonNull(events, "No events provided");
        var currentState = state;
        for (E event : events) {
            currentState = evolve(currentState, event);
        }
        return currentState;
    }

    /**
     * Apply the <code>events</code> on the <code>currentState</code> or, if there's no current state, on the {@link #initialState()}
     *
     * @param currentState the current projected state if it exists
     * @param events       the events to apply in order
     * @return the new projected state
     */
    default S computeNewState(Optional<S> currentState, List<? extends E> events) {
        requireNonNull(currentState, "No currentState Optional provided");
        return evolveAll(currentState.orElseGet(this::initialState), events);
    }

    /**
     * Contravariant mapping on the event type
     *
     * @param eventMapper maps the new event type to this views event type
     * @param <E2>        the new event type
     * @return a new {@link View} that handles <code>E2</code> events
     */
    default <E2> View<S, E2> mapOnEvent(Function<? super E2, ? extends E> eventMapper) {
        requireNonNull(eventMapper, "You must supply an eventMapper");
        return of((state, event) -> evolve(state, eventMapper.apply(event)),
                  this::initialState);
    }

    default <S2> View<S2, E> mapOnState(Function<? super S2, ? extends S> toState,
                                        Function<? super S, ? extends S2> fromState) {
        requireNonNull(toState, "You must supply a toState mapper");
        requireNonNull(fromState, "You must supply a fromState mapper");
        return of((state, event) -> fromState.apply(evolve(toState.apply(state), event)),
                  () -> fromState.apply(initialState()));
    }

    /**
     * Product composition over disjoint event types: every event is routed to the {@link View} owning its {@link Sum} variant,
     * the state of the other {@link View} is left untouched.
     *
     * @param other the view to combine with
     * @see #merge(View)
     */
    default <S2, E2> View<Pair<S, S2>, Sum<E, E2>> combine(View<S2, E2> other) {
        requireNonNull(other, "You must supply the View to combine with");
        return of((state, event) -> event.fold(
                          e -> new Pair<>(this.evolve(state._1(), e), state._2()),
                          e2 -> new Pair<>(state._1(), other.evolve(state._2(), e2))),
                  () -> new Pair<>(this.initialState(), other.initialState()));
    }

    /**
     * Merge two views that subscribe to the same event type: every event is applied to both views
     *
     * @param other the view to merge with
     */
    default <S2> View<Pair<S, S2>, E> merge(View<S2, E> other) {
        requireNonNull(other, "You must supply the View to merge with");
        return of((state, event) -> new Pair<>(this.evolve(state._1(), event),
                                               other.evolve(state._2(), event)),
                  () -> new Pair<>(this.initialState(), other.initialState()));
    }
}
