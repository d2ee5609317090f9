package dk.cloudcreate.essentials.fmodel.domain;

import dk.cloudcreate.essentials.shared.functional.tuple.*;

import java.util.*;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A {@link Decider} represents the main decision-making algorithm of a single business decision-making unit (typically an aggregate).<br>
 * It is a pure domain component that consists of three functions:
 * <ul>
 *     <li>{@link #decide(Object, Object)} - given a command and the current state, decide which events (facts) that should be recorded
 *     or reject the command with a domain specific error</li>
 *     <li>{@link #evolve(Object, Object)} - given the current state and an event, produce the next state. MUST be total and deterministic</li>
 *     <li>{@link #initialState()} - the state before any event has been applied, i.e. the seed of a left fold over the events</li>
 * </ul>
 * A {@link Decider} can be specialized for any command, state, event and error type, since these types don't affect its behaviour.<br>
 * All combinators (e.g. {@link #mapOnCommand(Function)} or {@link #combine(Decider)}) return a new {@link Decider} and never modify this instance,
 * so a {@link Decider} can be shared freely between threads.
 * <p>
 * Example:
 * <pre>{@code
 * Decider<OrderCommand, OrderState, OrderEvent, OrderError> decider =
 *       Decider.of((command, state) -> ...,
 *                  (state, event) -> ...,
 *                  () -> OrderState.INITIAL);
 * }</pre>
 *
 * @param <C>     the command type
 * @param <S>     the state type
 * @param <E>     the event type
 * @param <ERROR> the domain error type returned when a command is rejected
 */
public interface Decider<C, S, E, ERROR> {
    /**
     * Create a {@link Decider} from its three functions
     *
     * @param decide       the decision function
     * @param evolve       the evolution function
     * @param initialState supplies the initial state
     * @return a new immutable {@link Decider}
     */
    static <C, S, E, ERROR> Decider<C, S, E, ERROR> of(BiFunction<? super C, ? super S, Result<List<E>, ERROR>> decide,
                                                       BiFunction<? super S, ? super E, ? extends S> evolve,
                                                       Supplier<? extends S> initialState) {
        return new FunctionalDecider<>(decide, evolve, initialState);
    }

    /**
     * Create a {@link Decider} whose decision function never rejects a command
     *
     * @param decide       the decision function
     * @param evolve       the evolution function
     * @param initialState supplies the initial state
     * @return a new immutable {@link Decider}
     */
    static <C, S, E, ERROR> Decider<C, S, E, ERROR> ofInfallible(BiFunction<? super C, ? super S, List<E>> decide,
                                                                 BiFunction<? super S, ? super E, ? extends S> evolve,
                                                                 Supplier<? extends S> initialState) {
        requireNonNull(decide, "You must supply a decide function");
        return of((command, state) -> Result.success(decide.apply(command, state)),
                  evolve,
                  initialState);
    }

    /**
     * Decide which events the <code>command</code> results in given the current <code>state</code>.<br>
     * An empty event list means the command was accepted but didn't result in any change (no-op), which is different from
     * a {@link Result.Failure}, which means the command was rejected.
     *
     * @param command the command (read only)
     * @param state   the current state (read only)
     * @return the events (in the order they should be applied) or the error explaining why the command was rejected
     */
    Result<List<E>, ERROR> decide(C command, S state);

    /**
     * Apply the <code>event</code> on the <code>state</code> and return the resulting state
     *
     * @param state the current state (read only)
     * @param event the event to apply
     * @return the new state
     */
    S evolve(S state, E event);

    S initialState();

    /**
     * Left fold the <code>events</code> onto <code>state</code> using {@link #evolve(Object, Object)}
     *
     * @param state  the state to start from
     * @param events the events to apply in order
     * @return the resulting state
     */
    default S evolveAll(S state, List<? extends E> events) {
        requireNonNull(events, "No events provided");
        var currentState = state;
        for (E event : events) {
            currentState = evolve(currentState, event);
        }
        return currentState;
    }

    // ------------------------------------------------------------------------------------------------------------------------------------------------
    // Computations
    // ------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Event sourced computation: rebuild the current state from <code>currentEvents</code> (starting from {@link #initialState()})
     * and decide on the <code>command</code>
     *
     * @param currentEvents the events already recorded (oldest first)
     * @param command       the command to decide on
     * @return the new events or the error
     */
    default Result<List<E>, ERROR> computeNewEvents(List<? extends E> currentEvents, C command) {
        var currentState = evolveAll(initialState(), currentEvents);
        return decide(command, currentState);
    }

    /**
     * State stored computation: decide on the <code>command</code> against the <code>currentState</code> (or {@link #initialState()}
     * if there isn't any) and apply the resulting events
     *
     * @param currentState the current state if it exists
     * @param command      the command to decide on
     * @return the new state or the error
     */
    default Result<S, ERROR> computeNewState(Optional<S> currentState, C command) {
        requireNonNull(currentState, "No currentState Optional provided");
        var effectiveState = currentState.orElseGet(this::initialState);
        return decide(command, effectiveState).map(events -> evolveAll(effectiveState, events));
    }

    // ------------------------------------------------------------------------------------------------------------------------------------------------
    // Combinators
    // ------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Contravariant mapping on the command type: the <code>commandMapper</code> is applied to every command before it reaches {@link #decide(Object, Object)}
     *
     * @param commandMapper maps the new command type to this deciders command type
     * @param <C2>          the new command type
     * @return a new {@link Decider} that accepts <code>C2</code> commands
     */
    default <C2> Decider<C2, S, E, ERROR> mapOnCommand(Function<? super C2, ? extends C> commandMapper) {
        requireNonNull(commandMapper, "You must supply a commandMapper");
        return of((command, state) -> decide(commandMapper.apply(command), state),
                  this::evolve,
                  this::initialState);
    }

    /**
     * Map both ways between this deciders event type and <code>E2</code>
     *
     * @param toEvent   maps the new event type to this deciders event type (used by evolve)
     * @param fromEvent maps this deciders event type to the new event type (used on the decided events)
     * @param <E2>      the new event type
     * @return a new {@link Decider} that produces and evolves on <code>E2</code> events
     */
    default <E2> Decider<C, S, E2, ERROR> mapOnEvent(Function<? super E2, ? extends E> toEvent,
                                                     Function<? super E, ? extends E2> fromEvent) {
        requireNonNull(toEvent, "You must supply a toEvent mapper");
        requireNonNull(fromEvent, "You must supply a fromEvent mapper");
        return of((command, state) -> decide(command, state).map(events -> mapAll(events, fromEvent)),
                  (state, event) -> evolve(state, toEvent.apply(event)),
                  this::initialState);
    }

    /**
     * Map both ways between this deciders state type and <code>S2</code>
     *
     * @param toState   maps the new state type to this deciders state type
     * @param fromState maps this deciders state type to the new state type
     * @param <S2>      the new state type
     * @return a new {@link Decider} that works on <code>S2</code> state
     */
    default <S2> Decider<C, S2, E, ERROR> mapOnState(Function<? super S2, ? extends S> toState,
                                                     Function<? super S, ? extends S2> fromState) {
        requireNonNull(toState, "You must supply a toState mapper");
        requireNonNull(fromState, "You must supply a fromState mapper");
        return of((command, state) -> decide(command, toState.apply(state)),
                  (state, event) -> fromState.apply(evolve(toState.apply(state), event)),
                  () -> fromState.apply(initialState()));
    }

    /**
     * Map the domain error returned by {@link #decide(Object, Object)}. Errors are transformed, never dropped.
     *
     * @param errorMapper maps this deciders error type to the new error type
     * @param <ERROR2>    the new error type
     * @return a new {@link Decider} that rejects commands with <code>ERROR2</code>
     */
    default <ERROR2> Decider<C, S, E, ERROR2> mapError(Function<? super ERROR, ? extends ERROR2> errorMapper) {
        requireNonNull(errorMapper, "You must supply an errorMapper");
        return of((command, state) -> decide(command, state).mapError(errorMapper),
                  this::evolve,
                  this::initialState);
    }

    /**
     * Adapt the state, event and error types in one go, see {@link #mapOnState(Function, Function)}, {@link #mapOnEvent(Function, Function)}
     * and {@link #mapError(Function)}
     */
    default <S2, E2, ERROR2> Decider<C, S2, E2, ERROR2> dimap(Function<? super S2, ? extends S> toState,
                                                              Function<? super S, ? extends S2> fromState,
                                                              Function<? super E2, ? extends E> toEvent,
                                                              Function<? super E, ? extends E2> fromEvent,
                                                              Function<? super ERROR, ? extends ERROR2> errorMapper) {
        return this.<S2>mapOnState(toState, fromState)
                   .<E2>mapOnEvent(toEvent, fromEvent)
                   .mapError(errorMapper);
    }

    /**
     * Product composition: combine this {@link Decider} with <code>other</code> into a {@link Decider} that handles
     * the commands and events of both.<br>
     * Each command and event is routed to the {@link Decider} owning its {@link Sum} variant. The state of the other
     * {@link Decider} is left untouched and the decided events keep the order in which the owning {@link Decider} emitted them.
     *
     * @param other the decider to combine with
     * @param <C2>  the other deciders command type
     * @param <S2>  the other deciders state type
     * @param <E2>  the other deciders event type
     * @return the combined {@link Decider}
     */
    default <C2, S2, E2> Decider<Sum<C, C2>, Pair<S, S2>, Sum<E, E2>, ERROR> combine(Decider<C2, S2, E2, ERROR> other) {
        requireNonNull(other, "You must supply the Decider to combine with");
        return of((command, state) -> command.fold(
                          c -> this.decide(c, state._1()).map(events -> mapAll(events, Sum::<E, E2>first)),
                          c2 -> other.decide(c2, state._2()).map(events -> mapAll(events, Sum::<E, E2>second))),
                  (state, event) -> event.fold(
                          e -> new Pair<>(this.evolve(state._1(), e), state._2()),
                          e2 -> new Pair<>(state._1(), other.evolve(state._2(), e2))),
                  () -> new Pair<>(this.initialState(), other.initialState()));
    }

    /**
     * Product composition of three deciders, see {@link #combine(Decider)}
     */
    default <C2, S2, E2, C3, S3, E3> Decider<Sum3<C, C2, C3>, Triple<S, S2, S3>, Sum3<E, E2, E3>, ERROR> combine(Decider<C2, S2, E2, ERROR> second,
                                                                                                               Decider<C3, S3, E3, ERROR> third) {
        requireNonNull(second, "You must supply the second Decider to combine with");
        requireNonNull(third, "You must supply the third Decider to combine with");
        return this.<C2, S2, E2>combine(second)
                   .<C3, S3, E3>combine(third)
                   .<Triple<S, S2, S3>>mapOnState(state -> new Pair<>(new Pair<>(state._1(), state._2()), state._3()),
                                                  state -> new Triple<>(state._1()._1(), state._1()._2(), state._2()))
                   .<Sum3<E, E2, E3>>mapOnEvent(Sum3::toNestedSum,
                                                Sum3::fromNestedSum)
                   .mapOnCommand(Sum3::toNestedSum);
    }

    private static <T, R> List<R> mapAll(List<T> values, Function<? super T, ? extends R> mapper) {
        var result = new ArrayList<R>(values.size());
        for (T value : values) {
            result.add(mapper.apply(value));
        }
        return result;
    }
}
