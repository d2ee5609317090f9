package dk.cloudcreate.essentials.fmodel.domain;

import java.util.List;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable {@link Decider} that delegates to three functions
 *
 * @see Decider#of(BiFunction, BiFunction, Supplier)
 */
final class FunctionalDecider<C, S, E, ERROR> implements Decider<C, S, E, ERROR> {
    private final BiFunction<? super C, ? super S, Result<List<E>, ERROR>> decide;
    private final BiFunction<? super S, ? super E, ? extends S>           evolve;
    private final Supplier<? extends S>                                    initialState;

    FunctionalDecider(BiFunction<? super C, ? super S, Result<List<E>, ERROR>> decide,
                      BiFunction<? super S, ? super E, ? extends S> evolve,
                      Supplier<? extends S> initialState) {
        this.decide = requireNonNull(decide, "You must supply a decide function");
        this.evolve = requireNonNull(evolve, "You must supply an evolve function");
        this.initialState = requireNonNull(initialState, "You must supply an initialState function");
    }

    @Override
    public Result<List<E>, ERROR> decide(C command, S state) {
        requireNonNull(command, "No command provided");
        return requireNonNull(decide.apply(command, state), "The decide function returned null");
    }

    @Override
    public S evolve(S state, E event) {
        requireNonNull(event, "No event provided");
        return evolve.apply(state, event);
    }

    @Override
    public S initialState() {
        return initialState.get();
    }

    @Override
    public String toString() {
        return "Decider{" +
                "decide=" + decide +
                ", evolve=" + evolve +
                '}';
    }
}
