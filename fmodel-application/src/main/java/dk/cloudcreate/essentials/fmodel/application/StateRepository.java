package dk.cloudcreate.essentials.fmodel.application;

import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Stores the current state of state stored aggregates, see {@link StateStoredAggregate}
 *
 * @param <C> the command type
 * @param <S> the state type
 * @param <V> the version type
 */
public interface StateRepository<C, S, V> {
    /**
     * @param command the command being handled
     * @return the current state and its version or an empty {@link Mono} if no state has been stored yet
     */
    Mono<Pair<S, V>> fetchState(C command);

    /**
     * @param state   the new state
     * @param version the version of the state that was fetched or {@link Optional#empty()} if there wasn't any
     * @return the saved state and its new version
     */
    Mono<Pair<S, V>> save(S state, Optional<V> version);

    /**
     * Save the new state under the identity that {@link #fetchState(Object)} used for the <code>command</code>.<br>
     * {@link StateStoredAggregate} always saves through this method. The default delegates to {@link #save(Object, Optional)},
     * which resolves the identity from the state. Override it when that isn't possible, e.g. when a command
     * for an identity without any stored state leaves the decider's initial state untouched.
     *
     * @param command the command that was handled
     * @param state   the new state
     * @param version the version of the state that was fetched or {@link Optional#empty()} if there wasn't any
     * @return the saved state and its new version
     */
    default Mono<Pair<S, V>> save(C command, S state, Optional<V> version) {
        return save(state, version);
    }
}
