package dk.cloudcreate.essentials.fmodel.application;

import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Stores the projected state of a {@link MaterializedView}
 *
 * @param <E> the event type
 * @param <S> the projected state type
 * @param <V> the version type
 */
public interface ViewStateRepository<E, S, V> {
    /**
     * @param event the event being projected
     * @return the projected state the event belongs to and its version or an empty {@link Mono} if it doesn't exist yet
     */
    Mono<Pair<S, V>> fetchState(E event);

    Mono<Pair<S, V>> save(S state, Optional<V> version);

    /**
     * Save the projected state under the identity that {@link #fetchState(Object)} used for the <code>event</code>.
     * Defaults to {@link #save(Object, Optional)}
     */
    default Mono<Pair<S, V>> save(E event, S state, Optional<V> version) {
        return save(state, version);
    }
}
