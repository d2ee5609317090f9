package dk.cloudcreate.essentials.fmodel.application;

import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import reactor.core.publisher.Mono;

import java.util.*;

/**
 * Stores the events of event sourced aggregates, see {@link EventSourcedAggregate}.<br>
 * Each event is stored together with its version. Failures (including {@link OptimisticConcurrencyException})
 * are signalled as a {@link Mono#error(Throwable)}.
 *
 * @param <C> the command type
 * @param <E> the event type
 * @param <V> the version type
 */
public interface EventRepository<C, E, V> {
    /**
     * Fetch the events of the stream the <code>command</code> belongs to
     *
     * @param command the command being handled
     * @return the events and their versions, oldest first. An empty list if the stream doesn't exist yet
     */
    Mono<List<Pair<E, V>>> fetchEvents(C command);

    /**
     * Append the <code>events</code> to their stream.<br>
     * Saving an empty event list is legal and doesn't change the stream.
     *
     * @param events        the events to append, in order
     * @param latestVersion the version of the latest event fetched from the stream or {@link Optional#empty()} if the stream was new
     * @return the appended events and the versions they were assigned
     */
    Mono<List<Pair<E, V>>> save(List<E> events, Optional<V> latestVersion);
}
