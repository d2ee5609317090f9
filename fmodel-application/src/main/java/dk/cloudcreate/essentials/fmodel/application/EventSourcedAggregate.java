package dk.cloudcreate.essentials.fmodel.application;

import dk.cloudcreate.essentials.fmodel.domain.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Handles commands for an event sourced aggregate by combining a {@link Decider} with an {@link EventRepository}.<br>
 * Handling a command:
 * <ol>
 *     <li>fetches the events of the stream the command belongs to</li>
 *     <li>folds them, starting from {@link Decider#initialState()}, into the current state</li>
 *     <li>decides on the command. A rejected command is returned as a {@link Result.Failure} and nothing is saved</li>
 *     <li>saves the new events with the version of the latest fetched event (or {@link Optional#empty()} for a new stream)</li>
 * </ol>
 * Concurrent handling of commands for the same stream is detected by the {@link EventRepository}, which fails the save
 * with an {@link OptimisticConcurrencyException} if the stream has moved beyond the fetched version.
 * <p>
 * Example:
 * <pre>{@code
 * var aggregate = EventSourcedAggregate.from(orderDecider, orderEventRepository);
 * aggregate.handle(new CreateOrder(orderId, "John Doe", List.of("Item 1")))
 *          .subscribe(result -> ...);
 * }</pre>
 *
 * @param <C>     the command type
 * @param <S>     the state type
 * @param <E>     the event type
 * @param <V>     the version type
 * @param <ERROR> the domain error type
 */
public final class EventSourcedAggregate<C, S, E, V, ERROR> {
    private static final Logger log = LoggerFactory.getLogger(EventSourcedAggregate.class);

    private final Decider<C, S, E, ERROR>  decider;
    private final EventRepository<C, E, V> eventRepository;

    public static <C, S, E, V, ERROR> EventSourcedAggregate<C, S, E, V, ERROR> from(Decider<C, S, E, ERROR> decider,
                                                                                  EventRepository<C, E, V> eventRepository) {
        return new EventSourcedAggregate<>(decider, eventRepository);
    }

    public EventSourcedAggregate(Decider<C, S, E, ERROR> decider,
                                 EventRepository<C, E, V> eventRepository) {
        this.decider = requireNonNull(decider, "You must supply a Decider");
        this.eventRepository = requireNonNull(eventRepository, "You must supply an EventRepository");
    }

    /**
     * Handle the <code>command</code>
     *
     * @param command the command to handle
     * @return a {@link Mono} with either the saved events and their versions or the domain error that rejected the command.
     * Repository failures are signalled as an error on the {@link Mono}
     */
    public Mono<Result<List<Pair<E, V>>, ERROR>> handle(C command) {
        requireNonNull(command, "No command provided");
        return Mono.defer(() -> {
                       log.trace("Fetching events for command '{}'", command);
                       return eventRepository.fetchEvents(command);
                   })
                   .defaultIfEmpty(List.of())
                   .flatMap(persistedEvents -> decideAndSave(command, persistedEvents));
    }

    private Mono<Result<List<Pair<E, V>>, ERROR>> decideAndSave(C command, List<Pair<E, V>> persistedEvents) {
        var         currentEvents = new ArrayList<E>(persistedEvents.size());
        Optional<V> latestVersion = Optional.empty();
        for (var persistedEvent : persistedEvents) {
            currentEvents.add(persistedEvent._1());
            latestVersion = Optional.of(persistedEvent._2());
        }
        log.trace("Fetched {} event(s) with latest version {} for command '{}'", currentEvents.size(), latestVersion, command);

        var result = decider.computeNewEvents(currentEvents, command);
        if (result.isFailure()) {
            log.debug("Command '{}' was rejected: {}", command, result.error());
            return Mono.just(Result.failure(result.error()));
        }

        var newEvents = result.value();
        if (log.isTraceEnabled()) {
            log.trace("Command '{}' resulted in {} new event(s): {}", command, newEvents.size(), newEvents);
        } else {
            log.debug("Command '{}' resulted in {} new event(s)", command, newEvents.size());
        }
        return eventRepository.save(newEvents, latestVersion)
                              .map(savedEvents -> {
                                  log.debug("Saved {} event(s) for command '{}'", savedEvents.size(), command);
                                  return Result.<List<Pair<E, V>>, ERROR>success(savedEvents);
                              });
    }

    @Override
    public String toString() {
        return "EventSourcedAggregate{" +
                "decider=" + decider +
                ", eventRepository=" + eventRepository +
                '}';
    }
}
