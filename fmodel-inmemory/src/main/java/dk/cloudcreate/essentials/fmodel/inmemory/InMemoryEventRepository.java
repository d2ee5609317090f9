package dk.cloudcreate.essentials.fmodel.inmemory;

import dk.cloudcreate.essentials.fmodel.application.*;
import dk.cloudcreate.essentials.fmodel.application.types.Version;
import dk.cloudcreate.essentials.fmodel.domain.Identifier;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * In-memory {@link EventRepository} that keeps an event stream per identity.<br>
 * The stream a command belongs to is resolved with the <code>commandIdentity</code> function, the stream an event
 * is appended to with the <code>eventIdentity</code> function. Every appended event gets the next {@link Version} of its stream,
 * starting with {@link Version#FIRST_VERSION}.<br>
 * Appending to a stream is an atomic compare-and-set on the version of the latest event in the stream: if the stream
 * has moved beyond the <code>latestVersion</code> the save fails with an {@link OptimisticConcurrencyException} and nothing is appended.
 * Streams with different identities never block each other.
 * <p>
 * Example:
 * <pre>{@code
 * var repository = InMemoryEventRepository.<OrderCommand, OrderEvent>usingIdentifiers();
 * var aggregate  = EventSourcedAggregate.from(orderDecider, repository);
 * }</pre>
 *
 * @param <C> the command type
 * @param <E> the event type
 */
public final class InMemoryEventRepository<C, E> implements EventRepository<C, E, Version> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventRepository.class);

    private final ConcurrentHashMap<Object, List<Pair<E, Version>>> streams = new ConcurrentHashMap<>();
    private final Function<? super C, ?>                            commandIdentity;
    private final Function<? super E, ?>                            eventIdentity;

    /**
     * Create a repository for commands and events that implement {@link Identifier}
     */
    public static <C extends Identifier, E extends Identifier> InMemoryEventRepository<C, E> usingIdentifiers() {
        return new InMemoryEventRepository<>(Identifier::identifier, Identifier::identifier);
    }

    public InMemoryEventRepository(Function<? super C, ?> commandIdentity,
                                   Function<? super E, ?> eventIdentity) {
        this.commandIdentity = requireNonNull(commandIdentity, "You must supply a commandIdentity function");
        this.eventIdentity = requireNonNull(eventIdentity, "You must supply an eventIdentity function");
    }

    @Override
    public Mono<List<Pair<E, Version>>> fetchEvents(C command) {
        return Mono.fromSupplier(() -> {
            var identity = requireNonNull(commandIdentity.apply(command), "The commandIdentity function returned null");
            var stream   = streams.getOrDefault(identity, List.of());
            log.trace("Fetched {} event(s) from stream '{}'", stream.size(), identity);
            return stream;
        });
    }

    /**
     * Append the <code>events</code> to their stream. All <code>events</code> must belong to the same stream.<br>
     * Saving an empty event list is a no-op that doesn't check the <code>latestVersion</code>
     */
    @Override
    public Mono<List<Pair<E, Version>>> save(List<E> events, Optional<Version> latestVersion) {
        requireNonNull(events, "No events provided");
        requireNonNull(latestVersion, "No latestVersion provided");
        return Mono.fromCallable(() -> {
            if (events.isEmpty()) {
                log.trace("No events to save");
                return List.<Pair<E, Version>>of();
            }
            var identity = resolveStreamIdentity(events);
            var appended = new ArrayList<Pair<E, Version>>(events.size());
            streams.compute(identity, (id, stream) -> {
                var currentStream = stream != null ? stream : List.<Pair<E, Version>>of();
                var actualVersion = currentStream.isEmpty() ? Optional.<Version>empty() : Optional.of(currentStream.get(currentStream.size() - 1)._2());
                if (!actualVersion.equals(latestVersion)) {
                    log.debug("Rejecting {} event(s) for stream '{}': expected latest version {} but found {}", events.size(), id, latestVersion, actualVersion);
                    throw new OptimisticConcurrencyException(id, latestVersion, actualVersion);
                }
                var version = actualVersion.orElse(null);
                for (var event : events) {
                    version = version == null ? Version.FIRST_VERSION : version.increaseAndGet();
                    appended.add(new Pair<>(event, version));
                }
                var newStream = new ArrayList<Pair<E, Version>>(currentStream.size() + appended.size());
                newStream.addAll(currentStream);
                newStream.addAll(appended);
                return Collections.unmodifiableList(newStream);
            });
            log.debug("Appended {} event(s) to stream '{}' with latest version {}", appended.size(), identity, appended.get(appended.size() - 1)._2());
            return appended;
        });
    }

    private Object resolveStreamIdentity(List<E> events) {
        var identity = requireNonNull(eventIdentity.apply(events.get(0)), "The eventIdentity function returned null");
        for (var event : events) {
            var eventStreamIdentity = eventIdentity.apply(event);
            if (!identity.equals(eventStreamIdentity)) {
                throw new IllegalArgumentException(msg("All events saved together must belong to the same stream. Found '{}' and '{}'",
                                                       identity,
                                                       eventStreamIdentity));
            }
        }
        return identity;
    }

    /**
     * @return all the events in the stream with the given <code>identity</code> (empty if the stream doesn't exist)
     */
    public List<Pair<E, Version>> loadStream(Object identity) {
        requireNonNull(identity, "No identity provided");
        return streams.getOrDefault(identity, List.of());
    }

    public void clear() {
        streams.clear();
    }
}
