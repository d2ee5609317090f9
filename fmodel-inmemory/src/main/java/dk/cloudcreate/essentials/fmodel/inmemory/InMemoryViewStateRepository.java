package dk.cloudcreate.essentials.fmodel.inmemory;

import dk.cloudcreate.essentials.fmodel.application.*;
import dk.cloudcreate.essentials.fmodel.application.types.Version;
import dk.cloudcreate.essentials.fmodel.domain.Identifier;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * In-memory {@link ViewStateRepository}, see {@link InMemoryStateRepository}
 *
 * @param <E> the event type
 * @param <S> the projected state type
 */
public final class InMemoryViewStateRepository<E, S> implements ViewStateRepository<E, S, Version> {
    private final VersionedStateStore<S> store = new VersionedStateStore<>();
    private final Function<? super E, ?> eventIdentity;
    private final Function<? super S, ?> stateIdentity;

    public static <E extends Identifier, S extends Identifier> InMemoryViewStateRepository<E, S> usingIdentifiers() {
        return new InMemoryViewStateRepository<>(Identifier::identifier, Identifier::identifier);
    }

    public InMemoryViewStateRepository(Function<? super E, ?> eventIdentity,
                                       Function<? super S, ?> stateIdentity) {
        this.eventIdentity = requireNonNull(eventIdentity, "You must supply an eventIdentity function");
        this.stateIdentity = requireNonNull(stateIdentity, "You must supply a stateIdentity function");
    }

    @Override
    public Mono<Pair<S, Version>> fetchState(E event) {
        return Mono.defer(() -> Mono.justOrEmpty(store.get(eventIdentity.apply(event))));
    }

    @Override
    public Mono<Pair<S, Version>> save(S state, Optional<Version> version) {
        return Mono.fromCallable(() -> store.save(stateIdentity.apply(state), state, version));
    }

    @Override
    public Mono<Pair<S, Version>> save(E event, S state, Optional<Version> version) {
        return Mono.fromCallable(() -> store.save(eventIdentity.apply(event), state, version));
    }

    public Optional<Pair<S, Version>> findState(Object identity) {
        return store.get(identity);
    }

    public void clear() {
        store.clear();
    }
}
