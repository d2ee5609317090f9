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
 * In-memory {@link StateRepository}. The identity of the state a command belongs to is resolved with the
 * <code>commandIdentity</code> function. A state saved on its own, without the command it resulted from, is stored under the identity
 * resolved with the <code>stateIdentity</code> function.<br>
 * A save with a version that doesn't match the stored version fails with an {@link OptimisticConcurrencyException}.
 *
 * @param <C> the command type
 * @param <S> the state type
 */
public final class InMemoryStateRepository<C, S> implements StateRepository<C, S, Version> {
    private final VersionedStateStore<S> store = new VersionedStateStore<>();
    private final Function<? super C, ?> commandIdentity;
    private final Function<? super S, ?> stateIdentity;

    /**
     * Create a repository for commands and states that implement {@link Identifier}
     */
    public static <C extends Identifier, S extends Identifier> InMemoryStateRepository<C, S> usingIdentifiers() {
        return new InMemoryStateRepository<>(Identifier::identifier, Identifier::identifier);
    }

    public InMemoryStateRepository(Function<? super C, ?> commandIdentity,
                                   Function<? super S, ?> stateIdentity) {
        this.commandIdentity = requireNonNull(commandIdentity, "You must supply a commandIdentity function");
        this.stateIdentity = requireNonNull(stateIdentity, "You must supply a stateIdentity function");
    }

    @Override
    public Mono<Pair<S, Version>> fetchState(C command) {
        return Mono.defer(() -> Mono.justOrEmpty(store.get(commandIdentity.apply(command))));
    }

    @Override
    public Mono<Pair<S, Version>> save(S state, Optional<Version> version) {
        return Mono.fromCallable(() -> store.save(stateIdentity.apply(state), state, version));
    }

    /**
     * Stores the state under the command's identity, so a command that leaves the initial state untouched
     * is saved under the identity it was fetched by and not under the identity of the initial state
     */
    @Override
    public Mono<Pair<S, Version>> save(C command, S state, Optional<Version> version) {
        return Mono.fromCallable(() -> store.save(commandIdentity.apply(command), state, version));
    }

    /**
     * @return the stored state and its version for the given <code>identity</code>
     */
    public Optional<Pair<S, Version>> findState(Object identity) {
        return store.get(identity);
    }

    public void clear() {
        store.clear();
    }
}
