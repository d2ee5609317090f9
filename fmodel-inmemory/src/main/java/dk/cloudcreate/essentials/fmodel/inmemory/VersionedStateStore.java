package dk.cloudcreate.essentials.fmodel.inmemory;

import dk.cloudcreate.essentials.fmodel.application.OptimisticConcurrencyException;
import dk.cloudcreate.essentials.fmodel.application.types.Version;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Versioned state per identity. Saves for the same identity are atomic compare-and-set operations on the {@link Version},
 * saves for different identities never block each other.
 *
 * @param <S> the state type
 */
final class VersionedStateStore<S> {
    private static final Logger log = LoggerFactory.getLogger(VersionedStateStore.class);

    private final ConcurrentHashMap<Object, Pair<S, Version>> states = new ConcurrentHashMap<>();

    Optional<Pair<S, Version>> get(Object identity) {
        requireNonNull(identity, "No identity provided");
        return Optional.ofNullable(states.get(identity));
    }

    Pair<S, Version> save(Object identity, S state, Optional<Version> expectedVersion) {
        requireNonNull(identity, "No identity provided");
        requireNonNull(state, "No state provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        return states.compute(identity, (id, current) -> {
            var actualVersion = Optional.ofNullable(current).map(stateAndVersion -> stateAndVersion._2());
            if (!actualVersion.equals(expectedVersion)) {
                log.debug("Rejecting save of state for '{}': expected version {} but found {}", id, expectedVersion, actualVersion);
                throw new OptimisticConcurrencyException(id, expectedVersion, actualVersion);
            }
            var newVersion = actualVersion.map(Version::increaseAndGet).orElse(Version.FIRST_VERSION);
            log.trace("Saved state for '{}' with version {}", id, newVersion);
            return new Pair<>(state, newVersion);
        });
    }

    void clear() {
        states.clear();
    }
}
