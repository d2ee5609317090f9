package dk.cloudcreate.essentials.fmodel.application;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown (or signalled as a <code>Mono.error</code>) by a repository when a save is attempted with a version that
 * no longer matches the version stored for the same identity, i.e. another command was handled concurrently.<br>
 * The caller may re-run the command; nothing has been persisted.
 */
public class OptimisticConcurrencyException extends AggregateException {
    public final Object      identity;
    public final Optional<?> expectedVersion;
    public final Optional<?> actualVersion;

    public OptimisticConcurrencyException(Object identity, Optional<?> expectedVersion, Optional<?> actualVersion) {
        super(msg("Expected version '{}' for '{}' but found version '{}'",
                  requireNonNull(expectedVersion, "No expectedVersion provided").map(Object::toString).orElse("none"),
                  identity,
                  requireNonNull(actualVersion, "No actualVersion provided").map(Object::toString).orElse("none")));
        this.identity = identity;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
