package dk.cloudcreate.essentials.fmodel.application;

import dk.cloudcreate.essentials.fmodel.domain.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Handles commands for a state stored aggregate by combining a {@link Decider} with a {@link StateRepository}.<br>
 * Handling a command fetches the current state (or starts from {@link Decider#initialState()}), decides on the command,
 * applies the resulting events to the state and saves the new state with the version that was fetched.<br>
 * A rejected command is returned as a {@link Result.Failure} and nothing is saved.
 *
 * @param <C>     the command type
 * @param <S>     the state type
 * @param <E>     the event type
 * @param <V>     the version type
 * @param <ERROR> the domain error type
 */
public final class StateStoredAggregate<C, S, E, V, ERROR> {
    private static final Logger log = LoggerFactory.getLogger(StateStoredAggregate.class);

    private final Decider<C, S, E, ERROR>  decider;
    private final StateRepository<C, S, V> stateRepository;

    public static <C, S, E, V, ERROR> StateStoredAggregate<C, S, E, V, ERROR> from(Decider<C, S, E, ERROR> decider,
                                                                                 StateRepository<C, S, V> stateRepository) {
        return new StateStoredAggregate<>(decider, stateRepository);
    }

    public StateStoredAggregate(Decider<C, S, E, ERROR> decider,
                                StateRepository<C, S, V> stateRepository) {
        this.decider = requireNonNull(decider, "You must supply a Decider");
        this.stateRepository = requireNonNull(stateRepository, "You must supply a StateRepository");
    }

    /**
     * Handle the <code>command</code>
     *
     * @param command the command to handle
     * @return a {@link Mono} with either the saved state and its new version or the domain error that rejected the command.
     * Repository failures are signalled as an error on the {@link Mono}
     */
    public Mono<Result<Pair<S, V>, ERROR>> handle(C command) {
        requireNonNull(command, "No command provided");
        return Mono.defer(() -> {
                       log.trace("Fetching state for command '{}'", command);
                       return stateRepository.fetchState(command);
                   })
                   .map(Optional::of)
                   .defaultIfEmpty(Optional.empty())
                   .flatMap(currentStateAndVersion -> decideAndSave(command, currentStateAndVersion));
    }

    private Mono<Result<Pair<S, V>, ERROR>> decideAndSave(C command, Optional<Pair<S, V>> currentStateAndVersion) {
        var currentState = currentStateAndVersion.map(stateAndVersion -> stateAndVersion._1());
        var version      = currentStateAndVersion.map(stateAndVersion -> stateAndVersion._2());
        if (currentState.isEmpty()) {
            log.trace("No state found for command '{}', using the initial state", command);
        }

        var result = decider.computeNewState(currentState, command);
        if (result.isFailure()) {
            log.debug("Command '{}' was rejected: {}", command, result.error());
            return Mono.just(Result.failure(result.error()));
        }

        var newState = result.value();
        log.trace("Saving new state '{}' with expected version {} for command '{}'", newState, version, command);
        return stateRepository.save(command, newState, version)
                              .map(savedStateAndVersion -> {
                                  log.debug("Saved state with version '{}' for command '{}'", savedStateAndVersion._2(), command);
                                  return Result.<Pair<S, V>, ERROR>success(savedStateAndVersion);
                              });
    }

    @Override
    public String toString() {
        return "StateStoredAggregate{" +
                "decider=" + decider +
                ", stateRepository=" + stateRepository +
                '}';
    }
}
