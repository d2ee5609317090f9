package dk.cloudcreate.essentials.fmodel.application;

import dk.cloudcreate.essentials.fmodel.domain.Saga;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Reacts to action results (typically events) using a {@link Saga} and publishes the resulting actions (typically commands)
 * using an {@link ActionPublisher}
 *
 * @param <AR> the action result type
 * @param <A>  the action type
 */
public final class SagaManager<AR, A> {
    private static final Logger log = LoggerFactory.getLogger(SagaManager.class);

    private final Saga<AR, A>        saga;
    private final ActionPublisher<A> actionPublisher;

    public static <AR, A> SagaManager<AR, A> from(Saga<AR, A> saga,
                                                  ActionPublisher<A> actionPublisher) {
        return new SagaManager<>(saga, actionPublisher);
    }

    public SagaManager(Saga<AR, A> saga,
                       ActionPublisher<A> actionPublisher) {
        this.saga = requireNonNull(saga, "You must supply a Saga");
        this.actionPublisher = requireNonNull(actionPublisher, "You must supply an ActionPublisher");
    }

    /**
     * Compute the actions the <code>actionResult</code> results in without publishing them
     */
    public List<A> computeNewActions(AR actionResult) {
        requireNonNull(actionResult, "No actionResult provided");
        return saga.react(actionResult);
    }

    /**
     * React to the <code>actionResult</code> and publish the resulting actions
     *
     * @param actionResult the action result to react to
     * @return a {@link Mono} with the actions that were published
     */
    public Mono<List<A>> handle(AR actionResult) {
        requireNonNull(actionResult, "No actionResult provided");
        return Mono.defer(() -> {
            var actions = computeNewActions(actionResult);
            log.trace("Action result '{}' resulted in {} action(s)", actionResult, actions.size());
            return actionPublisher.publish(actions)
                                  .doOnNext(publishedActions -> log.debug("Published {} action(s) for action result '{}'", publishedActions.size(), actionResult));
        });
    }

    @Override
    public String toString() {
        return "SagaManager{" +
                "saga=" + saga +
                ", actionPublisher=" + actionPublisher +
                '}';
    }
}
