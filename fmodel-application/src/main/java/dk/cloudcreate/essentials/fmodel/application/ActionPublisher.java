package dk.cloudcreate.essentials.fmodel.application;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Publishes the actions (typically commands) issued by a {@link SagaManager} to some external system
 *
 * @param <A> the action type
 */
@FunctionalInterface
public interface ActionPublisher<A> {
    /**
     * @param actions the actions to publish, in order
     * @return the actions that were published
     */
    Mono<List<A>> publish(List<A> actions);
}
