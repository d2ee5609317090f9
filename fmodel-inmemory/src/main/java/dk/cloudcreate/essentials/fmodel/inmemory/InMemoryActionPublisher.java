package dk.cloudcreate.essentials.fmodel.inmemory;

import dk.cloudcreate.essentials.fmodel.application.ActionPublisher;
import org.slf4j.*;
import reactor.core.publisher.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link ActionPublisher} that records every published action and optionally forwards each action,
 * one at a time and in order, to a handler (e.g. the <code>handle</code> method of an aggregate).<br>
 * An action is recorded once it has been forwarded. A failed forward ends the publish with that error.
 *
 * @param <A> the action type
 */
public final class InMemoryActionPublisher<A> implements ActionPublisher<A> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryActionPublisher.class);

    private final List<A>                                publishedActions = new CopyOnWriteArrayList<>();
    private final Function<? super A, ? extends Mono<?>> forwardTo;

    /**
     * Create a publisher that only records the published actions
     */
    public InMemoryActionPublisher() {
        this(action -> Mono.empty());
    }

    /**
     * Create a publisher that records the published actions and forwards them to <code>forwardTo</code>
     *
     * @param forwardTo handles a published action. The next action is forwarded when the returned {@link Mono} completes
     */
    public InMemoryActionPublisher(Function<? super A, ? extends Mono<?>> forwardTo) {
        this.forwardTo = requireNonNull(forwardTo, "You must supply a forwardTo function");
    }

    @Override
    public Mono<List<A>> publish(List<A> actions) {
        requireNonNull(actions, "No actions provided");
        return Flux.fromIterable(actions)
                   .concatMap(action -> {
                       log.trace("Publishing action '{}'", action);
                       return forwardTo.apply(action)
                                       .then(Mono.fromRunnable(() -> publishedActions.add(action)))
                                       .thenReturn(action);
                   })
                   .collectList();
    }

    /**
     * @return the actions published so far, in the order they were published. An action that <code>forwardTo</code> failed on isn't included
     */
    public List<A> publishedActions() {
        return List.copyOf(publishedActions);
    }

    public void clear() {
        publishedActions.clear();
    }
}
