package dk.cloudcreate.essentials.fmodel.application;

import dk.cloudcreate.essentials.fmodel.domain.View;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Keeps a read side projection up to date by combining a {@link View} with a {@link ViewStateRepository}:
 * every event handled is applied to the projected state it belongs to, which is then saved.
 *
 * @param <S> the projected state type
 * @param <E> the event type
 * @param <V> the version type
 */
public final class MaterializedView<S, E, V> {
    private static final Logger log = LoggerFactory.getLogger(MaterializedView.class);

    private final View<S, E>                   view;
    private final ViewStateRepository<E, S, V> viewStateRepository;

    public static <S, E, V> MaterializedView<S, E, V> from(View<S, E> view,
                                                          ViewStateRepository<E, S, V> viewStateRepository) {
        return new MaterializedView<>(view, viewStateRepository);
    }

    public MaterializedView(View<S, E> view,
                            ViewStateRepository<E, S, V> viewStateRepository) {
        this.view = requireNonNull(view, "You must supply a View");
        this.viewStateRepository = requireNonNull(viewStateRepository, "You must supply a ViewStateRepository");
    }

    /**
     * Apply the <code>event</code> to the projected state it belongs to and save the result
     *
     * @param event the event to project
     * @return a {@link Mono} with the saved state and its new version
     */
    public Mono<Pair<S, V>> handle(E event) {
        requireNonNull(event, "No event provided");
        return Mono.defer(() -> viewStateRepository.fetchState(event))
                   .map(Optional::of)
                   .defaultIfEmpty(Optional.empty())
                   .flatMap(currentStateAndVersion -> {
                       var currentState = currentStateAndVersion.map(stateAndVersion -> stateAndVersion._1());
                       var version      = currentStateAndVersion.map(stateAndVersion -> stateAndVersion._2());
                       var newState     = view.computeNewState(currentState, List.of(event));
                       log.trace("Event '{}' resulted in state '{}', saving it with expected version {}", event, newState, version);
                       return viewStateRepository.save(event, newState, version);
                   })
                   .doOnNext(savedStateAndVersion -> log.debug("Projected event '{}' into state with version '{}'", event, savedStateAndVersion._2()));
    }

    @Override
    public String toString() {
        return "MaterializedView{" +
                "view=" + view +
                ", viewStateRepository=" + viewStateRepository +
                '}';
    }
}
