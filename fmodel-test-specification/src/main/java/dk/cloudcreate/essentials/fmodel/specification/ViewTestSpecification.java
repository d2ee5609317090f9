package dk.cloudcreate.essentials.fmodel.specification;

import dk.cloudcreate.essentials.fmodel.domain.View;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Given/Then test specification for a {@link View}:
 * <pre>{@code
 * ViewTestSpecification.forView(orderView)
 *                      .given(new OrderCreated(1, "John Doe", List.of("Item 1")),
 *                             new OrderCancelled(1))
 *                      .then(new OrderViewState(1, "John Doe", List.of("Item 1"), true));
 * }</pre>
 *
 * @param <S> the projected state type
 * @param <E> the event type
 */
public final class ViewTestSpecification<S, E> {
    private final View<S, E> view;
    private final List<E>    givenEvents = new ArrayList<>();

    public static <S, E> ViewTestSpecification<S, E> forView(View<S, E> view) {
        return new ViewTestSpecification<>(view);
    }

    private ViewTestSpecification(View<S, E> view) {
        this.view = requireNonNull(view, "You must supply a View");
    }

    public ViewTestSpecification<S, E> given(List<? extends E> events) {
        requireNonNull(events, "No events provided");
        givenEvents.addAll(events);
        return this;
    }

    @SafeVarargs
    public final ViewTestSpecification<S, E> given(E... events) {
        return given(Arrays.asList(events));
    }

    /**
     * Assert that projecting the given events, starting from the initial state, gives the <code>expectedState</code>
     */
    public void then(S expectedState) {
        var state = view.evolveAll(view.initialState(), givenEvents);
        assertThat(state).as("State after projecting %s event(s)", givenEvents.size())
                         .isEqualTo(expectedState);
    }
}
