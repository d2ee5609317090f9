package dk.cloudcreate.essentials.fmodel.domain;

import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A {@link Saga} reacts to action results (typically events) by issuing new actions (typically commands) -
 * the stateless glue between decision-making units.
 *
 * @param <AR> the action result type
 * @param <A>  the action type
 */
@FunctionalInterface
public interface Saga<AR, A> {
    static <AR, A> Saga<AR, A> of(Function<? super AR, List<A>> react) {
        requireNonNull(react, "You must supply a react function");
        return actionResult -> requireNonNull(react.apply(actionResult), "The react function returned null");
    }

    /**
     * @param actionResult the action result to react to
     * @return the actions to issue (may be empty)
     */
    List<A> react(AR actionResult);

    default <A2> Saga<AR, A2> mapOnAction(Function<? super A, ? extends A2> actionMapper) {
        requireNonNull(actionMapper, "You must supply an actionMapper");
        return actionResult -> {
            var actions = react(actionResult);
            var mapped  = new ArrayList<A2>(actions.size());
            actions.forEach(action -> mapped.add(actionMapper.apply(action)));
            return mapped;
        };
    }

    default <AR2> Saga<AR2, A> mapOnActionResult(Function<? super AR2, ? extends AR> actionResultMapper) {
        requireNonNull(actionResultMapper, "You must supply an actionResultMapper");
        return actionResult -> react(actionResultMapper.apply(actionResult));
    }

    /**
     * Combine two sagas reacting to disjoint action results. Each action result is routed to the saga owning its {@link Sum} variant.
     */
    default <AR2, A2> Saga<Sum<AR, AR2>, Sum<A, A2>> combine(Saga<AR2, A2> other) {
        requireNonNull(other, "You must supply the Saga to combine with");
        return actionResult -> actionResult.fold(
                ar -> this.<Sum<A, A2>>mapOnAction(Sum::first).react(ar),
                ar2 -> other.<Sum<A, A2>>mapOnAction(Sum::second).react(ar2));
    }

    /**
     * Merge two sagas reacting to the same action results. The actions of this saga come before the actions of <code>other</code>.
     */
    default <A2> Saga<AR, Sum<A, A2>> merge(Saga<AR, A2> other) {
        requireNonNull(other, "You must supply the Saga to merge with");
        return actionResult -> {
            var actions = new ArrayList<Sum<A, A2>>(this.<Sum<A, A2>>mapOnAction(Sum::first).react(actionResult));
            actions.addAll(other.<Sum<A, A2>>mapOnAction(Sum::second).react(actionResult));
            return actions;
        };
    }
}
