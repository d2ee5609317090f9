package dk.cloudcreate.essentials.fmodel.domain;

import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Tagged union of two types. Used as the combined command, event or action result type
 * when two {@link Decider}'s, {@link View}'s or {@link Saga}'s are combined.<br>
 * Since the type is sealed, every {@link Sum} is either a {@link First} or a {@link Second} - use {@link #fold(Function, Function)}
 * for exhaustive matching.
 *
 * @param <A> the first type
 * @param <B> the second type
 */
public sealed interface Sum<A, B> extends Identifier permits Sum.First, Sum.Second {

    static <A, B> Sum<A, B> first(A value) {
        return new First<>(value);
    }

    static <A, B> Sum<A, B> second(B value) {
        return new Second<>(value);
    }

    <R> R fold(Function<? super A, ? extends R> onFirst, Function<? super B, ? extends R> onSecond);

    /**
     * Resolve the identifier of the wrapped value
     *
     * @throws IllegalStateException if the wrapped value doesn't implement {@link Identifier}
     */
    @Override
    default String identifier() {
        return fold(Sum::identifierOf, Sum::identifierOf);
    }

    static String identifierOf(Object value) {
        if (value instanceof Identifier identifiable) {
            return identifiable.identifier();
        }
        throw new IllegalStateException(msg("'{}' doesn't implement {}", value.getClass().getName(), Identifier.class.getSimpleName()));
    }

    record First<A, B>(A value) implements Sum<A, B> {
        public First {
            requireNonNull(value, "No value provided");
        }

        @Override
        public <R> R fold(Function<? super A, ? extends R> onFirst, Function<? super B, ? extends R> onSecond) {
            return onFirst.apply(value);
        }
    }

    record Second<A, B>(B value) implements Sum<A, B> {
        public Second {
            requireNonNull(value, "No value provided");
        }

        @Override
        public <R> R fold(Function<? super A, ? extends R> onFirst, Function<? super B, ? extends R> onSecond) {
            return onSecond.apply(value);
        }
    }
}
