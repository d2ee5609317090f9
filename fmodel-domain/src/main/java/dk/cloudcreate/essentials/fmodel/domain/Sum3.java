package dk.cloudcreate.essentials.fmodel.domain;

import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Tagged union of three types, see {@link Sum}
 *
 * @param <A> the first type
 * @param <B> the second type
 * @param <C> the third type
 */
public sealed interface Sum3<A, B, C> extends Identifier permits Sum3.First, Sum3.Second, Sum3.Third {

    static <A, B, C> Sum3<A, B, C> first(A value) {
        return new First<>(value);
    }

    static <A, B, C> Sum3<A, B, C> second(B value) {
        return new Second<>(value);
    }

    static <A, B, C> Sum3<A, B, C> third(C value) {
        return new Third<>(value);
    }

    <R> R fold(Function<? super A, ? extends R> onFirst,
               Function<? super B, ? extends R> onSecond,
               Function<? super C, ? extends R> onThird);

    @Override
    default String identifier() {
        return fold(Sum::identifierOf, Sum::identifierOf, Sum::identifierOf);
    }

    /**
     * Nest this value the way {@link Decider#combine(Decider)} nests two combinations:
     * <code>((A | B) | C)</code>
     */
    default Sum<Sum<A, B>, C> toNestedSum() {
        return fold(a -> Sum.first(Sum.first(a)),
                    b -> Sum.first(Sum.second(b)),
                    Sum::second);
    }

    static <A, B, C> Sum3<A, B, C> fromNestedSum(Sum<Sum<A, B>, C> nested) {
        requireNonNull(nested, "No nested sum provided");
        return nested.fold(inner -> inner.fold(Sum3::first, Sum3::second),
                           Sum3::third);
    }

    record First<A, B, C>(A value) implements Sum3<A, B, C> {
        public First {
            requireNonNull(value, "No value provided");
        }

        @Override
        public <R> R fold(Function<? super A, ? extends R> onFirst, Function<? super B, ? extends R> onSecond, Function<? super C, ? extends R> onThird) {
            return onFirst.apply(value);
        }
    }

    record Second<A, B, C>(B value) implements Sum3<A, B, C> {
        public Second {
            requireNonNull(value, "No value provided");
        }

        @Override
        public <R> R fold(Function<? super A, ? extends R> onFirst, Function<? super B, ? extends R> onSecond, Function<? super C, ? extends R> onThird) {
            return onSecond.apply(value);
        }
    }

    record Third<A, B, C>(C value) implements Sum3<A, B, C> {
        public Third {
            requireNonNull(value, "No value provided");
        }

        @Override
        public <R> R fold(Function<? super A, ? extends R> onFirst, Function<? super B, ? extends R> onSecond, Function<? super C, ? extends R> onThird) {
            return onThird.apply(value);
        }
    }
}
