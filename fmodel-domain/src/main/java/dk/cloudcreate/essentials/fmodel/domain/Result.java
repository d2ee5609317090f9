package dk.cloudcreate.essentials.fmodel.domain;

import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The outcome of a {@link Decider#decide(Object, Object)} call (or any other computation that can be rejected by the domain):
 * either a {@link Success} carrying the value or a {@link Failure} carrying the domain specific error.<br>
 * A domain rejection is an expected outcome and is therefore returned as a value instead of being thrown.
 *
 * @param <VALUE> the value type
 * @param <ERROR> the domain error type
 */
public sealed interface Result<VALUE, ERROR> permits Result.Success, Result.Failure {

    static <VALUE, ERROR> Result<VALUE, ERROR> success(VALUE value) {
        return new Success<>(value);
    }

    static <VALUE, ERROR> Result<VALUE, ERROR> failure(ERROR error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * @return the value of a {@link Success}
     * @throws IllegalStateException if this is a {@link Failure}
     */
    VALUE value();

    /**
     * @return the error of a {@link Failure}
     * @throws IllegalStateException if this is a {@link Success}
     */
    ERROR error();

    /**
     * Reduce both outcomes to a single value
     *
     * @param onSuccess applied to the value of a {@link Success}
     * @param onFailure applied to the error of a {@link Failure}
     * @param <R>       the result type
     * @return the result of the function matching this outcome
     */
    <R> R fold(Function<? super VALUE, ? extends R> onSuccess, Function<? super ERROR, ? extends R> onFailure);

    default <VALUE2> Result<VALUE2, ERROR> map(Function<? super VALUE, ? extends VALUE2> mapper) {
        requireNonNull(mapper, "No mapper provided");
        return fold(value -> success(mapper.apply(value)),
                    Result::failure);
    }

    default <ERROR2> Result<VALUE, ERROR2> mapError(Function<? super ERROR, ? extends ERROR2> mapper) {
        requireNonNull(mapper, "No mapper provided");
        return fold(Result::success,
                    error -> failure(mapper.apply(error)));
    }

    default <VALUE2> Result<VALUE2, ERROR> flatMap(Function<? super VALUE, Result<VALUE2, ERROR>> mapper) {
        requireNonNull(mapper, "No mapper provided");
        return fold(mapper::apply,
                    Result::failure);
    }

    record Success<VALUE, ERROR>(VALUE value) implements Result<VALUE, ERROR> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public ERROR error() {
            throw new IllegalStateException(msg("Result is a Success with value '{}' and doesn't contain an error", value));
        }

        @Override
        public <R> R fold(Function<? super VALUE, ? extends R> onSuccess, Function<? super ERROR, ? extends R> onFailure) {
            return onSuccess.apply(value);
        }
    }

    record Failure<VALUE, ERROR>(ERROR error) implements Result<VALUE, ERROR> {
        public Failure {
            requireNonNull(error, "A Failure must contain an error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public VALUE value() {
            throw new IllegalStateException(msg("Result is a Failure with error '{}' and doesn't contain a value", error));
        }

        @Override
        public <R> R fold(Function<? super VALUE, ? extends R> onSuccess, Function<? super ERROR, ? extends R> onFailure) {
            return onFailure.apply(error);
        }
    }
}
