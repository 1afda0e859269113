package com.convkit.http;

import com.convkit.shared.error.ConversationException;
import com.convkit.shared.error.DecodeException;

/** Result of one exchange: a decoded record, a success without body, or a failure. */
public sealed interface Outcome<T> {

    record Success<T>(T value) implements Outcome<T> {}

    record EmptySuccess<T>() implements Outcome<T> {}

    record Failure<T>(ConversationException error) implements Outcome<T> {}

    default boolean isSuccess() {
        return !(this instanceof Failure);
    }

    /**
     * The decoded value. Throws the failure, or {@link DecodeException.Kind#EMPTY_BODY} when a
     * record was expected but the service sent an empty body.
     */
    default T get() {
        if (this instanceof Success<T> s) return s.value();
        if (this instanceof Failure<T> f) throw f.error();
        throw new DecodeException(DecodeException.Kind.EMPTY_BODY, "$",
                "expected a response body but the service sent none");
    }
}
