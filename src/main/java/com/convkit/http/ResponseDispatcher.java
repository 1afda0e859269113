package com.convkit.http;

import com.convkit.codec.JsonCodec;
import com.convkit.codec.RecordSchema;
import com.convkit.shared.error.DecodeException;
import com.convkit.shared.error.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Turns a status code and body into an {@link Outcome}. 2xx bodies are decoded with the
 * operation's schema; any other status becomes a {@link ServiceException} carrying the
 * service's message when one can be read from the body.
 */
public class ResponseDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ResponseDispatcher.class);
    private static final List<String> MESSAGE_KEYS = List.of("error", "message");

    /**
     * @param schema the expected response record, or {@code null} for operations that return nothing
     */
    public <T> Outcome<T> dispatch(RawResponse response, RecordSchema<T> schema) {
        if (!response.isSuccessful()) {
            return new Outcome.Failure<>(toServiceError(response));
        }
        if (schema == null || !response.hasBody()) {
            return new Outcome.EmptySuccess<>();
        }
        try {
            return new Outcome.Success<>(JsonCodec.decode(response.body(), schema));
        } catch (DecodeException e) {
            log.warn("Cannot decode {} from {} response: {}", schema.name(), response.statusCode(), e.getMessage());
            return new Outcome.Failure<>(e);
        }
    }

    public ServiceException toServiceError(RawResponse response) {
        return new ServiceException(response.statusCode(), extractMessage(response));
    }

    static String extractMessage(RawResponse response) {
        if (!response.hasBody()) return null;
        try {
            var node = JsonCodec.mapper().readTree(response.body());
            if (node == null || !node.isObject()) return null;
            for (var key : MESSAGE_KEYS) {
                var value = node.get(key);
                if (value != null && value.isTextual() && !value.textValue().isBlank()) {
                    return value.textValue();
                }
            }
        } catch (IOException e) {
            log.debug("Error body of status {} is not JSON", response.statusCode());
        }
        return null;
    }
}
