package com.convkit.shared.error;

import java.util.Optional;

/** The service answered with a non-2xx status. */
public class ServiceException extends ConversationException {

    private final int statusCode;
    private final String serviceMessage;

    public ServiceException(int statusCode, String serviceMessage) {
        super(serviceMessage != null
                ? "Service error " + statusCode + ": " + serviceMessage
                : "Service error " + statusCode);
        this.statusCode = statusCode;
        this.serviceMessage = serviceMessage;
    }

    public int statusCode() { return statusCode; }

    public Optional<String> serviceMessage() { return Optional.ofNullable(serviceMessage); }
}
