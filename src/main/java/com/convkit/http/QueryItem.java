package com.convkit.http;

import java.util.Objects;

public record QueryItem(String name, String value) {

    public QueryItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    String encoded() {
        return UriEncoding.encodeQueryComponent(name) + "=" + UriEncoding.encodeQueryComponent(value);
    }
}
