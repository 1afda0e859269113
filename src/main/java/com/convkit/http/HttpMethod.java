package com.convkit.http;

public enum HttpMethod {
    GET,
    POST,
    DELETE
}
