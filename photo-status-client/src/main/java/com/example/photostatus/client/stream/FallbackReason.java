package com.example.photostatus.client.stream;

public enum FallbackReason {
    TOO_MANY_FAILURES,
    SERVER_DISABLED,
    TOO_MANY_CONNECTIONS
}
