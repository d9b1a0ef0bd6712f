package com.example.photostatus.server.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubscribeResult {

    private static final SubscribeResult ACCEPTED = new SubscribeResult(true, null);

    boolean ok;
    RejectReason reason;

    public static SubscribeResult accepted() {
        return ACCEPTED;
    }

    public static SubscribeResult rejected(RejectReason reason) {
        return new SubscribeResult(false, reason);
    }

    public enum RejectReason {
        CONNECTION_CAP,
        SHUT_DOWN,
        INITIAL_WRITE_FAILED
    }
}
