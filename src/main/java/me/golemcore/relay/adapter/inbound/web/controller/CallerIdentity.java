package me.golemcore.relay.adapter.inbound.web.controller;

import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;

/**
 * Caller identity as set by the authenticating gateway in front of the relay.
 */
final class CallerIdentity {

    static final String HEADER = "X-Mahilo-User-Id";

    private CallerIdentity() {
    }

    static String require(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new RelayException(ErrorCode.UNAUTHORIZED, "Missing " + HEADER + " header");
        }
        return userId.trim();
    }
}
