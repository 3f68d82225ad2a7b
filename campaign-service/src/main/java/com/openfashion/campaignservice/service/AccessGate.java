package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.core.exceptions.PlatformPausedException;
import com.openfashion.campaignservice.core.exceptions.UnauthorizedException;

import java.util.UUID;

public interface AccessGate {

    boolean isOwner(UUID caller);

    boolean isPaused();

    default void requireOwner(UUID caller) {
        if (!isOwner(caller)) {
            throw new UnauthorizedException(caller);
        }
    }

    default void requireNotPaused() {
        if (isPaused()) {
            throw new PlatformPausedException();
        }
    }
}
