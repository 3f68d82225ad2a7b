package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class TransferFailedException extends RuntimeException {
    public TransferFailedException(String reference, String reason) {
        super("Value transfer " + reference + " failed: " + reason);
    }
}
