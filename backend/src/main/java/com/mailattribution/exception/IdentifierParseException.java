package com.mailattribution.exception;

import lombok.Getter;

/** Malformed tracking identifier (sub1 tag or campaign name) */
@Getter
public class IdentifierParseException extends RuntimeException {

    private final String rawValue;

    public IdentifierParseException(String message, String rawValue) {
        super(message);
        this.rawValue = rawValue;
    }
}
