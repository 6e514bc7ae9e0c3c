package com.thedigest.continuity.service;

/**
 * Bedrock kept rejecting brief generation with throttling errors after every backoff
 * attempt. The brief service treats it like any other generation failure and serves
 * the deterministic brief.
 */
public class ThrottledException extends RuntimeException {

    public ThrottledException(String message, Throwable cause) {
        super(message, cause);
    }
}
