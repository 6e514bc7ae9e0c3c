package com.thedigest.continuity.service;

/**
 * Raised when no candidate data can be read at all. The only failure the continuity
 * engine lets reach its callers.
 */
public class CandidateStoreUnavailableException extends RuntimeException {
    public CandidateStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
