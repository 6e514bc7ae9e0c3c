package com.thedigest.continuity.service;

public final class ClientIds {

    public static final String ANONYMOUS = "anonymous";

    static final int MAX_LENGTH = 120;

    private ClientIds() {
    }

    /**
     * Strips everything outside {@code [A-Za-z0-9_-]} and caps the length. Empty input
     * (before or after stripping) maps to {@link #ANONYMOUS}.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return ANONYMOUS;
        }
        String safe = raw.trim().replaceAll("[^a-zA-Z0-9_-]", "");
        if (safe.length() > MAX_LENGTH) {
            safe = safe.substring(0, MAX_LENGTH);
        }
        return safe.isEmpty() ? ANONYMOUS : safe;
    }
}
