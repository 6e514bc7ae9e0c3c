package com.thedigest.continuity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Level of detail (and generation cost) requested for a catch-up report.
 * Older clients still send the legacy codes {@code 2m} and {@code 10m}.
 */
public enum Depth {

    SHALLOW("shallow", "2m", new DepthConfig(4, 4, 600, 5, 3, 2)),
    MEDIUM("medium", "10m", new DepthConfig(8, 8, 1000, 10, 5, 3)),
    DEEP("deep", "deep", new DepthConfig(12, 12, 1600, 14, 7, 5));

    private final String code;
    private final String legacyCode;
    private final DepthConfig config;

    Depth(String code, String legacyCode, DepthConfig config) {
        this.code = code;
        this.legacyCode = legacyCode;
        this.config = config;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public DepthConfig config() {
        return config;
    }

    /**
     * Parses a depth code, accepting both current and legacy spellings.
     *
     * @param raw caller supplied value, may be null
     * @return the matching depth, or empty when the value is not recognised
     */
    public static Optional<Depth> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Depth depth : values()) {
            if (depth.code.equals(normalized) || depth.legacyCode.equals(normalized)) {
                return Optional.of(depth);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static Depth fromJson(String raw) {
        return parse(raw).orElse(null);
    }
}
