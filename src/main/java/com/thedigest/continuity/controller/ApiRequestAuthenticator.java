package com.thedigest.continuity.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared-secret check for mutating endpoints. With no secret configured every request
 * is allowed and a warning is logged once.
 */
@Component
public class ApiRequestAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(ApiRequestAuthenticator.class);

    private static final String BEARER_PREFIX = "Bearer";

    private final String apiSecret;
    private final AtomicBoolean openModeWarned = new AtomicBoolean(false);

    public ApiRequestAuthenticator(@Value("${app.api.secret:}") String apiSecret) {
        this.apiSecret = apiSecret == null ? "" : apiSecret.trim();
    }

    /**
     * @param authorizationHeader raw {@code Authorization} header, may be null
     * @return the rejection reason, or empty when the request is authorized
     */
    public Optional<String> rejectionReason(String authorizationHeader) {
        if (apiSecret.isEmpty()) {
            if (openModeWarned.compareAndSet(false, true)) {
                logger.warn("app.api.secret is not set; mutating API requests are accepted without authentication.");
            }
            return Optional.empty();
        }
        if (!StringUtils.hasText(authorizationHeader)) {
            return Optional.of("Missing Authorization header");
        }
        String[] parts = authorizationHeader.trim().split(" ");
        if (parts.length != 2 || !BEARER_PREFIX.equals(parts[0])) {
            return Optional.of("Invalid Authorization header format. Expected: Bearer <token>");
        }
        boolean matches = MessageDigest.isEqual(
                parts[1].getBytes(StandardCharsets.UTF_8),
                apiSecret.getBytes(StandardCharsets.UTF_8));
        return matches ? Optional.empty() : Optional.of("Invalid API token");
    }
}
