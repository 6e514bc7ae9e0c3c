package com.thedigest.continuity.controller;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Per-caller request throttle for the since-last-read endpoints, keyed by the
 * forwarded client address. Idle callers are evicted after a few minutes.
 */
@Component
public class RequestThrottle {

    static final String UNKNOWN_CALLER = "unknown";

    private final double permitsPerSecond;
    private final Cache<String, RateLimiter> limiters;

    public RequestThrottle(@Value("${app.ratelimit.sinceLastReadQps:0.33}") double permitsPerSecond) {
        this.permitsPerSecond = permitsPerSecond;
        this.limiters = CacheBuilder.newBuilder()
                .maximumSize(10_000)
                .expireAfterAccess(Duration.ofMinutes(5))
                .build();
    }

    /**
     * @return true when the caller may proceed; never blocks
     */
    @SuppressWarnings("UnstableApiUsage")
    public boolean tryAcquire(HttpServletRequest request) {
        if (permitsPerSecond <= 0) {
            return true;
        }
        try {
            return limiters.get(callerKey(request), () -> RateLimiter.create(permitsPerSecond)).tryAcquire();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Could not create rate limiter", e);
        }
    }

    static String callerKey(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (StringUtils.hasText(realIp)) {
            return realIp.trim();
        }
        return StringUtils.hasText(request.getRemoteAddr()) ? request.getRemoteAddr() : UNKNOWN_CALLER;
    }
}
