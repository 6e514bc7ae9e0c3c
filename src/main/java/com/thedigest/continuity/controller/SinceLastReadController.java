package com.thedigest.continuity.controller;

import com.thedigest.continuity.dto.AcknowledgeRequest;
import com.thedigest.continuity.dto.AcknowledgeResponse;
import com.thedigest.continuity.dto.ContinuityStateView;
import com.thedigest.continuity.dto.ErrorResponse;
import com.thedigest.continuity.dto.SinceLastReadPayload;
import com.thedigest.continuity.service.CandidateStoreUnavailableException;
import com.thedigest.continuity.service.ClientIds;
import com.thedigest.continuity.service.ContinuityEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Optional;

@RestController
@RequestMapping("/api/since-last-read")
@Tag(name = "Since Last Read", description = "Catch-up snapshots relative to the client's last acknowledged visit")
public class SinceLastReadController {

    private static final Logger logger = LoggerFactory.getLogger(SinceLastReadController.class);

    static final String CLIENT_ID_HEADER = "X-Digest-Client-Id";
    static final String CLIENT_ID_COOKIE = "the_digest_client_id";
    static final Duration COOKIE_MAX_AGE = Duration.ofDays(365);

    private final ContinuityEngine continuityEngine;
    private final ApiRequestAuthenticator authenticator;
    private final RequestThrottle throttle;

    public SinceLastReadController(ContinuityEngine continuityEngine,
                                   ApiRequestAuthenticator authenticator,
                                   RequestThrottle throttle) {
        this.continuityEngine = continuityEngine;
        this.authenticator = authenticator;
        this.throttle = throttle;
    }

    @Operation(
            summary = "Get the since-last-read snapshot",
            description = "Ranks what was published since the client's last acknowledged visit and returns highlights, " +
                    "a brief and citations. Reading does not move the watermark."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Snapshot computed or served from cache",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = SinceLastReadPayload.class))),
            @ApiResponse(responseCode = "429", description = "Too many requests", content = @Content),
            @ApiResponse(responseCode = "503", description = "Article store unavailable", content = @Content)
    })
    @GetMapping
    public ResponseEntity<?> getSinceLastRead(
            @Parameter(description = "shallow | medium | deep (legacy: 2m | 10m)")
            @RequestParam(value = "depth", required = false) String depth,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientHeader,
            @CookieValue(value = CLIENT_ID_COOKIE, required = false) String clientCookie,
            HttpServletRequest request) {
        if (!throttle.tryAcquire(request)) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(new ErrorResponse("Too many requests"));
        }
        try {
            SinceLastReadPayload payload = continuityEngine.getSinceLastRead(resolveClientId(clientHeader, clientCookie), depth);
            return ResponseEntity.ok()
                    .header(HttpHeaders.SET_COOKIE, clientCookie(payload.state().clientId()))
                    .body(payload);
        } catch (CandidateStoreUnavailableException e) {
            logger.error("Since-last-read unavailable: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(e.getMessage()));
        }
    }

    @Operation(
            summary = "Acknowledge the snapshot as read",
            description = "Moves the client's watermark to untilAt (or now) and remembers the preferred depth."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Watermark updated",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = AcknowledgeResponse.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token", content = @Content),
            @ApiResponse(responseCode = "429", description = "Too many requests", content = @Content)
    })
    @PostMapping
    public ResponseEntity<?> acknowledge(
            @RequestBody(required = false) AcknowledgeRequest body,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientHeader,
            @CookieValue(value = CLIENT_ID_COOKIE, required = false) String clientCookie,
            HttpServletRequest request) {
        Optional<String> rejection = authenticator.rejectionReason(authorization);
        if (rejection.isPresent()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse(rejection.get()));
        }
        if (!throttle.tryAcquire(request)) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(new ErrorResponse("Too many requests"));
        }

        String depth = body != null ? body.getDepth() : null;
        String untilAt = body != null ? body.getUntilAt() : null;
        ContinuityStateView state = continuityEngine.acknowledge(resolveClientId(clientHeader, clientCookie), depth, untilAt);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, clientCookie(state.clientId()))
                .body(new AcknowledgeResponse(true, state));
    }

    static String resolveClientId(String header, String cookie) {
        if (StringUtils.hasText(header)) {
            return header.trim();
        }
        if (StringUtils.hasText(cookie)) {
            return cookie.trim();
        }
        return ClientIds.ANONYMOUS;
    }

    private static String clientCookie(String clientId) {
        return ResponseCookie.from(CLIENT_ID_COOKIE, clientId)
                .maxAge(COOKIE_MAX_AGE)
                .path("/")
                .sameSite("Lax")
                .build()
                .toString();
    }
}
