package com.thedigest.continuity.service;

import com.thedigest.continuity.model.Depth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.OffsetDateTime;
import java.util.List;

@Service
public class SnapshotHashingService {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotHashingService.class);

    static final int HASH_LENGTH = 24;

    private final MessageDigest digest;

    /**
     * Initializes the SHA-256 message digest used for snapshot keys.
     */
    public SnapshotHashingService() {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            logger.error("Could not initialize SHA-256 MessageDigest", e);
            throw new RuntimeException("Failed to initialize hashing service", e);
        }
    }

    /**
     * Computes the content-addressed cache key for one since-last-read computation.
     * The candidate ids are hashed in the order given, which is the ranked order.
     *
     * @param clientId     normalized client id
     * @param depth        effective depth
     * @param sinceAt      lower bound of the delta window
     * @param candidateIds ids of every ranked candidate
     * @return the first 24 hex characters of the SHA-256 digest
     */
    public synchronized String snapshotHash(String clientId, Depth depth, OffsetDateTime sinceAt, List<String> candidateIds) {
        String material = clientId
                + "|" + depth.code()
                + "|" + sinceAt.toInstant()
                + "|" + String.join(",", candidateIds);
        byte[] encodedhash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
        return bytesToHex(encodedhash).substring(0, HASH_LENGTH);
    }

    /**
     * Converts a raw byte array into a lowercase hexadecimal string.
     */
    private String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
