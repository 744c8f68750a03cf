package com.elis.analysis.service;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers job submissions per user and {@code Idempotency-Key} so a resent request returns
 * the first response instead of queueing the work twice.
 */
@Service
public class IdempotencyService {

    public static final String HEADER = "Idempotency-Key";
    public static final String IN_PROGRESS = "PROCESSING";

    private static final Duration RESERVATION_TTL = Duration.ofSeconds(30);
    private static final Duration RESPONSE_TTL = Duration.ofHours(24);

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public String get(String userId, String idempotencyKey) {
        return redisTemplate.opsForValue().get(key(userId, idempotencyKey));
    }

    public boolean reserve(String userId, String idempotencyKey) {
        return Boolean.TRUE.equals(
                redisTemplate.opsForValue().setIfAbsent(key(userId, idempotencyKey), IN_PROGRESS, RESERVATION_TTL));
    }

    public void store(String userId, String idempotencyKey, String jsonResponse) {
        redisTemplate.opsForValue().set(key(userId, idempotencyKey), jsonResponse, RESPONSE_TTL);
    }

    /**
     * Drops a reservation whose submission was rejected, so the client can correct and resend.
     */
    public void release(String userId, String idempotencyKey) {
        redisTemplate.delete(key(userId, idempotencyKey));
    }

    public Optional<String> extractKey(HttpServletRequest request) {
        String header = request.getHeader(HEADER);

        if (header == null || header.isBlank()) {
            return Optional.empty();
        }

        try {
            UUID.fromString(header);
            return Optional.of(header);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String key(String userId, String idempotencyKey) {
        return "idempotency:" + userId + ":" + idempotencyKey;
    }
}
