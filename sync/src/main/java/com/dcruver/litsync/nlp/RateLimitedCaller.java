package com.dcruver.litsync.nlp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Wraps an external call with a response cache and retries.
 * <p>
 * Identical requests (same SHA-256 fingerprint of the serialized request and the
 * caller's name) are answered from the cache while fresh. Rate limits back off
 * exponentially, transient failures retry after a short fixed delay, and permanent
 * failures are rethrown at once.
 *
 * @param <Q> request type, must serialize deterministically with Jackson
 * @param <R> response type, must round-trip through Jackson
 */
@Slf4j
public class RateLimitedCaller<Q, R> {

    private final String name;
    private final ExternalCall<Q, R> delegate;
    private final Class<R> responseType;
    private final ResponseCache cache;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    private final ObjectMapper objectMapper = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .findAndAddModules()
        .build();

    public RateLimitedCaller(String name, ExternalCall<Q, R> delegate, Class<R> responseType,
                             ResponseCache cache, RetryPolicy policy, Sleeper sleeper) {
        this.name = name;
        this.delegate = delegate;
        this.responseType = responseType;
        this.cache = cache;
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public R call(Q request) throws ExternalCallException {
        String fingerprint = fingerprint(request);

        Optional<JsonNode> cached = cache.get(fingerprint);
        if (cached.isPresent()) {
            try {
                return objectMapper.treeToValue(cached.get(), responseType);
            } catch (JsonProcessingException e) {
                log.warn("Ignoring unreadable cache entry for {}: {}", name, e.getMessage());
            }
        }

        int rateLimited = 0;
        int transientFailures = 0;
        while (true) {
            try {
                R response = delegate.call(request);
                store(fingerprint, response);
                return response;
            } catch (ExternalCallException e) {
                if (!policy.isRetryable(e.getKind())) {
                    log.warn("{} failed permanently: {}", name, e.getMessage());
                    throw new ExternalCallException(ExternalCallException.Kind.PERMANENT,
                        "non-retryable: " + e.getMessage(), e);
                }

                Duration delay;
                if (e.getKind() == ExternalCallException.Kind.RATE_LIMITED) {
                    rateLimited++;
                    if (rateLimited >= policy.getMaxAttempts()) {
                        log.warn("{} still rate limited after {} attempts", name, rateLimited);
                        throw new RetriesExhaustedException(rateLimited + transientFailures, e);
                    }
                    delay = policy.backoffDelay(rateLimited);
                    log.info("{} rate limited, waiting {}s (attempt {}/{})",
                        name, delay.toSeconds(), rateLimited, policy.getMaxAttempts());
                } else {
                    transientFailures++;
                    if (transientFailures > policy.getTransientRetries()) {
                        log.warn("{} failed after {} transient retries: {}",
                            name, policy.getTransientRetries(), e.getMessage());
                        throw new RetriesExhaustedException(rateLimited + transientFailures, e);
                    }
                    delay = policy.getTransientDelay();
                    log.info("{} transient failure ({}), retrying in {}s", name, e.getMessage(), delay.toSeconds());
                }

                pause(delay, e);
            }
        }
    }

    private void pause(Duration delay, ExternalCallException cause) throws ExternalCallException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ExternalCallException(cause.getKind(), "interrupted while waiting to retry", ie);
        }
    }

    private void store(String fingerprint, R response) {
        try {
            cache.put(fingerprint, objectMapper.valueToTree(response));
        } catch (IOException e) {
            log.warn("Could not persist {} response to cache: {}", name, e.getMessage());
        }
    }

    /**
     * Deterministic SHA-256 over the caller name and the canonical JSON of the request.
     */
    public String fingerprint(Q request) {
        try {
            String canonical = name + "\n" + objectMapper.writeValueAsString(request);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request is not serializable: " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
