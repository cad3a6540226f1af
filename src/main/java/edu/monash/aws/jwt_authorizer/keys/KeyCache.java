package edu.monash.aws.jwt_authorizer.keys;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.logging.LogLevel;
import com.nimbusds.jose.util.DefaultResourceRetriever;
import com.nimbusds.jose.util.Resource;
import com.nimbusds.jose.util.ResourceRetriever;
import edu.monash.aws.jwt_authorizer.AuthorizerConfig;
import edu.monash.aws.jwt_authorizer.DenyReason;

import java.io.IOException;
import java.net.URL;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Verification keys fetched from the JWKS endpoint, shared by every invocation of a
 * warm function instance.
 *
 * <p>Keys are only fetched after a lookup misses, and at most once per
 * {@code minRefreshInterval}: a miss inside the interval is denied without touching the
 * network. Lookups of cached keys never block. A refresh fetches and parses the whole
 * key set before publishing it as a new snapshot, so removed keys disappear as soon as
 * the provider drops them. Misses that arrive while a refresh is running wait for that
 * refresh instead of starting their own.
 */
public class KeyCache {
    protected static String userAgent = "jwt-lambda-authorizer";
    protected static int sizeLimit = 51200;

    private final URL jwksUri;
    private final ResourceRetriever retriever;
    private final KeySetParser parser;
    private final Duration minRefreshInterval;
    private final Clock clock;
    private final LambdaLogger logger;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final Object refreshLock = new Object();
    // guarded by refreshLock
    private CompletableFuture<Snapshot> inFlight;

    public KeyCache(URL jwksUri, ResourceRetriever retriever, Duration minRefreshInterval, Clock clock,
                    LambdaLogger logger) {
        this.jwksUri = jwksUri;
        this.retriever = retriever;
        this.parser = new KeySetParser(logger);
        this.minRefreshInterval = minRefreshInterval;
        this.clock = clock;
        this.logger = logger;
    }

    public static KeyCache create(AuthorizerConfig config, Clock clock, LambdaLogger logger) {
        DefaultResourceRetriever retriever = new DefaultResourceRetriever(
                config.getJwksConnectTimeout(), config.getJwksReadTimeout(), sizeLimit);
        retriever.setHeaders(Map.of("User-Agent", List.of(userAgent)));
        return new KeyCache(config.getJwksUri(), retriever, config.getMinRefreshRate(), clock, logger);
    }

    /**
     * @return the key published under {@code keyId}
     * @throws KeyCacheException if the key is unknown, even after a refresh, or the key set
     *                           could not be fetched
     */
    public KeyRecord lookup(String keyId) throws KeyCacheException {
        Snapshot observed = snapshot.get();
        KeyRecord key = observed.keys.get(keyId);
        if (key != null) {
            return key;
        }

        Snapshot refreshed = awaitRefresh(observed, keyId);
        key = refreshed.keys.get(keyId);
        if (key == null) {
            throw new KeyCacheException(DenyReason.KEY_NOT_FOUND, "Key '" + keyId + "' not found in JWKS");
        }
        return key;
    }

    public int size() {
        return snapshot.get().keys.size();
    }

    public Optional<Instant> getLastRefresh() {
        return Optional.ofNullable(snapshot.get().refreshedAt);
    }

    private Snapshot awaitRefresh(Snapshot observed, String keyId) throws KeyCacheException {
        CompletableFuture<Snapshot> pending;
        boolean owner = false;
        synchronized (refreshLock) {
            if (inFlight != null) {
                pending = inFlight;
            } else {
                Snapshot current = snapshot.get();
                if (current != observed) {
                    // a refresh completed after this lookup missed
                    return current;
                }
                if (!isRefreshDue(current)) {
                    throw new KeyCacheException(DenyReason.KEY_NOT_FOUND, "Key '" + keyId
                            + "' not found and JWKS was refreshed less than " + minRefreshInterval + " ago");
                }
                pending = new CompletableFuture<>();
                inFlight = pending;
                owner = true;
            }
        }

        if (owner) {
            try {
                pending.complete(refresh());
            } catch (KeyCacheException e) {
                pending.completeExceptionally(e);
            } catch (RuntimeException e) {
                pending.completeExceptionally(new KeyCacheException(DenyReason.UPSTREAM_FETCH_FAILED,
                        "Unexpected failure refreshing JWKS: " + e.getMessage(), e));
            } finally {
                if (!pending.isDone()) {
                    // an Error escaped the refresh, waiters must not block on it
                    pending.completeExceptionally(new KeyCacheException(DenyReason.UPSTREAM_FETCH_FAILED,
                            "JWKS refresh aborted"));
                }
                synchronized (refreshLock) {
                    inFlight = null;
                }
            }
        } else {
            logger.log("Waiting for in-flight JWKS refresh (kid='" + keyId + "')", LogLevel.DEBUG);
        }

        try {
            return pending.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof KeyCacheException) {
                KeyCacheException cause = (KeyCacheException) e.getCause();
                throw new KeyCacheException(cause.getReason(), cause.getMessage(), cause);
            }
            throw new KeyCacheException(DenyReason.UPSTREAM_FETCH_FAILED, "JWKS refresh failed", e);
        }
    }

    private boolean isRefreshDue(Snapshot current) {
        return current.refreshedAt == null
                || !clock.instant().isBefore(current.refreshedAt.plus(minRefreshInterval));
    }

    private Snapshot refresh() throws KeyCacheException {
        logger.log("Refreshing JWKS from '" + jwksUri + "'", LogLevel.INFO);
        Resource resource;
        try {
            resource = retriever.retrieveResource(jwksUri);
        } catch (IOException e) {
            logger.log("Failed to fetch JWKS from '" + jwksUri + "': " + e.getMessage(), LogLevel.WARN);
            throw new KeyCacheException(DenyReason.UPSTREAM_FETCH_FAILED,
                    "Failed to fetch JWKS: " + e.getMessage(), e);
        }

        Map<String, KeyRecord> keys;
        try {
            keys = parser.parse(resource.getContent());
        } catch (ParseException e) {
            logger.log("Failed to parse JWKS content from '" + jwksUri + "': " + e.getMessage(), LogLevel.WARN);
            throw new KeyCacheException(DenyReason.UPSTREAM_FETCH_FAILED,
                    "Failed to parse JWKS content: " + e.getMessage(), e);
        }

        Snapshot fresh = new Snapshot(keys, clock.instant());
        snapshot.set(fresh);
        logger.log("Cached " + keys.size() + " keys from '" + jwksUri + "': " + keys.keySet(), LogLevel.INFO);
        return fresh;
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(Map.of(), null);

        final Map<String, KeyRecord> keys;
        final Instant refreshedAt;

        Snapshot(Map<String, KeyRecord> keys, Instant refreshedAt) {
            this.keys = keys;
            this.refreshedAt = refreshedAt;
        }
    }
}
