package com.warden.security.apikey;

import com.warden.observability.RequestContext;
import com.warden.observability.SecurityEvent;
import com.warden.observability.SecurityEventSink;
import com.warden.observability.SecurityEventType;
import com.warden.observability.SensitiveDataRedactor;
import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import com.warden.security.RateLimitExceededException;
import com.warden.security.concurrent.StripedLocks;
import com.warden.security.ratelimit.RateLimitCounter;
import com.warden.security.ratelimit.RateLimitDecision;
import com.warden.security.ratelimit.WindowType;
import com.warden.security.rbac.MatchTerm;
import com.warden.security.rbac.Permission;
import com.warden.security.rbac.RbacEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Issues, authenticates and manages long-lived, scoped, rate-limited API keys.
 * <p>
 * Raw keys are {@code <prefix><url-safe random>}; only their SHA-256 hash and the first eight
 * characters are kept. Logs and events carry that eight-character prefix and nothing more.
 * <p>
 * Mutations of one user's keys are serialized per user so the per-user key cap and rotation
 * cannot race. Authentication touches only the presented key and relies on the store's atomic
 * update and the counter's atomic increment.
 */
public final class ApiKeyEngine {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyEngine.class);

    static final String NOT_FOUND = "API key not found";
    /** Shared by every rejection; the specific reason goes only to the log and the security event. */
    static final String INVALID_KEY = "Invalid API key";

    private final ApiKeyStore store;
    private final RateLimitCounter rateLimits;
    private final RbacEngine rbac;
    private final ApiKeySettings settings;
    private final Clock clock;
    private final SecurityEventSink events;
    private final SecureRandom random = new SecureRandom();
    private final StripedLocks userLocks = new StripedLocks();

    /**
     * @param rbac engine used to validate requested scopes; null disables scope validation
     */
    public ApiKeyEngine(ApiKeyStore store, RateLimitCounter rateLimits, RbacEngine rbac,
                        ApiKeySettings settings, Clock clock, SecurityEventSink events) {
        if (store == null || rateLimits == null || settings == null || clock == null) {
            throw new IllegalArgumentException("store, rateLimits, settings and clock must not be null");
        }
        this.store = store;
        this.rateLimits = rateLimits;
        this.rbac = rbac;
        this.settings = settings;
        this.clock = clock;
        this.events = events == null ? SecurityEventSink.NOOP : events;
    }

    // ---- issuance --------------------------------------------------------------------------

    /**
     * Creates a key for {@code userId}. The raw key in the result is never retrievable again.
     *
     * @throws AuthException INVALID_REQUEST when the user already holds the maximum number of
     *                       active keys, INSUFFICIENT_SCOPE when a scope exceeds the user's grants
     */
    public CreatedApiKey createApiKey(RequestContext context, String userId, ApiKeyRequest request) {
        requireUser(userId);
        return userLocks.withLock(userId, () -> {
            long active = store.listByUser(userId).stream()
                    .filter(k -> k.status() == ApiKeyStatus.ACTIVE)
                    .count();
            if (active >= settings.maxKeysPerUser()) {
                throw AuthException.invalidRequest(
                        "Maximum API keys limit (%d) reached".formatted(settings.maxKeysPerUser()));
            }
            validateScopes(userId, request.scopes());

            Instant now = clock.instant();
            String rawKey = generateRawKey();
            Instant expiresAt = request.expiresIn() != null ? now.plus(request.expiresIn())
                    : settings.defaultExpiry() != null ? now.plus(settings.defaultExpiry()) : null;
            ApiKey key = new ApiKey(
                    generateKeyId(),
                    hash(rawKey),
                    displayPrefix(rawKey),
                    userId,
                    request.tenantId(),
                    request.name(),
                    request.description(),
                    request.scopes(),
                    ApiKeyStatus.ACTIVE,
                    request.rateLimitRequests() != null ? request.rateLimitRequests() : settings.defaultRateLimitRequests(),
                    request.rateLimitWindow() != null ? request.rateLimitWindow() : settings.defaultRateLimitWindow(),
                    request.allowedIps(),
                    request.requireHttps() != null ? request.requireHttps() : settings.requireHttpsByDefault(),
                    now,
                    expiresAt,
                    null,
                    0L,
                    0L,
                    null);
            store.save(key);
            log.info("Created API key {} ({}) for user '{}'", key.keyId(), key.keyPrefix(), userId);
            publish(SecurityEventType.API_KEY_CREATED, context, key, null);
            return new CreatedApiKey(key, rawKey);
        });
    }

    /**
     * Replaces an active key with a new one carrying the same policy. The old key is revoked and
     * the new raw key is returned once.
     */
    public CreatedApiKey rotateApiKey(RequestContext context, String keyId, String userId) {
        requireUser(userId);
        return userLocks.withLock(userId, () -> {
            ApiKey old = ownedKey(keyId, userId);
            if (old.status() != ApiKeyStatus.ACTIVE) {
                throw AuthException.invalidRequest("Can only rotate active API keys");
            }
            String rawKey = generateRawKey();
            ApiKey replacement = new ApiKey(
                    generateKeyId(),
                    hash(rawKey),
                    displayPrefix(rawKey),
                    old.userId(),
                    old.tenantId(),
                    old.name(),
                    old.description(),
                    old.scopes(),
                    ApiKeyStatus.ACTIVE,
                    old.rateLimitRequests(),
                    old.rateLimitWindow(),
                    old.allowedIps(),
                    old.requireHttps(),
                    clock.instant(),
                    old.expiresAt(),
                    null,
                    0L,
                    0L,
                    old.keyId());
            store.save(replacement);
            store.update(old.keyId(), k -> k.withStatus(ApiKeyStatus.REVOKED));
            log.info("Rotated API key {} ({}) to {} ({})",
                    old.keyId(), old.keyPrefix(), replacement.keyId(), replacement.keyPrefix());
            publish(SecurityEventType.API_KEY_ROTATED, context, replacement, null);
            return new CreatedApiKey(replacement, rawKey);
        });
    }

    // ---- authentication --------------------------------------------------------------------

    /**
     * Authenticates a raw key. Checks run in a fixed order: hash lookup, status, expiry, IP
     * allow-list, HTTPS, rate limit; only then are the usage counters updated. Every failure
     * after the lookup counts as a failed request on the key.
     *
     * @throws AuthException              NOT_AUTHENTICATED for unknown, inactive, expired or
     *                                    disallowed use
     * @throws RateLimitExceededException when the key's window is used up
     */
    public ApiKeyPrincipal authenticate(RequestContext context, String rawKey, ApiRequestInfo request) {
        ApiRequestInfo info = request == null ? ApiRequestInfo.of(null, true) : request;
        if (rawKey == null || rawKey.isBlank()) {
            throw AuthException.notAuthenticated("API key required");
        }
        Optional<ApiKey> found = store.findByHash(hash(rawKey));
        if (found.isEmpty()) {
            reject(context, null, rawKey, "invalid_key", info);
            throw AuthException.notAuthenticated(INVALID_KEY);
        }
        ApiKey key = found.get();
        Instant now = clock.instant();

        if (key.status() != ApiKeyStatus.ACTIVE) {
            fail(context, key, "key_" + key.status().name().toLowerCase(Locale.ROOT), info);
            throw AuthException.notAuthenticated(INVALID_KEY);
        }
        if (key.isExpiredAt(now)) {
            store.update(key.keyId(), k -> k.status() == ApiKeyStatus.ACTIVE ? k.withStatus(ApiKeyStatus.EXPIRED) : k);
            fail(context, key, "key_expired", info);
            throw AuthException.notAuthenticated(INVALID_KEY);
        }
        if (info.ipAddress() != null && !IpAllowList.isAllowed(info.ipAddress(), key.allowedIps())) {
            fail(context, key, "ip_not_allowed", info);
            throw AuthException.notAuthenticated(INVALID_KEY);
        }
        if (key.requireHttps() && !info.https()) {
            fail(context, key, "https_required", info);
            throw AuthException.notAuthenticated(INVALID_KEY);
        }
        RateLimitDecision decision = rateLimits.tryAcquire(key.keyId(), key.rateLimitWindow(),
                key.rateLimitRequests(), now);
        if (!decision.allowed()) {
            fail(context, key, "rate_limited", info);
            events.publish(SecurityEvent.of(SecurityEventType.RATE_LIMIT_EXCEEDED, context)
                    .at(now)
                    .subject(key.userId())
                    .tenant(key.tenantId())
                    .with("keyId", key.keyId())
                    .with("window", decision.windowType().label())
                    .with("limit", decision.limit())
                    .build());
            decision.throwIfDenied();
        }

        ApiKey used = store.update(key.keyId(), k -> k.withSuccessfulUse(now)).orElse(key);
        log.debug("API key {} authenticated ({} of {} this {})", used.keyPrefix(), decision.count(),
                decision.limit(), decision.windowType().label());
        return new ApiKeyPrincipal(used.keyId(), used.userId(), used.tenantId(), used.scopes(), used.name());
    }

    /**
     * Whether an authenticated key carries {@code scope}, and, when both sides name a tenant, that
     * the resource belongs to the key's tenant.
     */
    public boolean hasScope(ApiKeyPrincipal principal, String scope, String resourceTenantId) {
        if (principal == null || scope == null || !principal.scopes().contains(scope)) {
            return false;
        }
        return resourceTenantId == null || principal.tenantId() == null
                || principal.tenantId().equals(resourceTenantId);
    }

    /**
     * Records the outcome of a request made with the key; error responses count as failures.
     */
    public void recordUsage(String keyId, int statusCode) {
        if (statusCode >= 400) {
            store.update(keyId, ApiKey::withFailedRequest);
        }
    }

    // ---- management ------------------------------------------------------------------------

    public ApiKey revokeApiKey(RequestContext context, String keyId, String userId) {
        ApiKey revoked = transition(keyId, userId, ApiKeyStatus.REVOKED,
                Set.of(ApiKeyStatus.ACTIVE, ApiKeyStatus.SUSPENDED, ApiKeyStatus.EXPIRED, ApiKeyStatus.REVOKED));
        publish(SecurityEventType.API_KEY_REVOKED, context, revoked, null);
        return revoked;
    }

    public ApiKey suspendApiKey(RequestContext context, String keyId, String userId) {
        return transition(keyId, userId, ApiKeyStatus.SUSPENDED, Set.of(ApiKeyStatus.ACTIVE, ApiKeyStatus.SUSPENDED));
    }

    /**
     * Returns a suspended key to service. Revoked and expired keys stay dead.
     */
    public ApiKey reactivateApiKey(RequestContext context, String keyId, String userId) {
        return transition(keyId, userId, ApiKeyStatus.ACTIVE, Set.of(ApiKeyStatus.SUSPENDED, ApiKeyStatus.ACTIVE));
    }

    /**
     * Changes a key's name, description, scopes, rate limit or IP restrictions. New scopes are
     * validated against the owner's grants like on creation.
     */
    public ApiKey updateApiKey(RequestContext context, String keyId, String userId, ApiKeyUpdate update) {
        requireUser(userId);
        return userLocks.withLock(userId, () -> {
            ApiKey current = ownedKey(keyId, userId);
            if (update.scopes() != null) {
                if (update.scopes().isEmpty()) {
                    throw AuthException.invalidRequest("scopes must not be empty");
                }
                validateScopes(userId, update.scopes());
            }
            if (update.rateLimitRequests() != null && update.rateLimitRequests() <= 0) {
                throw AuthException.invalidRequest("rateLimitRequests must be positive");
            }
            ApiKey updated = store.update(current.keyId(), k -> k.withPolicy(
                    update.name() != null ? update.name() : k.name(),
                    update.description() != null ? update.description() : k.description(),
                    update.scopes() != null ? update.scopes() : k.scopes(),
                    update.rateLimitRequests() != null ? update.rateLimitRequests() : k.rateLimitRequests(),
                    update.rateLimitWindow() != null ? update.rateLimitWindow() : k.rateLimitWindow(),
                    update.allowedIps() != null ? update.allowedIps() : k.allowedIps(),
                    update.requireHttps() != null ? update.requireHttps() : k.requireHttps()))
                    .orElseThrow(() -> AuthException.invalidRequest(NOT_FOUND));
            log.info("Updated API key {} ({})", updated.keyId(), updated.keyPrefix());
            return updated;
        });
    }

    /**
     * The user's keys, newest first.
     */
    public List<ApiKey> listApiKeys(String userId, boolean includeInactive) {
        return store.listByUser(userId).stream()
                .filter(k -> includeInactive || k.status() == ApiKeyStatus.ACTIVE)
                .sorted(Comparator.comparing(ApiKey::createdAt).reversed().thenComparing(ApiKey::keyId))
                .toList();
    }

    public Optional<ApiKey> getApiKey(String keyId, String userId) {
        return store.findById(keyId).filter(k -> k.userId().equals(userId));
    }

    /**
     * Drops rate-limit windows that have ended. Meant for a periodic task.
     */
    public int purgeStaleRateLimitWindows() {
        int purged = rateLimits.purgeBefore(clock.instant());
        if (purged > 0) {
            log.info("Purged {} stale rate-limit window(s)", purged);
        }
        return purged;
    }

    // ---- helpers ---------------------------------------------------------------------------

    private ApiKey transition(String keyId, String userId, ApiKeyStatus target, Set<ApiKeyStatus> allowedFrom) {
        requireUser(userId);
        return userLocks.withLock(userId, () -> {
            ApiKey current = ownedKey(keyId, userId);
            if (!allowedFrom.contains(current.status())) {
                throw AuthException.invalidRequest("Cannot change API key from %s to %s"
                        .formatted(current.status(), target));
            }
            ApiKey updated = store.update(keyId, k -> k.withStatus(target))
                    .orElseThrow(() -> AuthException.invalidRequest(NOT_FOUND));
            log.info("API key {} ({}) is now {}", updated.keyId(), updated.keyPrefix(), target);
            return updated;
        });
    }

    private ApiKey ownedKey(String keyId, String userId) {
        return getApiKey(keyId, userId).orElseThrow(() -> AuthException.invalidRequest(NOT_FOUND));
    }

    private void validateScopes(String userId, List<String> scopes) {
        List<Permission> requested;
        try {
            requested = scopes.stream().map(Permission::parse).toList();
        } catch (IllegalArgumentException e) {
            throw AuthException.invalidRequest(e.getMessage());
        }
        if (rbac == null || !settings.requireScopeValidation()) {
            return;
        }
        Set<Permission> granted = null;
        for (int i = 0; i < requested.size(); i++) {
            Permission scope = requested.get(i);
            boolean allowed;
            if (isLiteral(scope)) {
                allowed = rbac.checkPermission(userId, scope.action(), scope.resource());
            } else {
                if (granted == null) {
                    granted = rbac.getEffectivePermissions(userId);
                }
                allowed = granted.stream().anyMatch(grant -> covers(grant, scope));
            }
            if (!allowed) {
                throw new AuthException(AuthErrorKind.INSUFFICIENT_SCOPE,
                        "User does not have permission for scope: %s".formatted(scopes.get(i)));
            }
        }
    }

    private static boolean isLiteral(Permission permission) {
        return permission.actionTerm() instanceof MatchTerm.Literal
                && permission.resourceTerm() instanceof MatchTerm.Literal;
    }

    /**
     * A wildcard or pattern scope is only delegable from an unconditional grant at least as broad
     * on both sides.
     */
    private static boolean covers(Permission grant, Permission requested) {
        return !grant.isConditional()
                && covers(grant.actionTerm(), requested.actionTerm())
                && covers(grant.resourceTerm(), requested.resourceTerm());
    }

    private static boolean covers(MatchTerm grant, MatchTerm requested) {
        if (grant instanceof MatchTerm.Wildcard) {
            return true;
        }
        if (requested instanceof MatchTerm.Literal) {
            return grant.matches(requested);
        }
        return grant.value().equals(requested.value());
    }

    private void fail(RequestContext context, ApiKey key, String reason, ApiRequestInfo info) {
        store.update(key.keyId(), ApiKey::withFailedRequest);
        reject(context, key, null, reason, info);
    }

    private void reject(RequestContext context, ApiKey key, String rawKey, String reason, ApiRequestInfo info) {
        String prefix = key != null ? key.keyPrefix() : displayPrefix(rawKey);
        log.warn("Failed API key authentication: {} for key {}... from IP {}",
                reason, prefix, info.ipAddress() == null ? "unknown" : info.ipAddress());
        events.publish(SecurityEvent.of(SecurityEventType.API_KEY_REJECTED, context)
                .at(clock.instant())
                .subject(key != null ? key.userId() : null)
                .tenant(key != null ? key.tenantId() : null)
                .with("keyPrefix", prefix)
                .with("reason", reason)
                .with("ipAddress", info.ipAddress())
                .with("userAgent", info.userAgent())
                .build());
    }

    private void publish(SecurityEventType type, RequestContext context, ApiKey key, String reason) {
        events.publish(SecurityEvent.of(type, context)
                .at(clock.instant())
                .subject(key.userId())
                .tenant(key.tenantId())
                .with("keyId", key.keyId())
                .with("keyPrefix", key.keyPrefix())
                .with("rotatedFrom", key.rotatedFrom())
                .with("reason", reason)
                .build());
    }

    private String generateRawKey() {
        byte[] bytes = new byte[settings.keyBytes()];
        random.nextBytes(bytes);
        return settings.keyPrefix() + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private String generateKeyId() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String displayPrefix(String rawKey) {
        if (rawKey == null || rawKey.length() <= SensitiveDataRedactor.VISIBLE_PREFIX_LENGTH) {
            return SensitiveDataRedactor.REDACTED;
        }
        return rawKey.substring(0, SensitiveDataRedactor.VISIBLE_PREFIX_LENGTH);
    }

    static String hash(String rawKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawKey.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw AuthException.invalidRequest("userId must not be null or blank");
        }
    }
}
