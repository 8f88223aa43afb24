package com.warden.security.apikey;

import com.warden.observability.RequestContext;
import com.warden.observability.SecurityEventType;
import com.warden.observability.testing.RecordingSecurityEventSink;
import com.warden.observability.testing.TestRequestContextFactory;
import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import com.warden.security.RateLimitExceededException;
import com.warden.security.ratelimit.InMemoryRateLimitCounter;
import com.warden.security.ratelimit.WindowType;
import com.warden.security.rbac.RbacEngine;
import com.warden.security.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayName("ApiKeyEngine")
class ApiKeyEngineTest {

    private static final ApiRequestInfo HTTPS = ApiRequestInfo.of("10.0.0.1", true);

    private final RequestContext ctx = TestRequestContextFactory.anonymous();

    private MutableClock clock;
    private InMemoryApiKeyStore store;
    private RbacEngine rbac;
    private RecordingSecurityEventSink events;
    private ApiKeyEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:10Z");
        store = new InMemoryApiKeyStore();
        rbac = new RbacEngine();
        rbac.assignUserRole("u1", "user");
        rbac.assignUserRole("boss", "admin");
        events = new RecordingSecurityEventSink();
        engine = new ApiKeyEngine(store, new InMemoryRateLimitCounter(), rbac,
                new ApiKeySettings("wk_", 32, Duration.ofDays(90), 3, true, 1000, WindowType.HOUR, true),
                clock, events);
    }

    private CreatedApiKey create(String userId, List<String> scopes) {
        return engine.createApiKey(ctx, userId, ApiKeyRequest.of("ci", scopes));
    }

    private static AuthErrorKind kindOf(Throwable e) {
        return ((AuthException) e).kind();
    }

    @Nested
    @DisplayName("createApiKey()")
    class Create {

        @Test
        @DisplayName("returns the raw key once and stores only its hash and prefix")
        void storesHashOnly() {
            CreatedApiKey created = create("u1", List.of("read:user"));

            ApiKey stored = store.findById(created.key().keyId()).orElseThrow();
            assertThat(created.rawKey()).startsWith("wk_").hasSize(3 + 43);
            assertThat(stored.keyHash()).isEqualTo(ApiKeyEngine.hash(created.rawKey())).hasSize(64);
            assertThat(stored.keyPrefix()).isEqualTo(created.rawKey().substring(0, 8));
            assertThat(stored.toString()).doesNotContain(created.rawKey()).doesNotContain(stored.keyHash());
            assertThat(created.toString()).doesNotContain(created.rawKey());
            assertThat(stored.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(90)));
            assertThat(stored.rateLimitWindow()).isEqualTo(WindowType.HOUR);
            assertThat(events.contains(SecurityEventType.API_KEY_CREATED)).isTrue();
        }

        @Test
        @DisplayName("enforces the per-user cap on active keys")
        void perUserCap() {
            create("u1", List.of("read:user"));
            create("u1", List.of("read:user"));
            CreatedApiKey third = create("u1", List.of("read:user"));

            assertThatThrownBy(() -> create("u1", List.of("read:user")))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_REQUEST))
                    .hasMessageContaining("(3)");

            engine.revokeApiKey(ctx, third.key().keyId(), "u1");
            assertThat(create("u1", List.of("read:user")).key().status()).isEqualTo(ApiKeyStatus.ACTIVE);
        }

        @Test
        @DisplayName("refuses scopes the creator does not hold")
        void scopeValidation() {
            assertThatThrownBy(() -> create("u1", List.of("read:user", "delete:user")))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INSUFFICIENT_SCOPE))
                    .hasMessageContaining("delete:user");
        }

        @Test
        @DisplayName("wildcard scopes need an equally broad grant")
        void wildcardScopes() {
            assertThatThrownBy(() -> create("u1", List.of("*:user")))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INSUFFICIENT_SCOPE));

            assertThat(create("boss", List.of("*:user", "read:*")).key().scopes())
                    .containsExactly("*:user", "read:*");
        }

        @Test
        @DisplayName("malformed scopes are invalid requests")
        void malformedScope() {
            assertThatThrownBy(() -> create("u1", List.of("read-user")))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_REQUEST));
        }
    }

    @Nested
    @DisplayName("authenticate()")
    class Authenticate {

        @Test
        @DisplayName("returns the principal and counts the request")
        void success() {
            CreatedApiKey created = create("u1", List.of("read:user"));

            ApiKeyPrincipal principal = engine.authenticate(ctx, created.rawKey(), HTTPS);

            assertThat(principal.keyId()).isEqualTo(created.key().keyId());
            assertThat(principal.userId()).isEqualTo("u1");
            assertThat(principal.scopes()).containsExactly("read:user");
            ApiKey stored = store.findById(created.key().keyId()).orElseThrow();
            assertThat(stored.totalRequests()).isEqualTo(1);
            assertThat(stored.lastUsed()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("unknown keys fail and are logged by prefix only")
        void unknownKey() {
            assertThatThrownBy(() -> engine.authenticate(ctx, "wk_doesnotexist_at_all", HTTPS))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.NOT_AUTHENTICATED));

            assertThat(events.ofType(SecurityEventType.API_KEY_REJECTED)).singleElement()
                    .satisfies(e -> assertThat(e.attributes())
                            .containsEntry("keyPrefix", "wk_doesn")
                            .containsEntry("reason", "invalid_key"));
        }

        @Test
        @DisplayName("revoked and unknown keys are rejected with the same message")
        void revokedIndistinguishableFromUnknown() {
            CreatedApiKey created = create("u1", List.of("read:user"));
            engine.revokeApiKey(ctx, created.key().keyId(), "u1");

            Throwable revoked = catchThrowable(() -> engine.authenticate(ctx, created.rawKey(), HTTPS));
            Throwable unknown = catchThrowable(() -> engine.authenticate(ctx, "wk_garbage_key_never_issued", HTTPS));

            assertThat(revoked).isInstanceOf(AuthException.class).hasMessage(ApiKeyEngine.INVALID_KEY);
            assertThat(unknown).isInstanceOf(AuthException.class).hasMessage(revoked.getMessage());
            assertThat(events.ofType(SecurityEventType.API_KEY_REJECTED))
                    .extracting(e -> e.attributes().get("reason"))
                    .containsExactly("key_revoked", "invalid_key");
        }

        @Test
        @DisplayName("suspended keys fail and count a failed request")
        void suspended() {
            CreatedApiKey created = create("u1", List.of("read:user"));
            engine.suspendApiKey(ctx, created.key().keyId(), "u1");

            assertThatThrownBy(() -> engine.authenticate(ctx, created.rawKey(), HTTPS))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.NOT_AUTHENTICATED));
            assertThat(store.findById(created.key().keyId()).orElseThrow().failedRequests()).isEqualTo(1);

            engine.reactivateApiKey(ctx, created.key().keyId(), "u1");
            assertThat(engine.authenticate(ctx, created.rawKey(), HTTPS).userId()).isEqualTo("u1");
        }

        @Test
        @DisplayName("expired keys transition to EXPIRED on first use")
        void expired() {
            CreatedApiKey created = engine.createApiKey(ctx, "u1", new ApiKeyRequest("short", null,
                    List.of("read:user"), null, Duration.ofHours(1), null, null, null, null));
            clock.advance(Duration.ofHours(2));

            assertThatThrownBy(() -> engine.authenticate(ctx, created.rawKey(), HTTPS))
                    .hasMessage(ApiKeyEngine.INVALID_KEY);
            assertThat(store.findById(created.key().keyId()).orElseThrow().status()).isEqualTo(ApiKeyStatus.EXPIRED);
            assertThatThrownBy(() -> engine.reactivateApiKey(ctx, created.key().keyId(), "u1"))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INVALID_REQUEST));
        }

        @Test
        @DisplayName("enforces the IP allow-list and the HTTPS requirement")
        void transportChecks() {
            CreatedApiKey created = engine.createApiKey(ctx, "u1", new ApiKeyRequest("office", null,
                    List.of("read:user"), null, null, null, null, List.of("192.168.0.0/16"), true));

            assertThatThrownBy(() -> engine.authenticate(ctx, created.rawKey(), ApiRequestInfo.of("10.0.0.1", true)))
                    .hasMessage(ApiKeyEngine.INVALID_KEY);
            assertThatThrownBy(() -> engine.authenticate(ctx, created.rawKey(), ApiRequestInfo.of("192.168.1.1", false)))
                    .hasMessage(ApiKeyEngine.INVALID_KEY);
            assertThat(engine.authenticate(ctx, created.rawKey(), ApiRequestInfo.of("192.168.1.1", true)).userId())
                    .isEqualTo("u1");
            assertThat(store.findById(created.key().keyId()).orElseThrow().failedRequests()).isEqualTo(2);
        }

        @Test
        @DisplayName("three per minute: the fourth fails, the next minute succeeds")
        void rateLimit() {
            CreatedApiKey created = engine.createApiKey(ctx, "u1", new ApiKeyRequest("limited", null,
                    List.of("read:user"), null, null, 3, WindowType.MINUTE, null, null));
            for (int i = 0; i < 3; i++) {
                engine.authenticate(ctx, created.rawKey(), HTTPS);
            }

            assertThatThrownBy(() -> engine.authenticate(ctx, created.rawKey(), HTTPS))
                    .isInstanceOf(RateLimitExceededException.class)
                    .satisfies(e -> {
                        RateLimitExceededException limited = (RateLimitExceededException) e;
                        assertThat(limited.window()).isEqualTo("minute");
                        assertThat(limited.limit()).isEqualTo(3);
                        assertThat(limited.retryAfter()).isEqualTo(Duration.ofSeconds(50));
                    });
            assertThat(events.contains(SecurityEventType.RATE_LIMIT_EXCEEDED)).isTrue();

            clock.set(Instant.parse("2026-03-01T10:01:00Z"));
            assertThat(engine.authenticate(ctx, created.rawKey(), HTTPS).userId()).isEqualTo("u1");
            ApiKey stored = store.findById(created.key().keyId()).orElseThrow();
            assertThat(stored.totalRequests()).isEqualTo(4);
            assertThat(stored.failedRequests()).isEqualTo(1);
        }

        @Test
        @DisplayName("blank keys are rejected without a lookup")
        void blankKey() {
            assertThatThrownBy(() -> engine.authenticate(ctx, " ", HTTPS))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.NOT_AUTHENTICATED));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("rotation revokes the old key and keeps the policy")
        void rotation() {
            CreatedApiKey original = engine.createApiKey(ctx, "u1", new ApiKeyRequest("ci", "pipeline",
                    List.of("read:user"), "t1", null, 5, WindowType.MINUTE, List.of("*"), false));

            CreatedApiKey rotated = engine.rotateApiKey(ctx, original.key().keyId(), "u1");

            assertThat(rotated.rawKey()).isNotEqualTo(original.rawKey());
            assertThat(rotated.key().rotatedFrom()).isEqualTo(original.key().keyId());
            assertThat(rotated.key().scopes()).isEqualTo(original.key().scopes());
            assertThat(rotated.key().rateLimitRequests()).isEqualTo(5);
            assertThat(rotated.key().rateLimitWindow()).isEqualTo(WindowType.MINUTE);
            assertThat(rotated.key().tenantId()).isEqualTo("t1");
            assertThat(rotated.key().requireHttps()).isFalse();
            assertThat(store.findById(original.key().keyId()).orElseThrow().status()).isEqualTo(ApiKeyStatus.REVOKED);
            assertThatThrownBy(() -> engine.authenticate(ctx, original.rawKey(), HTTPS))
                    .isInstanceOf(AuthException.class);
            assertThat(engine.authenticate(ctx, rotated.rawKey(), HTTPS).keyId()).isEqualTo(rotated.key().keyId());
            assertThatThrownBy(() -> engine.rotateApiKey(ctx, original.key().keyId(), "u1"))
                    .hasMessage("Can only rotate active API keys");
        }

        @Test
        @DisplayName("other users' keys look like missing keys")
        void ownership() {
            CreatedApiKey created = create("u1", List.of("read:user"));

            assertThatThrownBy(() -> engine.revokeApiKey(ctx, created.key().keyId(), "someone-else"))
                    .hasMessage(ApiKeyEngine.NOT_FOUND);
            assertThatThrownBy(() -> engine.revokeApiKey(ctx, "missing", "u1"))
                    .hasMessage(ApiKeyEngine.NOT_FOUND);
            assertThat(engine.getApiKey(created.key().keyId(), "someone-else")).isEmpty();
        }

        @Test
        @DisplayName("update changes policy and validates new scopes")
        void update() {
            CreatedApiKey created = create("u1", List.of("read:user"));

            ApiKey updated = engine.updateApiKey(ctx, created.key().keyId(), "u1",
                    new ApiKeyUpdate("renamed", null, List.of("update:profile"), 10, WindowType.DAY, null, null));

            assertThat(updated.name()).isEqualTo("renamed");
            assertThat(updated.scopes()).containsExactly("update:profile");
            assertThat(updated.rateLimitRequests()).isEqualTo(10);
            assertThat(updated.rateLimitWindow()).isEqualTo(WindowType.DAY);
            assertThat(updated.keyHash()).isEqualTo(created.key().keyHash());
            assertThatThrownBy(() -> engine.updateApiKey(ctx, created.key().keyId(), "u1",
                    new ApiKeyUpdate(null, null, List.of("delete:user"), null, null, null, null)))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(AuthErrorKind.INSUFFICIENT_SCOPE));
        }

        @Test
        @DisplayName("listing hides inactive keys unless asked")
        void listing() {
            CreatedApiKey first = create("u1", List.of("read:user"));
            clock.advance(Duration.ofSeconds(1));
            CreatedApiKey second = create("u1", List.of("read:user"));
            engine.revokeApiKey(ctx, first.key().keyId(), "u1");

            assertThat(engine.listApiKeys("u1", false)).extracting(ApiKey::keyId)
                    .containsExactly(second.key().keyId());
            assertThat(engine.listApiKeys("u1", true)).extracting(ApiKey::keyId)
                    .containsExactly(second.key().keyId(), first.key().keyId());
        }

        @Test
        @DisplayName("recordUsage counts error responses as failures")
        void recordUsage() {
            CreatedApiKey created = create("u1", List.of("read:user"));

            engine.recordUsage(created.key().keyId(), 200);
            engine.recordUsage(created.key().keyId(), 503);
            engine.recordUsage("missing", 500);

            assertThat(store.findById(created.key().keyId()).orElseThrow().failedRequests()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("hasScope requires the exact scope and a matching tenant")
    void hasScope() {
        ApiKeyPrincipal principal = new ApiKeyPrincipal("k1", "u1", "t1", List.of("read:billing"), "ci");

        assertThat(engine.hasScope(principal, "read:billing", null)).isTrue();
        assertThat(engine.hasScope(principal, "read:billing", "t1")).isTrue();
        assertThat(engine.hasScope(principal, "read:billing", "t2")).isFalse();
        assertThat(engine.hasScope(principal, "write:billing", "t1")).isFalse();
    }
}
