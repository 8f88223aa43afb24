package com.warden.authservice.config;

import com.warden.authservice.config.WardenProperties.Backend;
import com.warden.observability.LoggingSecurityEventSink;
import com.warden.observability.SecurityEventSink;
import com.warden.observability.SecurityMetrics;
import com.warden.observability.SensitiveDataRedactor;
import com.warden.security.apikey.ApiKeyEngine;
import com.warden.security.apikey.ApiKeySettings;
import com.warden.security.apikey.ApiKeyStore;
import com.warden.security.apikey.InMemoryApiKeyStore;
import com.warden.security.edge.EdgeAuthority;
import com.warden.security.edge.EdgeSettings;
import com.warden.security.edge.SensitivityRouter;
import com.warden.security.mfa.MfaProvider;
import com.warden.security.mfa.NoOpMfaProvider;
import com.warden.security.mfa.ScopeBasedMfaPolicy;
import com.warden.security.ratelimit.InMemoryRateLimitCounter;
import com.warden.security.ratelimit.KeyValueRateLimitCounter;
import com.warden.security.ratelimit.RateLimitCounter;
import com.warden.security.rbac.RbacEngine;
import com.warden.security.rbac.RoleConfigCodec;
import com.warden.security.session.InMemorySessionStore;
import com.warden.security.session.KeyValueSessionStore;
import com.warden.security.session.SessionManager;
import com.warden.security.session.SessionSettings;
import com.warden.security.session.SessionStore;
import com.warden.security.store.JedisKeyValueClient;
import com.warden.security.store.KeyValueClient;
import com.warden.security.store.KeyValueSettings;
import com.warden.security.token.JwtCodec;
import com.warden.security.token.ServiceTokenService;
import com.warden.security.token.StaticSigningKeyProvider;
import com.warden.security.token.TokenService;
import com.warden.security.token.TokenSettings;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the security core from {@link WardenProperties}.
 *
 * <p>The Redis client is lazy: it is only created when the session or rate-limit backend is
 * {@code redis}.
 */
@Configuration
public class SecurityCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityCoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecurityMetrics securityMetrics(MeterRegistry registry, WardenProperties properties) {
        return new SecurityMetrics(registry, properties.serviceName());
    }

    @Bean
    public SecurityEventSink securityEventSink(SecurityMetrics metrics) {
        return new LoggingSecurityEventSink(new SensitiveDataRedactor(), metrics);
    }

    @Bean
    public RbacEngine rbacEngine(WardenProperties properties, SecurityEventSink events, SecurityMetrics metrics,
                                 ResourceLoader resourceLoader) {
        RbacEngine engine = new RbacEngine(RbacEngine.DEFAULT_CACHE_SIZE, events, metrics);
        String seed = properties.roleSeed();
        if (seed != null && !seed.isBlank()) {
            Resource resource = resourceLoader.getResource(seed);
            try (InputStream in = resource.getInputStream()) {
                engine.importRoles(RoleConfigCodec.read(in));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read role seed " + seed, e);
            }
            log.info("Seeded roles from {}", seed);
        }
        return engine;
    }

    @Bean
    public JwtCodec jwtCodec(WardenProperties properties, Clock clock) {
        WardenProperties.Tokens tokens = properties.tokens();
        TokenSettings settings = new TokenSettings(tokens.issuer(), tokens.audience(), tokens.accessTokenTtl(),
                tokens.refreshTokenTtl(), tokens.serviceTokenTtl(), tokens.clockSkew());
        return new JwtCodec(StaticSigningKeyProvider.fromSecrets(tokens.signingSecrets(), tokens.currentKeyId()),
                settings, clock);
    }

    @Bean
    public TokenService tokenService(JwtCodec codec) {
        return new TokenService(codec);
    }

    @Bean
    public ServiceTokenService serviceTokenService(JwtCodec codec, WardenProperties properties) {
        ServiceTokenService services = new ServiceTokenService(codec);
        for (WardenProperties.ServiceRegistration registration : properties.services()) {
            services.registerService(registration.name(), registration.targets(), registration.operations());
        }
        return services;
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public JedisKeyValueClient keyValueClient(WardenProperties properties) {
        WardenProperties.Redis redis = properties.redis();
        log.info("Connecting to {}", redis);
        return new JedisKeyValueClient(new KeyValueSettings(redis.host(), redis.port(), redis.password(),
                redis.database(), redis.ssl(), redis.connectTimeout(), redis.socketTimeout()));
    }

    @Bean
    public SessionStore sessionStore(WardenProperties properties, ObjectProvider<KeyValueClient> keyValueClient,
                                     Clock clock) {
        if (properties.sessions().backend() == Backend.REDIS) {
            return new KeyValueSessionStore(keyValueClient.getObject(), properties.redis().keyPrefix(), clock);
        }
        return new InMemorySessionStore();
    }

    @Bean
    public SessionManager sessionManager(SessionStore store, WardenProperties properties, Clock clock,
                                         SecurityEventSink events) {
        WardenProperties.Sessions sessions = properties.sessions();
        return new SessionManager(store, new SessionSettings(sessions.ttl(), sessions.slidingExpiration(),
                sessions.maxPerUser(), sessions.suspiciousActivityThreshold()), clock, events);
    }

    @Bean
    public RateLimitCounter rateLimitCounter(WardenProperties properties,
                                             ObjectProvider<KeyValueClient> keyValueClient) {
        if (properties.apiKeys().rateLimitBackend() == Backend.REDIS) {
            return new KeyValueRateLimitCounter(keyValueClient.getObject(), properties.redis().keyPrefix());
        }
        return new InMemoryRateLimitCounter();
    }

    @Bean
    public ApiKeyStore apiKeyStore() {
        return new InMemoryApiKeyStore();
    }

    @Bean
    public ApiKeyEngine apiKeyEngine(ApiKeyStore store, RateLimitCounter counter, RbacEngine rbac,
                                     WardenProperties properties, Clock clock, SecurityEventSink events) {
        WardenProperties.ApiKeys apiKeys = properties.apiKeys();
        ApiKeySettings settings = new ApiKeySettings(apiKeys.keyPrefix(), 32, apiKeys.defaultExpiry(),
                apiKeys.maxPerUser(), true, apiKeys.defaultRateLimit(), apiKeys.defaultWindow(),
                apiKeys.requireHttps());
        return new ApiKeyEngine(store, counter, rbac, settings, clock, events);
    }

    @Bean
    public MfaProvider mfaProvider(WardenProperties properties) {
        if (properties.mfa().protectedScopes().isEmpty()) {
            return new NoOpMfaProvider();
        }
        return new ScopeBasedMfaPolicy(properties.mfa().protectedScopes(), new NoOpMfaProvider());
    }

    @Bean
    public EdgeSettings edgeSettings(WardenProperties properties) {
        WardenProperties.Edge edge = properties.edge();
        return new EdgeSettings(properties.serviceName(), edge.accessTokenCookie(), edge.tokenHeader(),
                edge.serviceTokenHeader(), edge.apiKeyHeader(), edge.tenantHeader(), edge.mfaMaxAge());
    }

    @Bean
    public EdgeAuthority edgeAuthority(WardenProperties properties, TokenService tokens,
                                       ServiceTokenService serviceTokens, ApiKeyEngine apiKeys, RbacEngine rbac,
                                       EdgeSettings settings, MfaProvider mfa, Clock clock,
                                       SecurityEventSink events, SecurityMetrics metrics) {
        SensitivityRouter router = new SensitivityRouter(properties.edge().routes().stream()
                .map(WardenProperties.Route::toRule)
                .toList());
        log.info("Edge routing table has {} rules", router.rules().size());
        return EdgeAuthority.builder()
                .tokens(tokens)
                .serviceTokens(serviceTokens)
                .apiKeys(apiKeys)
                .rbac(rbac)
                .router(router)
                .settings(settings)
                .mfa(mfa)
                .clock(clock)
                .events(events)
                .metrics(metrics)
                .build();
    }
}
