package com.warden.security.store;

import com.warden.security.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link KeyValueClient} backed by Redis through a pooled Jedis connection.
 * <p>
 * Connect and socket timeouts bound every call; any Jedis failure becomes a
 * {@link BackendUnavailableException}.
 */
public final class JedisKeyValueClient implements KeyValueClient, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JedisKeyValueClient.class);

    static final String BACKEND = "redis";

    /**
     * KEYS[1] = counter key, ARGV[1] = limit, ARGV[2] = ttl in milliseconds.
     * Returns {count, accepted}.
     */
    private static final String INCREMENT_WITHIN_LIMIT_SCRIPT = """
        local current = tonumber(redis.call("get", KEYS[1]) or "0")
        if current >= tonumber(ARGV[1]) then
            return {current, 0}
        end
        current = redis.call("incr", KEYS[1])
        if current == 1 then
            redis.call("pexpire", KEYS[1], ARGV[2])
        end
        return {current, 1}
        """;

    private final JedisPooled jedis;

    public JedisKeyValueClient(KeyValueSettings settings) {
        this(new JedisPooled(new HostAndPort(settings.host(), settings.port()),
                DefaultJedisClientConfig.builder()
                        .connectionTimeoutMillis((int) settings.connectTimeout().toMillis())
                        .socketTimeoutMillis((int) settings.socketTimeout().toMillis())
                        .password(settings.password())
                        .database(settings.database())
                        .ssl(settings.ssl())
                        .build()));
        log.info("Key-value client configured for {}", settings);
    }

    JedisKeyValueClient(JedisPooled jedis) {
        this.jedis = jedis;
    }

    @Override
    public Optional<String> get(String key) {
        return call(() -> Optional.ofNullable(jedis.get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call(() -> jedis.set(key, value, SetParams.setParams().px(ttlMillis(ttl))));
    }

    @Override
    public boolean delete(String key) {
        return call(() -> jedis.del(key) > 0);
    }

    @Override
    public boolean exists(String key) {
        return call(() -> jedis.exists(key));
    }

    @Override
    public void addToSet(String key, String member, Duration ttl) {
        call(() -> {
            jedis.sadd(key, member);
            return jedis.pexpire(key, ttlMillis(ttl));
        });
    }

    @Override
    public void removeFromSet(String key, String member) {
        call(() -> jedis.srem(key, member));
    }

    @Override
    public Set<String> members(String key) {
        return call(() -> jedis.smembers(key));
    }

    @Override
    public BoundedIncrement incrementWithinLimit(String key, long limit, Duration ttl) {
        Object result = call(() -> jedis.eval(INCREMENT_WITHIN_LIMIT_SCRIPT,
                List.of(key), List.of(Long.toString(limit), Long.toString(ttlMillis(ttl)))));
        List<?> values = (List<?>) result;
        long count = ((Number) values.get(0)).longValue();
        boolean accepted = ((Number) values.get(1)).longValue() == 1L;
        return new BoundedIncrement(count, accepted);
    }

    @Override
    public void close() {
        jedis.close();
    }

    private static long ttlMillis(Duration ttl) {
        return Math.max(1L, ttl.toMillis());
    }

    private static <T> T call(Supplier<T> command) {
        try {
            return command.get();
        } catch (JedisException e) {
            log.warn("Key-value backend call failed: {}", e.getMessage());
            throw new BackendUnavailableException(BACKEND, e);
        }
    }
}
