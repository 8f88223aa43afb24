package com.warden.security.store;

import com.warden.security.AuthErrorKind;
import com.warden.security.BackendUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JedisKeyValueClient")
class JedisKeyValueClientTest {

    @Mock
    private JedisPooled jedis;

    private JedisKeyValueClient client;

    @BeforeEach
    void setUp() {
        client = new JedisKeyValueClient(jedis);
    }

    @Test
    @DisplayName("reads values and maps nulls to empty")
    void get() {
        when(jedis.get("k1")).thenReturn("v1");
        when(jedis.get("missing")).thenReturn(null);

        assertThat(client.get("k1")).contains("v1");
        assertThat(client.get("missing")).isEmpty();
    }

    @Test
    @DisplayName("sets values with a millisecond expiry")
    void setWithTtl() {
        client.set("k1", "v1", Duration.ofSeconds(5));

        verify(jedis).set(eq("k1"), eq("v1"), any(SetParams.class));
    }

    @Test
    @DisplayName("parses the bounded increment script reply")
    void boundedIncrement() {
        when(jedis.eval(anyString(), eq(List.of("rl")), eq(List.of("3", "60000")))).thenReturn(List.of(2L, 1L));

        BoundedIncrement result = client.incrementWithinLimit("rl", 3, Duration.ofMinutes(1));

        assertThat(result).isEqualTo(new BoundedIncrement(2, true));
    }

    @Test
    @DisplayName("reports a refused increment")
    void refusedIncrement() {
        when(jedis.eval(anyString(), anyList(), anyList())).thenReturn(List.of(3L, 0L));

        assertThat(client.incrementWithinLimit("rl", 3, Duration.ofMinutes(1)).accepted()).isFalse();
    }

    @Test
    @DisplayName("connection failures become BackendUnavailableException")
    void connectionFailure() {
        when(jedis.get("k1")).thenThrow(new JedisConnectionException("Read timed out"));

        assertThatThrownBy(() -> client.get("k1"))
                .isInstanceOf(BackendUnavailableException.class)
                .satisfies(e -> {
                    BackendUnavailableException unavailable = (BackendUnavailableException) e;
                    assertThat(unavailable.kind()).isEqualTo(AuthErrorKind.BACKEND_UNAVAILABLE);
                    assertThat(unavailable.backend()).isEqualTo("redis");
                    assertThat(unavailable.retryable()).isTrue();
                });
    }
}
