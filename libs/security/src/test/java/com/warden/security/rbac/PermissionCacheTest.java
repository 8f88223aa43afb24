package com.warden.security.rbac;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionCache")
class PermissionCacheTest {

    private static PermissionCache.Key key(String user, String action) {
        return new PermissionCache.Key(user, action, "doc");
    }

    @Test
    @DisplayName("evicts in insertion order when full, even for recently read entries")
    void fifoEviction() {
        PermissionCache cache = new PermissionCache(2);
        cache.put(key("u1", "read"), true);
        cache.put(key("u1", "write"), false);
        cache.get(key("u1", "read"));

        cache.put(key("u2", "read"), true);

        assertThat(cache.get(key("u1", "read"))).isEmpty();
        assertThat(cache.get(key("u1", "write"))).contains(false);
        assertThat(cache.get(key("u2", "read"))).contains(true);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("overwriting an existing key does not evict")
    void overwriteDoesNotEvict() {
        PermissionCache cache = new PermissionCache(2);
        cache.put(key("u1", "read"), true);
        cache.put(key("u1", "write"), true);

        cache.put(key("u1", "read"), false);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(key("u1", "read"))).contains(false);
    }

    @Test
    @DisplayName("invalidates only the given user's entries")
    void perUserInvalidation() {
        PermissionCache cache = new PermissionCache(10);
        cache.put(key("u1", "read"), true);
        cache.put(key("u1", "write"), true);
        cache.put(key("u2", "read"), true);

        cache.invalidateUser("u1");

        assertThat(cache.get(key("u1", "read"))).isEmpty();
        assertThat(cache.get(key("u1", "write"))).isEmpty();
        assertThat(cache.get(key("u2", "read"))).contains(true);
    }

    @Test
    @DisplayName("clear empties everything")
    void clear() {
        PermissionCache cache = new PermissionCache(10);
        cache.put(key("u1", "read"), true);

        cache.clear();

        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("rejects non-positive size")
    void rejectsBadSize() {
        assertThatThrownBy(() -> new PermissionCache(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
