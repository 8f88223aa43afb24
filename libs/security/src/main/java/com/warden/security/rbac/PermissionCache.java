package com.warden.security.rbac;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bounded permission-decision cache with FIFO eviction and per-user invalidation.
 * <p>
 * Entries are evicted in insertion order regardless of use. A per-user index keeps
 * {@link #invalidateUser(String)} proportional to that user's entries. All methods are
 * synchronized; the engine additionally serializes invalidation against reads with its
 * read-write lock.
 */
final class PermissionCache {

    record Key(String userId, String action, String resource) {
    }

    private final int maxSize;
    private final LinkedHashMap<Key, Boolean> entries = new LinkedHashMap<>();
    private final Map<String, Set<Key>> keysByUser = new HashMap<>();

    PermissionCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.maxSize = maxSize;
    }

    synchronized Optional<Boolean> get(Key key) {
        return Optional.ofNullable(entries.get(key));
    }

    synchronized void put(Key key, boolean allowed) {
        if (!entries.containsKey(key) && entries.size() >= maxSize) {
            evictOldest();
        }
        entries.put(key, allowed);
        keysByUser.computeIfAbsent(key.userId(), u -> new HashSet<>()).add(key);
    }

    synchronized void invalidateUser(String userId) {
        Set<Key> keys = keysByUser.remove(userId);
        if (keys != null) {
            keys.forEach(entries::remove);
        }
    }

    synchronized void clear() {
        entries.clear();
        keysByUser.clear();
    }

    synchronized int size() {
        return entries.size();
    }

    int maxSize() {
        return maxSize;
    }

    private void evictOldest() {
        Iterator<Key> it = entries.keySet().iterator();
        if (!it.hasNext()) {
            return;
        }
        Key eldest = it.next();
        it.remove();
        Set<Key> userKeys = keysByUser.get(eldest.userId());
        if (userKeys != null) {
            userKeys.remove(eldest);
            if (userKeys.isEmpty()) {
                keysByUser.remove(eldest.userId());
            }
        }
    }
}
