package com.warden.security.rbac;

import com.warden.observability.SecurityEvent;
import com.warden.observability.SecurityEventSink;
import com.warden.observability.SecurityEventType;
import com.warden.observability.SecurityMetrics;
import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Role registry, user-role assignments and cached permission decisions for one process.
 * <p>
 * Construct one instance at startup and inject it wherever decisions are made. The four
 * {@link SystemRoles} are seeded by the constructor and cannot be modified.
 * <p>
 * Concurrency: decisions run under the read side of a {@link ReentrantReadWriteLock} (including
 * the cache fill), every mutation under the write side. Mutations invalidate affected cache
 * entries before releasing the write lock, so no reader can observe a decision computed from the
 * previous definitions.
 */
public final class RbacEngine {

    private static final Logger log = LoggerFactory.getLogger(RbacEngine.class);

    public static final int DEFAULT_CACHE_SIZE = 10_000;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Role> roles = new HashMap<>();
    private final Map<String, Set<String>> assignments = new HashMap<>();
    private final PermissionCache cache;
    private final SecurityEventSink events;
    private final SecurityMetrics metrics;

    public RbacEngine() {
        this(DEFAULT_CACHE_SIZE, SecurityEventSink.NOOP, null);
    }

    /**
     * @param cacheSize maximum number of cached decisions (FIFO eviction)
     * @param events    sink for role-change events
     * @param metrics   cache hit/miss metrics, nullable
     */
    public RbacEngine(int cacheSize, SecurityEventSink events, SecurityMetrics metrics) {
        this.cache = new PermissionCache(cacheSize);
        this.events = events == null ? SecurityEventSink.NOOP : events;
        this.metrics = metrics;
        for (Role role : SystemRoles.definitions()) {
            roles.put(role.name(), role);
        }
    }

    // ---- role definitions ------------------------------------------------------------------

    /**
     * Registers a new role.
     *
     * @throws AuthException           CONFIGURATION_ERROR if the name is taken or reserved
     * @throws RoleNotFoundException   if a parent role does not exist
     * @throws CycleDetectedException  if the parents would make the hierarchy cyclic
     */
    public void addRole(Role role) {
        requireCallerRole(role);
        lock.writeLock().lock();
        try {
            if (roles.containsKey(role.name())) {
                throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR,
                        "Role '%s' already exists".formatted(role.name()));
            }
            validateParents(role);
            cache.clear();
            roles.put(role.name(), role);
        } finally {
            lock.writeLock().unlock();
        }
        roleChanged("added", role.name());
    }

    /**
     * Replaces the definition of an existing non-system role.
     */
    public void updateRole(Role role) {
        requireCallerRole(role);
        lock.writeLock().lock();
        try {
            if (!roles.containsKey(role.name())) {
                throw new RoleNotFoundException(role.name());
            }
            validateParents(role);
            cache.clear();
            roles.put(role.name(), role);
        } finally {
            lock.writeLock().unlock();
        }
        roleChanged("updated", role.name());
    }

    /**
     * Deletes a non-system role, detaching it from every assignment and child role.
     */
    public void removeRole(String roleName) {
        String name = Role.normalize(roleName);
        lock.writeLock().lock();
        try {
            Role existing = roles.get(name);
            if (existing == null) {
                throw new RoleNotFoundException(name);
            }
            if (existing.system()) {
                throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR,
                        "System role '%s' cannot be removed".formatted(name));
            }
            cache.clear();
            roles.remove(name);
            for (Role other : List.copyOf(roles.values())) {
                if (other.parentRoles().contains(name)) {
                    roles.put(other.name(), other.withoutParent(name));
                }
            }
            assignments.values().forEach(assigned -> assigned.remove(name));
            assignments.values().removeIf(Set::isEmpty);
        } finally {
            lock.writeLock().unlock();
        }
        roleChanged("removed", name);
    }

    public Optional<Role> getRole(String roleName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(roles.get(Role.normalize(roleName)));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Role> listRoles() {
        lock.readLock().lock();
        try {
            return roles.values().stream()
                    .sorted(Comparator.comparing(Role::name))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---- assignments -----------------------------------------------------------------------

    public void assignUserRole(String userId, String roleName) {
        requireUser(userId);
        String name = Role.normalize(roleName);
        lock.writeLock().lock();
        try {
            if (!roles.containsKey(name)) {
                throw new RoleNotFoundException(name);
            }
            cache.invalidateUser(userId);
            assignments.computeIfAbsent(userId, u -> new LinkedHashSet<>()).add(name);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Assigned role '{}' to user '{}'", name, userId);
    }

    /**
     * @return true if the user held the role directly
     */
    public boolean removeUserRole(String userId, String roleName) {
        requireUser(userId);
        String name = Role.normalize(roleName);
        boolean removed;
        lock.writeLock().lock();
        try {
            if (!roles.containsKey(name)) {
                throw new RoleNotFoundException(name);
            }
            cache.invalidateUser(userId);
            Set<String> assigned = assignments.get(userId);
            removed = assigned != null && assigned.remove(name);
            if (assigned != null && assigned.isEmpty()) {
                assignments.remove(userId);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            log.info("Removed role '{}' from user '{}'", name, userId);
        }
        return removed;
    }

    /**
     * Returns the user's roles, optionally closed over the parent hierarchy.
     */
    public Set<String> getUserRoles(String userId, boolean includeInherited) {
        lock.readLock().lock();
        try {
            Set<String> direct = assignments.getOrDefault(userId, Set.of());
            return includeInherited ? expand(direct) : Set.copyOf(direct);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Transitive closure of the given role names over the parent hierarchy. Unknown names are
     * dropped.
     */
    public Set<String> expandRoles(Collection<String> roleNames) {
        lock.readLock().lock();
        try {
            return expand(roleNames);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---- decisions -------------------------------------------------------------------------

    public boolean checkPermission(String userId, String action, String resource) {
        return checkPermission(userId, action, resource, true);
    }

    /**
     * Decides whether the user may perform {@code action} on {@code resource} through any direct
     * or inherited role. Conditional grants never apply here; use
     * {@link #checkPermission(String, String, String, Map)} to supply request attributes.
     */
    public boolean checkPermission(String userId, String action, String resource, boolean useCache) {
        if (userId == null || isBlank(action) || isBlank(resource)) {
            return false;
        }
        MatchTerm requestedAction = MatchTerm.of(action);
        MatchTerm requestedResource = MatchTerm.of(resource);
        PermissionCache.Key key = new PermissionCache.Key(
                userId, requestedAction.value(), requestedResource.value());

        lock.readLock().lock();
        try {
            if (useCache) {
                Optional<Boolean> cached = cache.get(key);
                recordCacheLookup(cached.isPresent());
                if (cached.isPresent()) {
                    return cached.get();
                }
            }
            Set<String> effective = expand(assignments.getOrDefault(userId, Set.of()));
            boolean allowed = evaluate(effective, requestedAction, requestedResource, null);
            if (useCache) {
                cache.put(key, allowed);
            }
            return allowed;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Uncached decision that also applies conditional grants against the given attributes.
     */
    public boolean checkPermission(String userId, String action, String resource,
                                   Map<String, ?> attributes) {
        if (userId == null || isBlank(action) || isBlank(resource)) {
            return false;
        }
        lock.readLock().lock();
        try {
            Set<String> effective = expand(assignments.getOrDefault(userId, Set.of()));
            return evaluate(effective, MatchTerm.of(action), MatchTerm.of(resource),
                    attributes == null ? Map.of() : attributes);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Decision for a role set taken from verified token claims rather than engine assignments.
     */
    public boolean hasPermission(Collection<String> roleNames, String action, String resource) {
        if (roleNames == null || roleNames.isEmpty() || isBlank(action) || isBlank(resource)) {
            return false;
        }
        lock.readLock().lock();
        try {
            return evaluate(expand(roleNames), MatchTerm.of(action), MatchTerm.of(resource), null);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Union of every grant the user holds directly or through inheritance.
     */
    public Set<Permission> getEffectivePermissions(String userId) {
        lock.readLock().lock();
        try {
            Set<Permission> result = new LinkedHashSet<>();
            for (String name : expand(assignments.getOrDefault(userId, Set.of()))) {
                result.addAll(roles.get(name).permissions());
            }
            return Set.copyOf(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    int cacheSize() {
        return cache.size();
    }

    // ---- export / import -------------------------------------------------------------------

    public RoleConfig exportRoles() {
        lock.readLock().lock();
        try {
            List<RoleConfig.RoleDefinition> definitions = roles.values().stream()
                    .sorted(Comparator.comparing(Role::name))
                    .map(RbacEngine::toDefinition)
                    .toList();
            Map<String, List<String>> exportedAssignments = new HashMap<>();
            assignments.forEach((user, names) -> exportedAssignments.put(user, names.stream().sorted().toList()));
            return new RoleConfig(definitions, exportedAssignments);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces every non-system role and every assignment with the given configuration. System
     * role definitions in the input are ignored. On any error the previous state is restored.
     */
    public void importRoles(RoleConfig config) {
        if (config == null) {
            throw AuthException.invalidRequest("config must not be null");
        }
        List<Role> incoming = new ArrayList<>();
        for (RoleConfig.RoleDefinition definition : config.roles()) {
            if (!definition.system() && !SystemRoles.isSystemRole(definition.name())) {
                incoming.add(fromDefinition(definition));
            }
        }

        Map<String, Role> savedRoles = new HashMap<>();
        Map<String, Set<String>> savedAssignments = new HashMap<>();
        lock.writeLock().lock();
        try {
            savedRoles.putAll(roles);
            assignments.forEach((user, names) -> savedAssignments.put(user, new LinkedHashSet<>(names)));
            cache.clear();
            roles.values().removeIf(role -> !role.system());
            assignments.clear();
            for (Role role : dependencyOrder(incoming)) {
                if (roles.containsKey(role.name())) {
                    throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR,
                            "Duplicate role '%s' in config".formatted(role.name()));
                }
                validateParents(role);
                roles.put(role.name(), role);
            }
            for (Map.Entry<String, List<String>> entry : config.assignments().entrySet()) {
                for (String roleName : entry.getValue()) {
                    String name = Role.normalize(roleName);
                    if (!roles.containsKey(name)) {
                        throw new RoleNotFoundException(name);
                    }
                    assignments.computeIfAbsent(entry.getKey(), u -> new LinkedHashSet<>()).add(name);
                }
            }
        } catch (RuntimeException e) {
            roles.clear();
            roles.putAll(savedRoles);
            assignments.clear();
            assignments.putAll(savedAssignments);
            cache.clear();
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Imported {} roles and {} user assignments", incoming.size(), config.assignments().size());
        roleChanged("imported", null);
    }

    // ---- internals -------------------------------------------------------------------------

    private static void requireCallerRole(Role role) {
        if (role == null) {
            throw AuthException.invalidRequest("role must not be null");
        }
        if (role.system() || SystemRoles.isSystemRole(role.name())) {
            throw new AuthException(AuthErrorKind.CONFIGURATION_ERROR,
                    "System role '%s' cannot be modified".formatted(role.name()));
        }
    }

    private static void requireUser(String userId) {
        if (isBlank(userId)) {
            throw AuthException.invalidRequest("userId must not be null or blank");
        }
    }

    /** Caller holds the write lock. */
    private void validateParents(Role role) {
        for (String parent : role.parentRoles()) {
            if (parent.equals(role.name())) {
                throw new CycleDetectedException(List.of(role.name(), role.name()));
            }
            if (!roles.containsKey(parent)) {
                throw new RoleNotFoundException(parent);
            }
            List<String> path = findPath(parent, role.name());
            if (!path.isEmpty()) {
                List<String> cycle = new ArrayList<>();
                cycle.add(role.name());
                cycle.addAll(path);
                throw new CycleDetectedException(cycle);
            }
        }
    }

    /**
     * Depth-first search along parent links from {@code from} to {@code target}; empty when
     * unreachable.
     */
    private List<String> findPath(String from, String target) {
        Deque<String> path = new ArrayDeque<>();
        return dfs(from, target, new HashSet<>(), path) ? new ArrayList<>(path) : List.of();
    }

    private boolean dfs(String current, String target, Set<String> visited, Deque<String> path) {
        path.addLast(current);
        if (current.equals(target)) {
            return true;
        }
        if (visited.add(current)) {
            Role role = roles.get(current);
            if (role != null) {
                for (String parent : role.parentRoles()) {
                    if (dfs(parent, target, visited, path)) {
                        return true;
                    }
                }
            }
        }
        path.removeLast();
        return false;
    }

    /** Caller holds a lock. */
    private Set<String> expand(Collection<String> roleNames) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        for (String name : roleNames) {
            pending.push(Role.normalize(name));
        }
        while (!pending.isEmpty()) {
            String name = pending.pop();
            Role role = roles.get(name);
            if (role == null || !visited.add(name)) {
                continue;
            }
            role.parentRoles().forEach(pending::push);
        }
        return Set.copyOf(visited);
    }

    private boolean evaluate(Set<String> roleNames, MatchTerm action, MatchTerm resource,
                             Map<String, ?> attributes) {
        for (String name : roleNames) {
            for (Permission permission : roles.get(name).permissions()) {
                if (!permission.matches(action, resource)) {
                    continue;
                }
                if (!permission.isConditional() || (attributes != null && permission.conditionsSatisfied(attributes))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Orders roles so every parent precedes its children. Parents must already be registered or
     * be part of the input.
     */
    private List<Role> dependencyOrder(List<Role> incoming) {
        Map<String, Role> remaining = new HashMap<>();
        for (Role role : incoming) {
            remaining.put(role.name(), role);
        }
        List<Role> ordered = new ArrayList<>();
        Set<String> placed = new HashSet<>(roles.keySet());
        while (!remaining.isEmpty()) {
            List<Role> ready = remaining.values().stream()
                    .filter(role -> placed.containsAll(role.parentRoles()))
                    .sorted(Comparator.comparing(Role::name))
                    .toList();
            if (ready.isEmpty()) {
                for (Role role : remaining.values()) {
                    for (String parent : role.parentRoles()) {
                        if (!placed.contains(parent) && !remaining.containsKey(parent)) {
                            throw new RoleNotFoundException(parent);
                        }
                    }
                }
                List<String> stuck = remaining.keySet().stream().sorted().toList();
                throw new CycleDetectedException(stuck);
            }
            for (Role role : ready) {
                ordered.add(role);
                placed.add(role.name());
                remaining.remove(role.name());
            }
        }
        return ordered;
    }

    private static RoleConfig.RoleDefinition toDefinition(Role role) {
        List<RoleConfig.PermissionDefinition> permissions = role.permissions().stream()
                .sorted(Comparator.comparing(Permission::toScope))
                .map(p -> new RoleConfig.PermissionDefinition(p.action(), p.resource(),
                        p.conditions().isEmpty() ? null : p.conditions()))
                .toList();
        return new RoleConfig.RoleDefinition(role.name(), permissions,
                role.parentRoles().stream().sorted().toList(), role.system(), role.tenantId());
    }

    private static Role fromDefinition(RoleConfig.RoleDefinition definition) {
        Set<Permission> permissions = new LinkedHashSet<>();
        for (RoleConfig.PermissionDefinition p : definition.permissions()) {
            permissions.add(Permission.of(p.action(), p.resource(), p.conditions()));
        }
        return new Role(definition.name(), permissions, new LinkedHashSet<>(definition.parentRoles()),
                false, definition.tenantId());
    }

    private void recordCacheLookup(boolean hit) {
        if (metrics != null) {
            metrics.recordCacheLookup(hit);
        }
    }

    private void roleChanged(String change, String roleName) {
        log.info("Role definitions changed: {} {}", change, roleName == null ? "" : roleName);
        events.publish(SecurityEvent.of(SecurityEventType.ROLE_CHANGED)
                .with("change", change)
                .with("role", roleName)
                .build());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
