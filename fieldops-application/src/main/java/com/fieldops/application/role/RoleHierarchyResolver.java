package com.fieldops.application.role;

import com.fieldops.application.ports.RoleSource;
import com.fieldops.domain.metadata.CrudAccess;
import com.fieldops.domain.role.RoleHierarchy;
import com.fieldops.domain.role.RoleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link RoleHierarchy} and answers rank questions against it.
 *
 * <p>The hierarchy is loaded once from the {@link RoleSource} and replaced only by {@link #reload()}. A reload swaps
 * the whole snapshot, so a caller that already read the old one finishes with it. Listeners registered through
 * {@link #addReloadListener(Runnable)} run after each swap (caches keyed by role clear themselves there).
 *
 * <p>Role input may be a name or a legacy numeric priority. Anything that does not resolve falls back to the
 * lowest role, never to a privileged one.
 */
public class RoleHierarchyResolver {

    private static final Logger log = LoggerFactory.getLogger(RoleHierarchyResolver.class);

    private final RoleSource source;
    private final AtomicReference<RoleHierarchy> current = new AtomicReference<>();
    private final List<Runnable> reloadListeners = new CopyOnWriteArrayList<>();

    public RoleHierarchyResolver(RoleSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /** Loads on first call; later calls return the cached snapshot. */
    public RoleHierarchy hierarchy() {
        RoleHierarchy h = current.get();
        if (h != null) return h;
        synchronized (this) {
            h = current.get();
            if (h == null) {
                h = fetch();
                current.set(h);
                log.info("[ROLES] loaded count={} order={}", h.size(), h.names());
            }
            return h;
        }
    }

    /**
     * Re-reads the source and atomically replaces the snapshot.
     * On failure the previous hierarchy stays in place and the error propagates.
     */
    public RoleHierarchy reload() {
        RoleHierarchy next = fetch();
        RoleHierarchy prev = current.getAndSet(next);
        log.info("[ROLES] reloaded count={} order={} previous={}",
                next.size(), next.names(), prev == null ? "[]" : prev.names());
        for (Runnable l : reloadListeners) {
            l.run();
        }
        return next;
    }

    public void addReloadListener(Runnable listener) {
        reloadListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Index of the role, or {@link RoleHierarchy#UNKNOWN}. */
    public int rank(String roleName) {
        return hierarchy().rank(roleName);
    }

    /**
     * Resolves a role name or numeric priority to a known role name.
     * Unresolvable input (null, unknown name, unknown priority) yields the lowest role.
     */
    public String normalizeRoleName(Object roleOrPriority) {
        RoleHierarchy h = hierarchy();
        String fallback = h.lowest().name();
        if (roleOrPriority == null) return fallback;

        if (roleOrPriority instanceof Number n) {
            Integer priority = exactPriority(n);
            if (priority == null) {
                log.debug("[ROLES] priority not a whole int value={} fallback={}", n, fallback);
                return fallback;
            }
            return byPriority(h, priority, fallback);
        }

        String s = roleOrPriority.toString().trim().toLowerCase(Locale.ROOT);
        if (h.contains(s)) return s;
        if (!s.isEmpty() && s.chars().allMatch(Character::isDigit)) {
            try {
                return byPriority(h, Integer.parseInt(s), fallback);
            } catch (NumberFormatException e) {
                log.debug("[ROLES] priority out of int range value={}", s);
                return fallback;
            }
        }
        log.debug("[ROLES] unknown role value={} fallback={}", s, fallback);
        return fallback;
    }

    /**
     * True iff the user's (normalized) role ranks at or above the requirement.
     * Always false for {@code none} and for requirements naming an unknown role.
     */
    public boolean hasPermission(Object userRole, String requiredRole) {
        if (CrudAccess.isNone(requiredRole)) return false;
        RoleHierarchy h = hierarchy();
        int required = h.rank(requiredRole);
        if (required == RoleHierarchy.UNKNOWN) return false;
        return h.rank(normalizeRoleName(userRole)) >= required;
    }

    public List<RoleRecord> roles() {
        return hierarchy().roles();
    }

    private RoleHierarchy fetch() {
        return RoleHierarchy.of(source.loadRoles());
    }

    // whole numbers that fit an int exactly, anything else is unresolvable
    private static Integer exactPriority(Number n) {
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) return n.intValue();
        if (n instanceof Long l) {
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? (int) l.longValue() : null;
        }
        try {
            return new BigDecimal(n.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            return null;
        }
    }

    private static String byPriority(RoleHierarchy h, int priority, String fallback) {
        String name = h.nameForPriority(priority);
        return name == null ? fallback : name;
    }
}
