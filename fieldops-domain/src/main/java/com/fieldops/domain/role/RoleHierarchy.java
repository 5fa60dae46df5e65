package com.fieldops.domain.role;

import com.fieldops.domain.error.ConfigurationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the role list, lowest privilege first.
 *
 * Priorities are strictly increasing with list order and names are unique; construction fails otherwise.
 */
public final class RoleHierarchy {

    public static final int UNKNOWN = -1;

    private final List<RoleRecord> roles;
    private final Map<String, Integer> rankByName;
    private final Map<Integer, String> nameByPriority;

    private RoleHierarchy(List<RoleRecord> roles) {
        this.roles = List.copyOf(roles);
        Map<String, Integer> ranks = new HashMap<>();
        Map<Integer, String> byPriority = new HashMap<>();
        for (int i = 0; i < this.roles.size(); i++) {
            RoleRecord r = this.roles.get(i);
            ranks.put(r.name(), i);
            byPriority.put(r.priority(), r.name());
        }
        this.rankByName = Map.copyOf(ranks);
        this.nameByPriority = Map.copyOf(byPriority);
    }

    /**
     * @throws ConfigurationException when the list is empty, names repeat or priorities are not strictly increasing
     */
    public static RoleHierarchy of(List<RoleRecord> roles) {
        if (roles == null || roles.isEmpty()) {
            throw new ConfigurationException("Role hierarchy is empty");
        }
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Integer previous = null;
        for (RoleRecord r : roles) {
            if (!seen.add(r.name())) {
                problems.add("duplicate role name: " + r.name());
            }
            if (previous != null && r.priority() <= previous) {
                problems.add("priority of '" + r.name() + "' (" + r.priority() + ") is not greater than " + previous);
            }
            previous = r.priority();
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid role hierarchy", problems);
        }
        return new RoleHierarchy(roles);
    }

    public List<RoleRecord> roles() {
        return roles;
    }

    public int size() {
        return roles.size();
    }

    /** Index in the hierarchy, or {@link #UNKNOWN}. */
    public int rank(String roleName) {
        if (roleName == null) return UNKNOWN;
        Integer r = rankByName.get(roleName.trim().toLowerCase(Locale.ROOT));
        return r == null ? UNKNOWN : r;
    }

    public boolean contains(String roleName) {
        return rank(roleName) != UNKNOWN;
    }

    /** Role name with this exact priority, or null. */
    public String nameForPriority(int priority) {
        return nameByPriority.get(priority);
    }

    public RoleRecord lowest() {
        return roles.get(0);
    }

    public RoleRecord highest() {
        return roles.get(roles.size() - 1);
    }

    public List<String> names() {
        return roles.stream().map(RoleRecord::name).toList();
    }

    @Override
    public String toString() {
        return "RoleHierarchy" + names();
    }
}
