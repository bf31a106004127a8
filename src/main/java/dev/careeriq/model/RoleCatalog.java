package dev.careeriq.model;

import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Immutable list of known target roles, in detection order.
 */
@Getter
public final class RoleCatalog {

    private final String defaultRole;
    private final List<RoleProfile> roles;

    public RoleCatalog(String defaultRole, List<RoleProfile> roles) {
        this.roles = List.copyOf(roles);
        this.defaultRole = defaultRole;
        if (find(defaultRole).isEmpty()) {
            throw new IllegalArgumentException("Default role is not in the catalog: " + defaultRole);
        }
    }

    /**
     * Case-insensitive lookup by role name.
     */
    public Optional<RoleProfile> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return roles.stream()
                .filter(role -> role.name().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    public RoleProfile defaultProfile() {
        return find(defaultRole).orElseThrow();
    }

    /**
     * Profile for a role name, or the default profile when the name is unknown.
     */
    public RoleProfile profileOrDefault(String name) {
        return find(name).orElseGet(this::defaultProfile);
    }
}
