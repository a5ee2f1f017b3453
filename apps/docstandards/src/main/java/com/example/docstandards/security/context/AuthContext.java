package com.example.docstandards.security.context;

import java.util.Collection;
import java.util.Set;

public record AuthContext(
        String subject,
        Set<Role> roles
) {
    public boolean hasAnyRole(Collection<Role> required) {
        return required.stream().anyMatch(roles::contains);
    }

    public static AuthContext of(String subject, Set<Role> roles) {
        return new AuthContext(subject, Set.copyOf(roles));
    }
}
