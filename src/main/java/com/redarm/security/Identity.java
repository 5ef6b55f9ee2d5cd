package com.redarm.security;

import com.redarm.util.Emails;

import java.util.Objects;

/**
 * Authenticated caller: canonical email plus role.
 */
public final class Identity {

    private final String email;
    private final String role;

    public Identity(String email, String role) {
        this.email = Emails.normalize(email);
        this.role = role == null || role.isBlank() ? "user" : role;
    }

    public String getEmail() {
        return email;
    }

    public String getRole() {
        return role;
    }

    /**
     * True if the given owner email matches this identity, ignoring case and surrounding whitespace.
     */
    public boolean owns(String ownerEmail) {
        return Emails.sameOwner(email, ownerEmail);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identity)) {
            return false;
        }
        Identity other = (Identity) o;
        return email.equals(other.email) && role.equals(other.role);
    }

    @Override
    public int hashCode() {
        return Objects.hash(email, role);
    }

    @Override
    public String toString() {
        return "Identity{email=" + email + ", role=" + role + "}";
    }
}
