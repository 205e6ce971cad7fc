package com.dockerlab.model;

import java.util.Optional;

/**
 * Partial update of a user. An empty field is left untouched by the store.
 */
public record UserPatch(Optional<String> name, Optional<String> email) {

    public UserPatch {
        name = name == null ? Optional.empty() : name;
        email = email == null ? Optional.empty() : email;
    }

    public static UserPatch of(String name, String email) {
        return new UserPatch(Optional.ofNullable(name), Optional.ofNullable(email));
    }

    public boolean isEmpty() {
        return name.isEmpty() && email.isEmpty();
    }
}
