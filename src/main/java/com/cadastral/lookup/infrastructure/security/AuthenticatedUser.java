package com.cadastral.lookup.infrastructure.security;

import com.cadastral.lookup.domain.model.User;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Identity of the caller, resolved from the bearer token and exposed to controllers
 * as a request attribute.
 */
@Getter
@EqualsAndHashCode
@ToString
public class AuthenticatedUser {

    public static final String REQUEST_ATTRIBUTE = "authenticatedUser";

    private final Long id;
    private final String email;
    private final boolean superuser;

    public AuthenticatedUser(Long id, String email, boolean superuser) {
        this.id = id;
        this.email = email;
        this.superuser = superuser;
    }

    public static AuthenticatedUser of(User user) {
        return new AuthenticatedUser(user.getId(), user.getEmail(), user.isSuperuser());
    }
}
