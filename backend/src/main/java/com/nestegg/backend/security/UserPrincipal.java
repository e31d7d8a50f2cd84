package com.nestegg.backend.security;

import lombok.Value;

/**
 * Authenticated caller, as asserted by the bearer token.
 */
@Value
public class UserPrincipal {
    Long userId;
    String username;
}
