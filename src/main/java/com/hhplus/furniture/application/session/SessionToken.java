package com.hhplus.furniture.application.session;

import com.hhplus.furniture.domain.user.Role;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SessionToken {

    private final String token;
    private final String email;
    private final Role role;
    private final long expiresInSeconds;
}
