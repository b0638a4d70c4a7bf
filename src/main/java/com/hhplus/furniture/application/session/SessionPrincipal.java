package com.hhplus.furniture.application.session;

import com.hhplus.furniture.domain.user.Account;
import com.hhplus.furniture.domain.user.Role;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 세션에 저장되는 로그인 주체
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class SessionPrincipal {

    private final Long accountId;
    private final String email;
    private final Role role;

    public static SessionPrincipal of(Account account) {
        return new SessionPrincipal(account.getAccountId(), account.getEmail(), account.getRole());
    }

    public boolean isManager() {
        return role == Role.MANAGER;
    }
}
