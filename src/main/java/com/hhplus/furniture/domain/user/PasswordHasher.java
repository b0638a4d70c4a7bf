package com.hhplus.furniture.domain.user;

/**
 * 비밀번호 해시 포트
 */
public interface PasswordHasher {

    String hash(String rawPassword);

    boolean matches(String rawPassword, String passwordHash);
}
