package com.hhplus.furniture.domain.user;

/**
 * 사용자/매니저 공통 계정 정보
 */
public interface Account {

    Long getAccountId();

    String getEmail();

    String getName();

    String getPasswordHash();

    Role getRole();
}
