package com.hhplus.furniture.domain.user;

public enum Role {
    USER,
    MANAGER
}
