package com.hhplus.furniture.application.user.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@Builder
@AllArgsConstructor
public class RegisterUserCommand {

    private final String name;
    private final String email;
    private final String password;
    private final String address;
    private final BigDecimal credit;
}
