package com.hhplus.furniture.application.user.dto;

import com.hhplus.furniture.domain.user.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@Builder
@AllArgsConstructor
public class UserInfo {

    private final Long userId;
    private final String name;
    private final String email;
    private final String address;
    private final BigDecimal credit;

    public static UserInfo from(User user) {
        return UserInfo.builder()
                .userId(user.getUserId())
                .name(user.getName())
                .email(user.getEmail())
                .address(user.getAddress())
                .credit(user.getCredit())
                .build();
    }
}
