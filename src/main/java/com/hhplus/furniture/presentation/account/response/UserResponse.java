package com.hhplus.furniture.presentation.account.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.user.dto.UserInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("email")
    private String email;

    @JsonProperty("address")
    private String address;

    @JsonProperty("credit")
    private BigDecimal credit;

    @JsonProperty("role")
    private String role;

    public static UserResponse from(UserInfo info) {
        return UserResponse.builder()
                .userId(info.getUserId())
                .name(info.getName())
                .email(info.getEmail())
                .address(info.getAddress())
                .credit(info.getCredit())
                .role("USER")
                .build();
    }
}
