package com.hhplus.furniture.presentation.account.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.domain.user.Manager;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ManagerResponse {

    @JsonProperty("manager_id")
    private Long managerId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("email")
    private String email;

    @JsonProperty("role")
    private String role;

    public static ManagerResponse from(Manager manager) {
        return new ManagerResponse(manager.getManagerId(), manager.getName(), manager.getEmail(),
                manager.getRole().name());
    }
}
