package com.hhplus.furniture.presentation.account.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 프로필 변경 요청 DTO. 비어 있는 필드는 변경하지 않는다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditUserRequest {

    @JsonProperty("new_name")
    private String newName;

    @JsonProperty("new_address")
    private String newAddress;
}
