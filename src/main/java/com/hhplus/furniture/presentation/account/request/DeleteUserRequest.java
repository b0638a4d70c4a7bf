package com.hhplus.furniture.presentation.account.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteUserRequest {

    @JsonProperty("email_to_delete")
    private String emailToDelete;
}
