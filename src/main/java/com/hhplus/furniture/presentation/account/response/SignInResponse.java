package com.hhplus.furniture.presentation.account.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.session.SessionToken;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SignInResponse {

    @JsonProperty("message")
    private String message;

    @JsonProperty("token")
    private String token;

    @JsonProperty("email")
    private String email;

    @JsonProperty("role")
    private String role;

    @JsonProperty("expires_in")
    private long expiresIn;

    public static SignInResponse from(SessionToken token) {
        return new SignInResponse("Signed in successfully", token.getToken(), token.getEmail(),
                token.getRole().name(), token.getExpiresInSeconds());
    }
}
