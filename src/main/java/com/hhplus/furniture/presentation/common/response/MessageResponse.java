package com.hhplus.furniture.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 본문이 안내 메시지 하나뿐인 응답
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

    @JsonProperty("message")
    private String message;

    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
