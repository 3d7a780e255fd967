package com.demoBank.bankAssistant.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionCreatedResponse {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("message")
    private String message;

    /**
     * The assistant greeting the session starts with.
     */
    @JsonProperty("initial_message")
    private String initialMessage;
}
