package com.demoBank.bankAssistant.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for chat messages.
 * A blank message is accepted here and answered by the orchestrator with an error reply.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotNull(message = "message is required")
    @JsonProperty("message")
    private String message;

    /**
     * Existing session to continue. When absent a new session is started.
     */
    @JsonProperty("session_id")
    private String sessionId;
}
