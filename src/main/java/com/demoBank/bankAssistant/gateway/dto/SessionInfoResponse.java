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
public class SessionInfoResponse {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("message_count")
    private int messageCount;

    /**
     * Locked category, null until the first successful categorization.
     */
    @JsonProperty("category")
    private String category;
}
