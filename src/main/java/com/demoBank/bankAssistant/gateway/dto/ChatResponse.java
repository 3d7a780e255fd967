package com.demoBank.bankAssistant.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for chat messages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatResponse {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("response")
    private String response;

    @JsonProperty("timestamp")
    private Instant timestamp;

    /**
     * What each stage produced on this turn ("How I got this"). Null fields mean the stage was
     * cached from an earlier turn or not reached.
     */
    @JsonProperty("intermediate_outputs")
    private IntermediateOutputs intermediateOutputs;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class IntermediateOutputs {
        @JsonProperty("intent")
        private String intent;

        @JsonProperty("categories")
        private String categories;

        @JsonProperty("selected_category")
        private String selectedCategory;

        /**
         * Detail-extraction output, truncated for transport.
         */
        @JsonProperty("extraction")
        private String extraction;
    }
}
