package com.demoBank.bankAssistant.completion.dto;

import com.demoBank.bankAssistant.completion.config.CompletionProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for an OpenAI-compatible chat completions call.
 * Every stage sends its whole prompt as one user turn; there is no system message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionRequest {

    private static final String USER_ROLE = "user";

    @JsonProperty("model")
    private String model;

    @JsonProperty("messages")
    private List<Message> messages;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("max_completion_tokens")
    private Integer maxCompletionTokens;

    @JsonProperty("stream")
    private boolean stream;

    /**
     * Builds a non-streaming request carrying a single user prompt and the configured sampling settings.
     */
    public static CompletionRequest forPrompt(String prompt, CompletionProperties settings) {
        return CompletionRequest.builder()
                .model(settings.getModel())
                .messages(List.of(new Message(USER_ROLE, prompt)))
                .temperature(settings.getTemperature())
                .topP(settings.getTopP())
                .maxCompletionTokens(settings.getMaxCompletionTokens())
                .stream(false)
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;
        private String content;
    }
}
