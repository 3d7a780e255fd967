package com.demoBank.bankAssistant.completion.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response body of a chat completions call. Only the fields the assistant reads are mapped.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompletionResponse {

    private String model;

    private List<Choice> choices;

    private Usage usage;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private CompletionRequest.Message message;

        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Usage {
        @JsonProperty("total_tokens")
        private Integer totalTokens;
    }

    /**
     * @return Text of the first choice, or null when the response carries none
     */
    public String getContent() {
        if (choices == null || choices.isEmpty() || choices.get(0) == null) {
            return null;
        }
        CompletionRequest.Message message = choices.get(0).getMessage();
        return message != null ? message.getContent() : null;
    }
}
