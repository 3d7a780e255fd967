package com.demoBank.bankAssistant.orchestrator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Structured output of the detail-extraction stage, read from the JSON object the model
 * embeds in its answer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DetailExtractionResponse {

    public static final String FIELD_STATUS = "status";
    public static final String FIELD_EXTRACTED_DATA = "extracted_data";
    public static final String FIELD_FOLLOW_UP_QUESTION = "follow_up_question";
    public static final String FIELD_RESPONSE_TO_USER = "response_to_user";

    public static final String STATUS_READY_TO_RESOLVE = "ready_to_resolve";

    /**
     * "needs_info" or "ready_to_resolve". Any other value is treated as needing more info.
     */
    private String status;

    /**
     * Newly extracted facts, merged into the session's context data. Empty when the model
     * extracted nothing or sent something other than an object.
     */
    private Map<String, Object> extractedData;

    private String followUpQuestion;

    private String responseToUser;

    public boolean isReadyToResolve() {
        return STATUS_READY_TO_RESOLVE.equals(status);
    }

    public boolean hasExtractedData() {
        return extractedData != null && !extractedData.isEmpty();
    }
}
