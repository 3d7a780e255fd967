package com.demoBank.bankAssistant.completion.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one completion call: either the generated text or the reason the call failed.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CompletionResult {

    public static final String ERROR_PREFIX = "Error: ";

    private final boolean success;

    /**
     * Trimmed generated text. Null when the call failed.
     */
    private final String content;

    /**
     * Failure detail. Null when the call succeeded.
     */
    private final String errorMessage;

    public static CompletionResult ok(String content) {
        return new CompletionResult(true, content, null);
    }

    public static CompletionResult failed(String errorMessage) {
        return new CompletionResult(false, null, errorMessage);
    }

    /**
     * True when the call succeeded but produced nothing usable.
     */
    public boolean isBlank() {
        return success && (content == null || content.isBlank());
    }

    /**
     * Renders the result as text: the content on success, an "Error: ..." diagnostic otherwise.
     *
     * @return Text usable as a stage output or user-facing reply
     */
    public String asText() {
        return success ? content : ERROR_PREFIX + errorMessage;
    }
}
