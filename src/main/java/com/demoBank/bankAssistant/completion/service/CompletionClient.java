package com.demoBank.bankAssistant.completion.service;

import com.demoBank.bankAssistant.completion.config.CompletionProperties;
import com.demoBank.bankAssistant.completion.dto.CompletionRequest;
import com.demoBank.bankAssistant.completion.dto.CompletionResponse;
import com.demoBank.bankAssistant.completion.model.CompletionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/**
 * Client for the text-completion service.
 * Handles HTTP communication with an OpenAI-compatible chat completions endpoint.
 *
 * Never throws to its caller: HTTP errors, I/O errors and timeouts come back as a failed
 * {@link CompletionResult} carrying the failure detail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionClient {

    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final RestClient completionRestClient;
    private final CompletionProperties properties;

    /**
     * Sends a prompt as a single user message and returns the generated text.
     *
     * @param prompt Complete prompt for the stage
     * @return Successful result with trimmed content, or a failed result with the error detail
     */
    public CompletionResult complete(String prompt) {
        CompletionRequest request = CompletionRequest.forPrompt(prompt, properties);

        try {
            log.debug("Calling completion API - model: {}, prompt length: {}", properties.getModel(), prompt.length());

            CompletionResponse response = completionRestClient.post()
                    .uri(COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getKey())
                    .body(request)
                    .retrieve()
                    .body(CompletionResponse.class);

            if (response == null) {
                log.warn("Completion API returned an empty body");
                return CompletionResult.failed("Completion API returned null response");
            }

            String content = response.getContent();
            if (content == null) {
                log.warn("Completion API response has no content - model: {}", response.getModel());
                return CompletionResult.failed("Completion API response contained no content");
            }

            log.debug("Completion API response received - model: {}, tokens used: {}",
                    response.getModel(),
                    response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");

            return CompletionResult.ok(content.trim());

        } catch (Exception e) {
            log.error("Error calling completion API", e);
            return CompletionResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
