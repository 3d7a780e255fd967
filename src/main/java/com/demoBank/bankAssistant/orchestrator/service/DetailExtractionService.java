package com.demoBank.bankAssistant.orchestrator.service;

import com.demoBank.bankAssistant.completion.model.CompletionResult;
import com.demoBank.bankAssistant.completion.service.CompletionClient;
import com.demoBank.bankAssistant.orchestrator.dto.DetailExtractionResponse;
import com.demoBank.bankAssistant.orchestrator.prompt.DetailExtractionPrompt;
import com.demoBank.bankAssistant.orchestrator.util.ContextDataFormatter;
import com.demoBank.bankAssistant.orchestrator.util.JsonSpanExtractor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stage 4 - works out what is still missing and extracts new details from the conversation.
 *
 * Runs on every turn. Its output is free text that should contain a JSON object; parsing is
 * lenient and a missing or broken object is not an error (the caller shows the raw text).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DetailExtractionService {

    private static final TypeReference<Map<String, Object>> EXTRACTED_DATA_TYPE = new TypeReference<>() {};

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    private final ContextDataFormatter contextDataFormatter;

    /**
     * Runs the extraction prompt.
     *
     * @param interpretedIntent Stage 1 output
     * @param conversationHistory All customer inputs so far, newline separated
     * @param selectedCategory Locked category
     * @param contextData Details collected in earlier turns
     * @param correlationId Correlation ID for logging
     * @return Raw model output
     */
    public CompletionResult extract(String interpretedIntent, String conversationHistory, String selectedCategory,
                                    Map<String, Object> contextData, String correlationId) {
        log.info("Step EXTRACT_DETAILS - correlationId: {}, category: {}, collected fields: {}",
                correlationId, selectedCategory, contextData.size());

        String collectedInfo = contextData.isEmpty()
                ? DetailExtractionPrompt.NOTHING_COLLECTED
                : contextDataFormatter.toPrettyJson(contextData);

        CompletionResult result = completionClient.complete(
                DetailExtractionPrompt.build(selectedCategory, conversationHistory, interpretedIntent, collectedInfo));

        if (!result.isSuccess()) {
            log.warn("Detail extraction failed - correlationId: {}, error: {}", correlationId, result.getErrorMessage());
        }
        return result;
    }

    /**
     * Decodes the first syntactically valid JSON object in the extraction output.
     * Field shapes are read leniently: an {@code extracted_data} that is not an object (an empty
     * array, a string, null) means nothing was extracted, and does not reject the span.
     *
     * @param rawOutput Stage 4 output text
     * @param correlationId Correlation ID for logging
     * @return Decoded response, or empty when no span is valid JSON
     */
    public Optional<DetailExtractionResponse> parse(String rawOutput, String correlationId) {
        List<String> spans = JsonSpanExtractor.objectSpans(rawOutput);
        if (spans.isEmpty()) {
            log.debug("No JSON object in extraction output - correlationId: {}", correlationId);
            return Optional.empty();
        }

        for (String span : spans) {
            JsonNode root;
            try {
                root = objectMapper.readTree(span);
            } catch (JsonProcessingException e) {
                log.debug("Skipping undecodable JSON span - correlationId: {}, error: {}", correlationId, e.getOriginalMessage());
                continue;
            }
            if (root != null && root.isObject()) {
                return Optional.of(toResponse(root, correlationId));
            }
        }

        log.warn("Extraction output contained no decodable JSON object - correlationId: {}, spans: {}",
                correlationId, spans.size());
        return Optional.empty();
    }

    private DetailExtractionResponse toResponse(JsonNode root, String correlationId) {
        JsonNode data = root.path(DetailExtractionResponse.FIELD_EXTRACTED_DATA);
        Map<String, Object> extractedData = Map.of();
        if (data.isObject()) {
            extractedData = objectMapper.convertValue(data, EXTRACTED_DATA_TYPE);
        } else if (!data.isMissingNode() && !data.isNull()) {
            log.debug("Ignoring non-object extracted_data - correlationId: {}, type: {}", correlationId, data.getNodeType());
        }

        return DetailExtractionResponse.builder()
                .status(textOrNull(root, DetailExtractionResponse.FIELD_STATUS))
                .extractedData(extractedData)
                .followUpQuestion(textOrNull(root, DetailExtractionResponse.FIELD_FOLLOW_UP_QUESTION))
                .responseToUser(textOrNull(root, DetailExtractionResponse.FIELD_RESPONSE_TO_USER))
                .build();
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
