package com.demoBank.bankAssistant.orchestrator.service;

import com.demoBank.bankAssistant.completion.model.CompletionResult;
import com.demoBank.bankAssistant.completion.service.CompletionClient;
import com.demoBank.bankAssistant.orchestrator.model.ServiceCategory;
import com.demoBank.bankAssistant.orchestrator.prompt.CategorySelectionPrompt;
import com.demoBank.bankAssistant.orchestrator.prompt.CategorySuggestionPrompt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stages 2 and 3 - categorization of the interpreted request.
 *
 * Handles:
 * - Suggesting candidate categories from the fixed category list
 * - Selecting the single category the session will be locked to
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryService {

    private final CompletionClient completionClient;

    /**
     * Asks the model which of the known categories may apply.
     *
     * @param interpretedIntent Stage 1 output
     * @param correlationId Correlation ID for logging
     * @return Free-text list of candidate categories
     */
    public CompletionResult suggestCategories(String interpretedIntent, String correlationId) {
        log.info("Step SUGGEST_CATEGORIES - correlationId: {}", correlationId);

        CompletionResult result = completionClient.complete(CategorySuggestionPrompt.build(interpretedIntent));

        if (!result.isSuccess()) {
            log.warn("Category suggestion failed - correlationId: {}, error: {}", correlationId, result.getErrorMessage());
        }
        return result;
    }

    /**
     * Asks the model for exactly one category out of the suggestions.
     * The answer is accepted as-is; a label outside the known list is only logged.
     *
     * @param interpretedIntent Stage 1 output
     * @param suggestedCategories Stage 2 output
     * @param correlationId Correlation ID for logging
     * @return Selected category name
     */
    public CompletionResult selectCategory(String interpretedIntent, String suggestedCategories, String correlationId) {
        log.info("Step SELECT_CATEGORY - correlationId: {}", correlationId);

        CompletionResult result = completionClient.complete(
                CategorySelectionPrompt.build(interpretedIntent, suggestedCategories));

        if (!result.isSuccess()) {
            log.warn("Category selection failed - correlationId: {}, error: {}", correlationId, result.getErrorMessage());
        } else if (!result.isBlank() && ServiceCategory.fromLabel(result.getContent()).isEmpty()) {
            log.warn("Selected category is not one of the known categories - correlationId: {}, category: {}",
                    correlationId, result.getContent());
        }
        return result;
    }
}
