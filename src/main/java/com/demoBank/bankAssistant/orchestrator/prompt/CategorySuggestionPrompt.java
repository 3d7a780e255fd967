package com.demoBank.bankAssistant.orchestrator.prompt;

import com.demoBank.bankAssistant.orchestrator.model.ServiceCategory;

/**
 * Prompt for stage 2: map the interpreted request to one or more candidate categories.
 */
public class CategorySuggestionPrompt {

    private CategorySuggestionPrompt() {}

    private static final String TEMPLATE = """
            Map the query to one or more possible categories that may apply.
            Available Categories:
            %s

            Interpreted customer request:
            %s

            Return the suggested categories (one or more) that best match this request. Format: list the category names.""";

    public static String build(String interpretedIntent) {
        return TEMPLATE.formatted(ServiceCategory.asPromptList(), interpretedIntent);
    }
}
