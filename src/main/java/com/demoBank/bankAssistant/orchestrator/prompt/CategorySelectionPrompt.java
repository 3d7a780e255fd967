package com.demoBank.bankAssistant.orchestrator.prompt;

/**
 * Prompt for stage 3: narrow the suggestions down to exactly one category name.
 */
public class CategorySelectionPrompt {

    private CategorySelectionPrompt() {}

    private static final String TEMPLATE = """
            Select the MOST appropriate single category from the suggestions.

            Suggested Categories:
            %s

            Interpreted customer request:
            %s

            Return ONLY the single most appropriate category name, nothing else.""";

    public static String build(String interpretedIntent, String suggestedCategories) {
        return TEMPLATE.formatted(suggestedCategories, interpretedIntent);
    }
}
