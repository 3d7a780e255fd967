package com.demoBank.bankAssistant.orchestrator.prompt;

/**
 * Prompt for stage 5: write the final customer-facing answer once enough details are known.
 */
public class ResolutionPrompt {

    private ResolutionPrompt() {}

    private static final String TEMPLATE = """
            You are a professional banking assistant. Generate a helpful, friendly response to satisfy the customer.

            Request Category: %s

            Collected Information:
            %s

            Generate a concise, professional response that:
            1. Confirms what action you're taking or what information you're providing
            2. Addresses the customer's needs based on the category
            3. Is warm and reassuring
            4. Ends with an offer to help further if needed

            Keep it short and natural.""";

    public static String build(String selectedCategory, String collectedInfo) {
        return TEMPLATE.formatted(selectedCategory, collectedInfo);
    }
}
