package com.demoBank.bankAssistant.orchestrator.prompt;

/**
 * Prompt for stage 1: restate what the customer wants in clear terms.
 */
public class IntentInterpretationPrompt {

    private IntentInterpretationPrompt() {}

    private static final String TEMPLATE = """
            You are a Bank Assistant. Interpret the customer's intent clearly and concisely.
            Customer message: %s
            Provide a clear interpretation of what the customer wants or needs. Be specific and professional.""";

    public static String build(String customerMessage) {
        return TEMPLATE.formatted(customerMessage);
    }
}
