package com.demoBank.bankAssistant.orchestrator.prompt;

/**
 * Prompt for stage 4: decide whether more information is needed and pull new details out of
 * the conversation.
 *
 * The model is asked for a JSON object with:
 * - status: "needs_info" or "ready_to_resolve"
 * - extracted_data: new key/value facts
 * - follow_up_question: one question, or null
 * - response_to_user: the message shown to the customer
 */
public class DetailExtractionPrompt {

    private DetailExtractionPrompt() {}

    public static final String NOTHING_COLLECTED = "None yet";

    private static final String TEMPLATE = """
            You are handling a banking request. Based on the category and information collected so far, determine what's needed next.

            Selected Category: %s

            Customer's original message: %s

            Interpreted intent: %s

            Information already collected:
            %s

            Task:
            1. If you need more information to process this request, ask ONE specific follow-up question
            2. If you have enough information, acknowledge this and prepare to resolve the request
            3. Extract any new details from the customer's message

            Return your response in this JSON format:
            {
                "status": "needs_info" or "ready_to_resolve",
                "extracted_data": {"key": "value"},
                "follow_up_question": "your question here" or null,
                "response_to_user": "friendly message to the customer"
            }""";

    /**
     * @param selectedCategory Locked category for the session
     * @param conversationHistory All customer inputs so far, newline separated
     * @param interpretedIntent Stage 1 interpretation
     * @param collectedInfo Context collected so far, already rendered (JSON or {@link #NOTHING_COLLECTED})
     */
    public static String build(String selectedCategory, String conversationHistory,
                               String interpretedIntent, String collectedInfo) {
        return TEMPLATE.formatted(selectedCategory, conversationHistory, interpretedIntent, collectedInfo);
    }
}
