package com.demoBank.bankAssistant.orchestrator.service;

import com.demoBank.bankAssistant.completion.model.CompletionResult;
import com.demoBank.bankAssistant.completion.service.CompletionClient;
import com.demoBank.bankAssistant.orchestrator.prompt.IntentInterpretationPrompt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stage 1 - interprets what the customer wants from their first message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentService {

    private final CompletionClient completionClient;

    /**
     * Interprets the customer's intent.
     *
     * @param customerMessage Trimmed customer message
     * @param correlationId Correlation ID for logging
     * @return Interpretation, or the failure of the completion call
     */
    public CompletionResult interpret(String customerMessage, String correlationId) {
        log.info("Step INTERPRET - correlationId: {}, message length: {}", correlationId, customerMessage.length());

        CompletionResult result = completionClient.complete(IntentInterpretationPrompt.build(customerMessage));

        if (!result.isSuccess()) {
            log.warn("Intent interpretation failed - correlationId: {}, error: {}", correlationId, result.getErrorMessage());
        }
        return result;
    }
}
