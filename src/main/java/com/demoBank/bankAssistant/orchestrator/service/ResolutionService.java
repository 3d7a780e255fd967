package com.demoBank.bankAssistant.orchestrator.service;

import com.demoBank.bankAssistant.completion.model.CompletionResult;
import com.demoBank.bankAssistant.completion.service.CompletionClient;
import com.demoBank.bankAssistant.orchestrator.prompt.ResolutionPrompt;
import com.demoBank.bankAssistant.orchestrator.util.ContextDataFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Stage 5 - generates the final answer once extraction reports the request is ready to resolve.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResolutionService {

    private final CompletionClient completionClient;
    private final ContextDataFormatter contextDataFormatter;

    public CompletionResult resolve(String selectedCategory, Map<String, Object> contextData, String correlationId) {
        log.info("Step RESOLVE - correlationId: {}, category: {}, collected fields: {}",
                correlationId, selectedCategory, contextData.size());

        CompletionResult result = completionClient.complete(
                ResolutionPrompt.build(selectedCategory, contextDataFormatter.toPrettyJson(contextData)));

        if (!result.isSuccess()) {
            log.warn("Resolution failed - correlationId: {}, error: {}", correlationId, result.getErrorMessage());
        }
        return result;
    }
}
