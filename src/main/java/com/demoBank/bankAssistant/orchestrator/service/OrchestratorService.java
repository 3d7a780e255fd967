package com.demoBank.bankAssistant.orchestrator.service;

import com.demoBank.bankAssistant.completion.model.CompletionResult;
import com.demoBank.bankAssistant.orchestrator.dto.DetailExtractionResponse;
import com.demoBank.bankAssistant.orchestrator.model.TurnResult;
import com.demoBank.bankAssistant.session.model.ChatMessage;
import com.demoBank.bankAssistant.session.model.SessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrator service - runs the prompt chain for one conversation turn.
 *
 * Workflow steps:
 * VALIDATE -> INTERPRET (first turn only) -> SUGGEST_CATEGORIES (first turn only)
 * -> SELECT_CATEGORY (until locked) -> EXTRACT_DETAILS (every turn)
 * -> (IF READY_TO_RESOLVE -> RESOLVE) -> RESPOND
 *
 * Stage outputs for interpretation, suggestions and category are cached on the session and
 * never recomputed. Turns for the same session are serialized on the session's turn lock.
 *
 * When a completion call fails during interpretation, suggestion or selection, the turn is
 * aborted with the diagnostic as reply and nothing is cached, so the next turn retries the stage.
 * Setting assistant.chain.cache-failed-stages=true restores the older behavior of treating the
 * diagnostic text as a real stage output.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestratorService {

    static final String EMPTY_INPUT_REPLY = "Error: Empty input";
    static final String CATEGORY_FAILED_REPLY = "Error: Failed to select category";
    static final String EXTRACTION_FAILED_REPLY = "Error: Failed to process request";
    static final String DEFAULT_RESOLVED_REPLY = "Your request has been processed.";
    static final String DEFAULT_NEEDS_INFO_REPLY = "Could you provide more details?";

    private final IntentService intentService;
    private final CategoryService categoryService;
    private final DetailExtractionService detailExtractionService;
    private final ResolutionService resolutionService;

    @Value("${assistant.chain.cache-failed-stages:false}")
    private boolean cacheFailedStages;

    /**
     * Processes one customer message against a session.
     * Records the message and the reply in the session's message history.
     *
     * @param session Session the message belongs to
     * @param message Raw customer message
     * @param correlationId Correlation ID for logging
     * @return Reply and per-stage outputs of this turn
     */
    public TurnResult processTurn(SessionState session, String message, String correlationId) {
        String rawMessage = message != null ? message : "";

        ReentrantLock turnLock = session.getTurnLock();
        if (!turnLock.tryLock()) {
            log.info("Waiting for in-flight turn - correlationId: {}, sessionId: {}", correlationId, session.getSessionId());
            turnLock.lock();
        }
        try {
            log.info("Starting turn - correlationId: {}, sessionId: {}, turn: {}",
                    correlationId, session.getSessionId(), session.getTurnHistory().size() + 1);

            session.addMessage(ChatMessage.user(rawMessage));
            TurnResult result = runChain(session, rawMessage.trim(), correlationId);
            session.addMessage(ChatMessage.assistant(result.getReply()));

            log.info("Turn completed - correlationId: {}, sessionId: {}, category: {}, collected fields: {}, resolved: {}",
                    correlationId, session.getSessionId(), session.getSelectedCategory(),
                    session.getContextData().size(), result.isResolved());
            return result;
        } finally {
            turnLock.unlock();
        }
    }

    private TurnResult runChain(SessionState session, String userInput, String correlationId) {
        TurnResult.TurnResultBuilder turn = TurnResult.builder();

        // Step 1: VALIDATE
        if (userInput.isEmpty()) {
            log.warn("Rejecting empty message - correlationId: {}", correlationId);
            return turn.reply(EMPTY_INPUT_REPLY).build();
        }

        session.addTurn(userInput);
        String conversationHistory = session.getCumulativeHistory();

        // Step 2: INTERPRET
        String interpretedIntent;
        if (session.hasInterpretedIntent()) {
            interpretedIntent = session.getInterpretedIntent();
            log.debug("Reusing cached interpretation - correlationId: {}", correlationId);
        } else {
            CompletionResult result = intentService.interpret(userInput, correlationId);
            if (abortOnFailure(result)) {
                return turn.reply(result.asText()).build();
            }
            interpretedIntent = result.asText();
            session.setInterpretedIntent(interpretedIntent);
            turn.intent(interpretedIntent);
        }

        // Step 3: SUGGEST_CATEGORIES
        String suggestedCategories;
        if (session.hasSuggestedCategories()) {
            suggestedCategories = session.getSuggestedCategories();
            log.debug("Reusing cached category suggestions - correlationId: {}", correlationId);
        } else {
            CompletionResult result = categoryService.suggestCategories(interpretedIntent, correlationId);
            if (abortOnFailure(result)) {
                return turn.reply(result.asText()).build();
            }
            suggestedCategories = result.asText();
            session.setSuggestedCategories(suggestedCategories);
            turn.categories(suggestedCategories);
        }

        // Step 4: SELECT_CATEGORY
        String selectedCategory;
        if (session.isCategoryLocked()) {
            selectedCategory = session.getSelectedCategory();
            log.debug("Category already locked - correlationId: {}, category: {}", correlationId, selectedCategory);
        } else {
            CompletionResult result = categoryService.selectCategory(interpretedIntent, suggestedCategories, correlationId);
            if (abortOnFailure(result)) {
                return turn.reply(result.asText()).build();
            }
            String candidate = result.asText();
            if (candidate == null || candidate.isBlank()) {
                log.warn("Category selection returned nothing - correlationId: {}", correlationId);
                return turn.reply(CATEGORY_FAILED_REPLY).build();
            }
            selectedCategory = candidate.trim();
            session.lockCategory(selectedCategory);
            turn.selectedCategory(selectedCategory);
            log.info("Category locked - correlationId: {}, sessionId: {}, category: {}",
                    correlationId, session.getSessionId(), selectedCategory);
        }

        // Step 5: EXTRACT_DETAILS
        CompletionResult extraction = detailExtractionService.extract(
                interpretedIntent, conversationHistory, selectedCategory, session.getContextData(), correlationId);
        if (extraction.isBlank()) {
            log.warn("Detail extraction returned nothing - correlationId: {}", correlationId);
            return turn.reply(EXTRACTION_FAILED_REPLY).build();
        }
        String extractionText = extraction.asText();
        turn.extraction(extractionText);
        if (abortOnFailure(extraction)) {
            return turn.reply(extractionText).build();
        }

        Optional<DetailExtractionResponse> parsed = detailExtractionService.parse(extractionText, correlationId);
        if (parsed.isEmpty()) {
            log.info("Extraction output is not structured, replying with it verbatim - correlationId: {}", correlationId);
            return turn.reply(extractionText).build();
        }

        DetailExtractionResponse response = parsed.get();
        if (response.hasExtractedData()) {
            session.mergeContextData(response.getExtractedData());
            log.debug("Merged extracted data - correlationId: {}, keys: {}", correlationId, response.getExtractedData().keySet());
        }

        // Step 6: RESOLVE or ask for more
        if (response.isReadyToResolve()) {
            return resolve(session, selectedCategory, response, turn, correlationId);
        }

        log.info("More information needed - correlationId: {}, followUp: {}", correlationId, response.getFollowUpQuestion());
        return turn.reply(response.getResponseToUser() != null ? response.getResponseToUser() : DEFAULT_NEEDS_INFO_REPLY)
                .build();
    }

    private TurnResult resolve(SessionState session, String selectedCategory, DetailExtractionResponse response,
                               TurnResult.TurnResultBuilder turn, String correlationId) {
        CompletionResult resolution = resolutionService.resolve(selectedCategory, session.getContextData(), correlationId);

        if (resolution.isSuccess() && !resolution.isBlank()) {
            return turn.reply(resolution.getContent()).resolved(true).build();
        }
        if (!resolution.isSuccess() && cacheFailedStages) {
            return turn.reply(resolution.asText()).build();
        }

        log.warn("Resolution produced no answer, falling back to extraction reply - correlationId: {}", correlationId);
        return turn.reply(response.getResponseToUser() != null ? response.getResponseToUser() : DEFAULT_RESOLVED_REPLY)
                .build();
    }

    private boolean abortOnFailure(CompletionResult result) {
        return !result.isSuccess() && !cacheFailedStages;
    }
}
