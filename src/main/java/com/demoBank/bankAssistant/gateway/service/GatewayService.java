package com.demoBank.bankAssistant.gateway.service;

import com.demoBank.bankAssistant.gateway.dto.ChatRequest;
import com.demoBank.bankAssistant.gateway.dto.ChatResponse;
import com.demoBank.bankAssistant.gateway.dto.SessionCreatedResponse;
import com.demoBank.bankAssistant.gateway.dto.SessionInfoResponse;
import com.demoBank.bankAssistant.gateway.dto.SessionListResponse;
import com.demoBank.bankAssistant.orchestrator.model.TurnResult;
import com.demoBank.bankAssistant.orchestrator.service.OrchestratorService;
import com.demoBank.bankAssistant.session.exception.SessionNotFoundException;
import com.demoBank.bankAssistant.session.model.ChatMessage;
import com.demoBank.bankAssistant.session.model.SessionState;
import com.demoBank.bankAssistant.session.service.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Gateway service - handles all business logic behind the HTTP endpoints.
 *
 * Responsibilities:
 * - Generate a correlationId per request
 * - Resolve or create the session for a chat message
 * - Forward the message to the Orchestrator
 * - Shape orchestrator output for transport (truncated intermediate outputs)
 * - Session lifecycle: create, inspect, delete, list
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    static final int EXTRACTION_PREVIEW_LENGTH = 200;
    private static final int LOG_PREVIEW_LENGTH = 50;

    private final CorrelationIdService correlationIdService;
    private final SessionRegistry sessionRegistry;
    private final OrchestratorService orchestratorService;

    /**
     * Processes a chat message, starting a session when the request carries no known id.
     *
     * @param request Chat request containing the message and optional session id
     * @return Chat response with the reply and this turn's stage outputs
     */
    public ChatResponse processChatRequest(ChatRequest request) {
        String correlationId = correlationIdService.open();
        try {
            log.info("Chat request received - correlationId: {}, sessionId: {}, message: {}",
                    correlationId, request.getSessionId(), preview(request.getMessage(), LOG_PREVIEW_LENGTH));

            SessionState session = sessionRegistry.getOrCreate(request.getSessionId());

            TurnResult result = orchestratorService.processTurn(session, request.getMessage(), correlationId);

            log.info("Chat response generated - correlationId: {}, sessionId: {}, response: {}",
                    correlationId, session.getSessionId(), preview(result.getReply(), LOG_PREVIEW_LENGTH));

            return ChatResponse.builder()
                    .sessionId(session.getSessionId())
                    .response(result.getReply())
                    .timestamp(Instant.now())
                    .intermediateOutputs(ChatResponse.IntermediateOutputs.builder()
                            .intent(result.getIntent())
                            .categories(result.getCategories())
                            .selectedCategory(result.getSelectedCategory())
                            .extraction(preview(result.getExtraction(), EXTRACTION_PREVIEW_LENGTH))
                            .build())
                    .build();
        } finally {
            correlationIdService.close();
        }
    }

    public SessionCreatedResponse createSession() {
        SessionState session = sessionRegistry.create();
        List<ChatMessage> history = session.getMessageHistory();

        return SessionCreatedResponse.builder()
                .sessionId(session.getSessionId())
                .message("New session created")
                .initialMessage(history.get(0).getContent())
                .build();
    }

    /**
     * @throws SessionNotFoundException if the session does not exist
     */
    public SessionInfoResponse getSessionInfo(String sessionId) {
        SessionState session = sessionRegistry.get(sessionId);
        return SessionInfoResponse.builder()
                .sessionId(session.getSessionId())
                .messageCount(session.getMessageCount())
                .category(session.getSelectedCategory())
                .build();
    }

    /**
     * @throws SessionNotFoundException if the session does not exist
     */
    public void deleteSession(String sessionId) {
        sessionRegistry.delete(sessionId);
    }

    public SessionListResponse listSessions() {
        List<String> ids = sessionRegistry.listIds();
        return SessionListResponse.builder()
                .activeSessions(ids.size())
                .sessionIds(ids)
                .build();
    }

    private static String preview(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
