package com.demoBank.bankAssistant.gateway.controller;

import com.demoBank.bankAssistant.gateway.dto.ChatRequest;
import com.demoBank.bankAssistant.gateway.dto.ChatResponse;
import com.demoBank.bankAssistant.gateway.dto.SessionCreatedResponse;
import com.demoBank.bankAssistant.gateway.dto.SessionInfoResponse;
import com.demoBank.bankAssistant.gateway.dto.SessionListResponse;
import com.demoBank.bankAssistant.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway REST controller - thin HTTP layer for chat and session requests.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Delegate business logic to GatewayService
 */
@RestController
@CrossOrigin(origins = {"https://bank-ai-react-assistant.vercel.app", "http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class GatewayController {

    private final GatewayService gatewayService;

    /**
     * Service status.
     */
    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        Map<String, String> response = new LinkedHashMap<>();
        response.put("message", "Bank AI Assistant API");
        response.put("version", "1.0.0");
        response.put("status", "running");
        return ResponseEntity.ok(response);
    }

    /**
     * Chat endpoint - processes one customer message.
     *
     * @param request Chat request containing the message and optional session id
     * @return Chat response with the reply
     */
    @PostMapping("/api/chat")
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        return ResponseEntity.ok(gatewayService.processChatRequest(request));
    }

    @PostMapping("/api/session/new")
    public ResponseEntity<SessionCreatedResponse> createSession() {
        return ResponseEntity.ok(gatewayService.createSession());
    }

    @GetMapping("/api/session/{sessionId}/info")
    public ResponseEntity<SessionInfoResponse> getSessionInfo(@PathVariable String sessionId) {
        return ResponseEntity.ok(gatewayService.getSessionInfo(sessionId));
    }

    @DeleteMapping("/api/session/{sessionId}")
    public ResponseEntity<Map<String, String>> deleteSession(@PathVariable String sessionId) {
        gatewayService.deleteSession(sessionId);
        return ResponseEntity.ok(Map.of("message", "Session deleted"));
    }

    @GetMapping("/api/sessions")
    public ResponseEntity<SessionListResponse> listSessions() {
        return ResponseEntity.ok(gatewayService.listSessions());
    }
}
