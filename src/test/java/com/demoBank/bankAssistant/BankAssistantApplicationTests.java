package com.demoBank.bankAssistant;

import com.demoBank.bankAssistant.completion.model.CompletionResult;
import com.demoBank.bankAssistant.completion.service.CompletionClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "completion.api.key=test-key")
@AutoConfigureMockMvc
class BankAssistantApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private CompletionClient completionClient;

    @Test
    void accountOpeningConversation_shouldRunEndToEnd() throws Exception {
        when(completionClient.complete(startsWith("You are a Bank Assistant. Interpret")))
                .thenReturn(CompletionResult.ok("The customer wants to open a new checking account."));
        when(completionClient.complete(startsWith("Map the query")))
                .thenReturn(CompletionResult.ok("- Account Opening"));
        when(completionClient.complete(startsWith("Select the MOST")))
                .thenReturn(CompletionResult.ok("Account Opening"));
        when(completionClient.complete(startsWith("You are handling a banking request"))).thenReturn(
                CompletionResult.ok("{\"status\":\"needs_info\",\"extracted_data\":{},\"response_to_user\":\"Could you share your full legal name?\"}"),
                CompletionResult.ok("{\"status\":\"ready_to_resolve\",\"extracted_data\":{\"name\":\"Jane Doe\"},\"response_to_user\":\"Thanks!\"}"));
        when(completionClient.complete(startsWith("You are a professional banking assistant")))
                .thenReturn(CompletionResult.ok("Your checking account application is underway, Jane."));

        String created = mockMvc.perform(post("/api/session/new"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.initial_message").value("Hello! I'm your banking assistant. How can I help you today?"))
                .andReturn().getResponse().getContentAsString();
        String sessionId = objectMapper.readTree(created).get("session_id").asText();

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(chatBody("I need a new checking account", sessionId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value(sessionId))
                .andExpect(jsonPath("$.response").value("Could you share your full legal name?"))
                .andExpect(jsonPath("$.intermediate_outputs.selected_category").value("Account Opening"));

        String second = mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(chatBody("Jane Doe", sessionId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Your checking account application is underway, Jane."))
                .andReturn().getResponse().getContentAsString();
        JsonNode outputs = objectMapper.readTree(second).get("intermediate_outputs");
        assertThat(outputs.get("intent").isNull()).isTrue();
        assertThat(outputs.get("selected_category").isNull()).isTrue();

        mockMvc.perform(get("/api/session/{id}/info", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message_count").value(5))
                .andExpect(jsonPath("$.category").value("Account Opening"));

        verify(completionClient, times(1)).complete(startsWith("You are a Bank Assistant. Interpret"));

        mockMvc.perform(delete("/api/session/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Session deleted"));
        mockMvc.perform(get("/api/session/{id}/info", sessionId))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/session/{id}", sessionId))
                .andExpect(status().isNotFound());
    }

    @Test
    void emptyMessage_shouldBeAnsweredWithoutCompletionCalls() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(chatBody("   ", null)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Error: Empty input"))
                .andExpect(jsonPath("$.session_id").isNotEmpty());

        verify(completionClient, never()).complete(anyString());
    }

    @Test
    void unknownSession_shouldBeNotFound() throws Exception {
        mockMvc.perform(get("/api/session/{id}/info", "does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    private String chatBody(String message, String sessionId) throws Exception {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("message", message);
        if (sessionId != null) {
            body.put("session_id", sessionId);
        }
        return objectMapper.writeValueAsString(body);
    }
}
