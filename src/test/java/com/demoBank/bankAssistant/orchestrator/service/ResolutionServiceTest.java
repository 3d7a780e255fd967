package com.demoBank.bankAssistant.orchestrator.service;

import com.demoBank.bankAssistant.completion.model.CompletionResult;
import com.demoBank.bankAssistant.completion.service.CompletionClient;
import com.demoBank.bankAssistant.orchestrator.util.ContextDataFormatter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResolutionServiceTest {

    @Mock
    private CompletionClient completionClient;

    private ResolutionService resolutionService;
    private IntentService intentService;

    @BeforeEach
    void setUp() {
        resolutionService = new ResolutionService(completionClient, new ContextDataFormatter(new ObjectMapper()));
        intentService = new IntentService(completionClient);
    }

    @Test
    void resolve_shouldPassCategoryAndCollectedDetails() {
        when(completionClient.complete(anyString())).thenReturn(CompletionResult.ok("Your card has been blocked."));
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("card_last_four", "4821");
        context.put("reason", "stolen");

        CompletionResult result = resolutionService.resolve("Card Services", context, "c-1");

        assertThat(result.getContent()).isEqualTo("Your card has been blocked.");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(completionClient).complete(prompt.capture());
        assertThat(prompt.getValue())
                .startsWith("You are a professional banking assistant")
                .contains("Request Category: Card Services")
                .contains("\"card_last_four\" : \"4821\"")
                .contains("\"reason\" : \"stolen\"");
    }

    @Test
    void resolve_shouldReturnFailureUntouched() {
        when(completionClient.complete(anyString())).thenReturn(CompletionResult.failed("Read timed out"));

        CompletionResult result = resolutionService.resolve("Card Services", Map.of(), "c-1");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.asText()).isEqualTo("Error: Read timed out");
    }

    @Test
    void interpret_shouldEmbedCustomerMessage() {
        when(completionClient.complete(anyString())).thenReturn(CompletionResult.ok("Customer lost their card."));

        CompletionResult result = intentService.interpret("I lost my debit card", "c-1");

        assertThat(result.getContent()).isEqualTo("Customer lost their card.");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(completionClient).complete(prompt.capture());
        assertThat(prompt.getValue()).contains("Customer message: I lost my debit card");
    }
}
