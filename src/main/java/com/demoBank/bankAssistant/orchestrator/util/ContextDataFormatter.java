package com.demoBank.bankAssistant.orchestrator.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Renders collected context data as pretty-printed JSON for inclusion in prompts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextDataFormatter {

    private final ObjectMapper objectMapper;

    public String toPrettyJson(Map<String, Object> contextData) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(contextData);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize context data, using plain rendering - keys: {}", contextData.keySet(), e);
            return String.valueOf(contextData);
        }
    }
}
