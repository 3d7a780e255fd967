package com.demoBank.bankAssistant.gateway.service;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating correlation IDs for request tracking.
 * The current ID is also exposed to log lines through the MDC key {@value #MDC_KEY}.
 */
@Service
public class CorrelationIdService {

    public static final String MDC_KEY = "correlationId";

    /**
     * Generates a correlation ID and binds it to the current thread's logging context.
     *
     * @return A UUID-based correlation ID
     */
    public String open() {
        String correlationId = UUID.randomUUID().toString();
        MDC.put(MDC_KEY, correlationId);
        return correlationId;
    }

    /**
     * Unbinds the correlation ID from the current thread.
     */
    public void close() {
        MDC.remove(MDC_KEY);
    }
}
