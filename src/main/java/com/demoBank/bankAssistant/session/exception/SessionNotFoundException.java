package com.demoBank.bankAssistant.session.exception;

/**
 * Exception thrown when a session id does not match any active session.
 */
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
