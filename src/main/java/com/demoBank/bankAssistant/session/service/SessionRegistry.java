package com.demoBank.bankAssistant.session.service;

import com.demoBank.bankAssistant.session.config.SessionProperties;
import com.demoBank.bankAssistant.session.exception.SessionNotFoundException;
import com.demoBank.bankAssistant.session.model.SessionState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Session registry - process-wide mapping from session id to conversation state, backed by Caffeine.
 *
 * Responsibilities:
 * - Create sessions (fresh id, greeting seeded)
 * - Look up, delete and enumerate sessions
 * - Optional idle expiry and size bound (both off by default)
 *
 * All operations are safe for concurrent use.
 */
@Slf4j
@Service
public class SessionRegistry {

    private final Cache<String, SessionState> sessionCache;

    public SessionRegistry(SessionProperties properties) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (properties.getIdleTtl() != null) {
            builder.expireAfterAccess(properties.getIdleTtl());
        }
        if (properties.getMaximumSize() != null) {
            builder.maximumSize(properties.getMaximumSize());
        }
        this.sessionCache = builder
                .removalListener((String key, SessionState value, RemovalCause cause) ->
                        log.debug("Session removed - sessionId: {}, cause: {}", key, cause))
                .build();

        log.info("Session registry initialized - idleTtl: {}, maximumSize: {}",
                properties.getIdleTtl() != null ? properties.getIdleTtl() : "none",
                properties.getMaximumSize() != null ? properties.getMaximumSize() : "unbounded");
    }

    /**
     * Creates a new session with a freshly generated id.
     *
     * @return The new session, already registered
     */
    public SessionState create() {
        SessionState session = new SessionState(UUID.randomUUID().toString());
        sessionCache.put(session.getSessionId(), session);
        log.info("Created new session - sessionId: {}", session.getSessionId());
        return session;
    }

    /**
     * Gets the session for an id, creating it when it does not exist yet.
     * A null or blank id always yields a new session with a generated id.
     *
     * @param sessionId Session id supplied by the caller, may be null
     * @return Existing or newly created session
     */
    public SessionState getOrCreate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return create();
        }
        return sessionCache.get(sessionId, id -> {
            log.info("Creating new session for supplied id - sessionId: {}", id);
            return new SessionState(id);
        });
    }

    public Optional<SessionState> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionCache.getIfPresent(sessionId));
    }

    /**
     * @throws SessionNotFoundException if no session has this id
     */
    public SessionState get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Removes a session.
     *
     * @throws SessionNotFoundException if no session has this id
     */
    public void delete(String sessionId) {
        SessionState removed = sessionId != null ? sessionCache.asMap().remove(sessionId) : null;
        if (removed == null) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Deleted session - sessionId: {}", sessionId);
    }

    public List<String> listIds() {
        return List.copyOf(sessionCache.asMap().keySet());
    }

    public int count() {
        return sessionCache.asMap().size();
    }
}
