package com.demoBank.bankAssistant.session.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Session store settings. Both limits are unset by default: sessions live until deleted
 * or until the process ends.
 */
@Data
@ConfigurationProperties(prefix = "assistant.session")
public class SessionProperties {

    /**
     * Evict a session after this much inactivity. Null disables expiry.
     */
    private Duration idleTtl;

    /**
     * Upper bound on stored sessions. Null means unbounded.
     */
    private Long maximumSize;
}
