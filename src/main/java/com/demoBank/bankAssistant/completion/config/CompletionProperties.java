package com.demoBank.bankAssistant.completion.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the text-completion service used by every prompt-chain stage.
 *
 * The API key is mandatory: when it is missing the application context fails to start,
 * so the service never accepts traffic without a credential.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "completion.api")
public class CompletionProperties {

    /**
     * Base URL of an OpenAI-compatible API; "/chat/completions" is appended.
     */
    @NotBlank
    private String baseUrl = "https://api.groq.com/openai/v1";

    /**
     * Credential read from the GROQ_API_KEY environment variable.
     */
    @NotBlank(message = "completion.api.key must be set (GROQ_API_KEY environment variable)")
    private String key;

    @NotBlank
    private String model = "llama-3.3-70b-versatile";

    private Double temperature = 0.3;

    private Double topP = 0.95;

    @Positive
    private Integer maxCompletionTokens = 8192;

    /**
     * Upper bound for connecting to and reading from the completion service.
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(30);
}
