package com.demoBank.bankAssistant.completion.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.web.client.RestClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionClientConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(CompletionClientConfig.class);

    @Test
    void startup_shouldFailWithoutApiKey() {
        contextRunner.run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure())
                    .rootCause()
                    .hasMessageContaining("completion.api");
        });
    }

    @Test
    void startup_shouldFailWithBlankApiKey() {
        contextRunner.withPropertyValues("completion.api.key=   ")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void startup_shouldBindSettingsAndCreateRestClientWhenKeyPresent() {
        contextRunner.withPropertyValues(
                        "completion.api.key=secret",
                        "completion.api.model=custom-model",
                        "completion.api.timeout=5s")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(RestClient.class);

                    CompletionProperties properties = context.getBean(CompletionProperties.class);
                    assertThat(properties.getKey()).isEqualTo("secret");
                    assertThat(properties.getModel()).isEqualTo("custom-model");
                    assertThat(properties.getTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getTemperature()).isEqualTo(0.3);
                    assertThat(properties.getMaxCompletionTokens()).isEqualTo(8192);
                });
    }
}
