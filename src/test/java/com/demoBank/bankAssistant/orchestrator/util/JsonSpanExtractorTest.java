package com.demoBank.bankAssistant.orchestrator.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSpanExtractorTest {

    @Test
    void objectSpans_shouldFindObjectWrappedInProseAndMarkdown() {
        String text = """
                Sure! Here is the result:
                ```json
                {"status": "needs_info", "extracted_data": {"name": "Jane"}}
                ```
                Let me know if you need anything else.""";

        assertThat(JsonSpanExtractor.objectSpans(text))
                .containsExactly("{\"status\": \"needs_info\", \"extracted_data\": {\"name\": \"Jane\"}}");
    }

    @Test
    void objectSpans_shouldSeparateAdjacentObjects() {
        String text = "first {\"a\": 1} then {\"b\": {\"c\": 2}} done";

        assertThat(JsonSpanExtractor.objectSpans(text))
                .containsExactly("{\"a\": 1}", "{\"b\": {\"c\": 2}}");
    }

    @Test
    void objectSpans_shouldIgnoreBracesInsideStrings() {
        String text = "{\"response_to_user\": \"Use the format {last}, {first} \\\"please\\\"\"}";

        assertThat(JsonSpanExtractor.objectSpans(text)).containsExactly(text);
    }

    @Test
    void objectSpans_shouldSkipUnclosedBrace() {
        String text = "note { unfinished ... {\"status\": \"ready_to_resolve\"}";

        assertThat(JsonSpanExtractor.objectSpans(text)).containsExactly("{\"status\": \"ready_to_resolve\"}");
    }

    @Test
    void objectSpans_shouldBeEmptyWithoutBraces() {
        assertThat(JsonSpanExtractor.objectSpans("Could you tell me your name?")).isEmpty();
        assertThat(JsonSpanExtractor.objectSpans("")).isEmpty();
        assertThat(JsonSpanExtractor.objectSpans(null)).isEmpty();
        assertThat(JsonSpanExtractor.objectSpans("closing only }")).isEmpty();
    }
}
