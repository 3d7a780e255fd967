package com.demoBank.bankAssistant.orchestrator.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds JSON object candidates embedded in free text (model output wrapped in prose or markdown).
 *
 * Unlike a greedy first-"{"-to-last-"}" match, each candidate is a balanced span: braces inside
 * string literals are ignored and two adjacent objects are returned separately.
 */
public class JsonSpanExtractor {

    private JsonSpanExtractor() {}

    /**
     * Returns every top-level balanced {...} span in order of appearance.
     * An opening brace that is never closed is skipped and scanning resumes after it.
     *
     * @param text Free text possibly containing JSON objects
     * @return Spans in order; empty list when there are none
     */
    public static List<String> objectSpans(String text) {
        List<String> spans = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return spans;
        }

        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findClosingBrace(text, start);
            if (end < 0) {
                start = text.indexOf('{', start + 1);
            } else {
                spans.add(text.substring(start, end + 1));
                start = text.indexOf('{', end + 1);
            }
        }
        return spans;
    }

    /**
     * @return Index of the brace closing the one at {@code start}, or -1 if it is never closed
     */
    private static int findClosingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
