package com.demoBank.bankAssistant.session.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulated state of one customer conversation.
 *
 * The cached stage outputs (interpreted intent, suggested categories, selected category) are
 * write-once: setting one that is already present is a programming error. Context data is only
 * ever merged into, never cleared. Histories are append-only.
 *
 * Not thread-safe on its own; callers mutate it while holding {@link #getTurnLock()}.
 */
public class SessionState {

    public static final String GREETING = "Hello! I'm your banking assistant. How can I help you today?";

    @Getter
    private final String sessionId;

    private final List<ChatMessage> messageHistory = new ArrayList<>();

    private final List<String> turnHistory = new ArrayList<>();

    @Getter
    private String interpretedIntent;

    @Getter
    private String suggestedCategories;

    @Getter
    private String selectedCategory;

    private final Map<String, Object> contextData = new LinkedHashMap<>();

    /**
     * Serializes turns for this session so concurrent requests queue instead of interleaving.
     */
    @Getter
    private final ReentrantLock turnLock = new ReentrantLock();

    public SessionState(String sessionId) {
        this.sessionId = sessionId;
        this.messageHistory.add(ChatMessage.assistant(GREETING));
    }

    public List<ChatMessage> getMessageHistory() {
        return Collections.unmodifiableList(messageHistory);
    }

    public List<String> getTurnHistory() {
        return Collections.unmodifiableList(turnHistory);
    }

    public Map<String, Object> getContextData() {
        return Collections.unmodifiableMap(contextData);
    }

    public int getMessageCount() {
        return messageHistory.size();
    }

    public void addMessage(ChatMessage message) {
        messageHistory.add(message);
    }

    public void addTurn(String userInput) {
        turnHistory.add(userInput);
    }

    /**
     * All turn inputs so far, in order, one per line.
     */
    public String getCumulativeHistory() {
        return String.join("\n", turnHistory);
    }

    public boolean hasInterpretedIntent() {
        return interpretedIntent != null;
    }

    public boolean hasSuggestedCategories() {
        return suggestedCategories != null;
    }

    public boolean isCategoryLocked() {
        return selectedCategory != null;
    }

    public void setInterpretedIntent(String interpretedIntent) {
        requireUnset(this.interpretedIntent, "interpretedIntent");
        this.interpretedIntent = interpretedIntent;
    }

    public void setSuggestedCategories(String suggestedCategories) {
        requireUnset(this.suggestedCategories, "suggestedCategories");
        this.suggestedCategories = suggestedCategories;
    }

    /**
     * Locks the category for the rest of the session and starts an empty context.
     */
    public void lockCategory(String selectedCategory) {
        requireUnset(this.selectedCategory, "selectedCategory");
        this.selectedCategory = selectedCategory;
        this.contextData.clear();
    }

    /**
     * Merges newly extracted fields into the context; existing keys are overwritten, none removed.
     */
    public void mergeContextData(Map<String, ?> extracted) {
        if (extracted != null) {
            contextData.putAll(extracted);
        }
    }

    private static void requireUnset(String current, String field) {
        if (current != null) {
            throw new IllegalStateException(field + " is already set for this session");
        }
    }
}
