package com.demoBank.bankAssistant.orchestrator.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fixed set of banking service categories offered to the model in the categorization stages.
 * Model output is not validated against this list; the labels only shape the prompts.
 */
public enum ServiceCategory {

    ACCOUNT_OPENING("Account Opening"),
    BILLING_ISSUE("Billing Issue"),
    ACCOUNT_ACCESS("Account Access"),
    TRANSACTION_INQUIRY("Transaction Inquiry"),
    CARD_SERVICES("Card Services"),
    ACCOUNT_STATEMENT("Account Statement"),
    LOAN_INQUIRY("Loan Inquiry"),
    GENERAL_INFORMATION("General Information");

    private final String label;

    ServiceCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Case-insensitive lookup by display label.
     */
    public static Optional<ServiceCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim();
        return Arrays.stream(values())
                .filter(category -> category.label.equalsIgnoreCase(normalized))
                .findFirst();
    }

    /**
     * All labels as a bulleted list, one per line.
     */
    public static String asPromptList() {
        return Arrays.stream(values())
                .map(category -> "- " + category.label)
                .collect(Collectors.joining("\n"));
    }
}
