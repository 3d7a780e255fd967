package com.demoBank.bankAssistant.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one conversation turn: the reply plus what each stage produced on this turn.
 *
 * A stage field is null when the stage was served from the session cache or was not reached.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TurnResult {

    /**
     * User-facing reply for this turn.
     */
    private String reply;

    private String intent;

    private String categories;

    private String selectedCategory;

    /**
     * Raw detail-extraction output, untruncated.
     */
    private String extraction;

    /**
     * True when the resolution stage produced the reply.
     */
    private boolean resolved;
}
