package com.demoBank.bankAssistant.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionListResponse {

    @JsonProperty("active_sessions")
    private int activeSessions;

    @JsonProperty("session_ids")
    private List<String> sessionIds;
}
