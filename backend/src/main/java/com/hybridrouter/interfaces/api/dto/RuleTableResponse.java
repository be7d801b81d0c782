package com.hybridrouter.interfaces.api.dto;

import com.hybridrouter.infrastructure.routing.RuleTable;

import java.time.Instant;

public record RuleTableResponse(
        long version,
        int rules,
        String location,
        Instant loadedAt
) {
    public static RuleTableResponse from(RuleTable table) {
        return new RuleTableResponse(table.version(), table.rules().size(), table.location(), table.loadedAt());
    }
}
