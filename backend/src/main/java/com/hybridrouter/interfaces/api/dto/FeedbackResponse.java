package com.hybridrouter.interfaces.api.dto;

public record FeedbackResponse(
        boolean accepted,
        boolean duplicate
) {}
