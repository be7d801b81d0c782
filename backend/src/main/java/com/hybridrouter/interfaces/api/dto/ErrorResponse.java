package com.hybridrouter.interfaces.api.dto;

public record ErrorResponse(
        String code,
        String message
) {}
