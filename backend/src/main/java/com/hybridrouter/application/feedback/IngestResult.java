package com.hybridrouter.application.feedback;

public record IngestResult(
        boolean accepted,
        boolean duplicate
) {}
