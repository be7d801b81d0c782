package com.hybridrouter.infrastructure.evaluation;

public class FeedbackPayloadException extends RuntimeException {

    public FeedbackPayloadException(String message) {
        super(message);
    }

    public FeedbackPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
