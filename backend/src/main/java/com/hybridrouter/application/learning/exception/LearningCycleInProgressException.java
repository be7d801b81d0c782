package com.hybridrouter.application.learning.exception;

public class LearningCycleInProgressException extends RuntimeException {

    public LearningCycleInProgressException() {
        super("A learning cycle is already running");
    }
}
