package com.seorag.inference;

public enum AnswerStatus {
    ANSWERED(false),
    NO_EVIDENCE(false),
    OFF_TOPIC(false),
    INDEX_NOT_READY(true),
    UPSTREAM_ERROR(true);

    private final boolean retryable;

    AnswerStatus(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
