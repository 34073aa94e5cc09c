package com.merlt.orchestrator.feedback;

public enum FeedbackRejection {
    DUPLICATE_FEEDBACK,
    UNKNOWN_USER,
    INVALID_RECORD,
    PROCESSING_ERROR
}
