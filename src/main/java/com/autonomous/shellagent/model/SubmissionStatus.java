package com.autonomous.shellagent.model;

public enum SubmissionStatus {
    ACCEPTED,
    BUSY,
    DUPLICATE,
    NO_ACTIONS
}
