package com.autonomous.shellagent.model;

public enum ActionKind {
    RUN_COMMAND,
    SEND_KEYS,
    WAIT
}
