package com.autonomous.shellagent.model;

import lombok.Value;

import java.time.Instant;

@Value
public class ConversationMessage {
    String role;     // system | user | assistant
    String content;
    Instant timestamp;
}
