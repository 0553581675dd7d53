package com.overseer.core.model;

public enum MessageKind {
    DIRECTIVE,
    REPORT,
    QUESTION,
    ANSWER,
    NOTIFICATION
}
