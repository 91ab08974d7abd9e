package org.dumpsieve.model;

public enum ClauseKind {
    INDEX,
    CONSTRAINT
}
