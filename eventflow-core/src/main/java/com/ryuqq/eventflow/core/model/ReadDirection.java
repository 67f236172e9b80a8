package com.ryuqq.eventflow.core.model;

/**
 * 읽기 방향.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ReadDirection {
    FORWARD,
    BACKWARD
}
