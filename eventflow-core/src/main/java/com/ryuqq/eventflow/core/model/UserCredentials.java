package com.ryuqq.eventflow.core.model;

/**
 * 스트림 스토어 사용자 자격 증명.
 *
 * @param username 사용자명
 * @param password 비밀번호
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record UserCredentials(String username, String password) {

    public UserCredentials {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username cannot be null or blank");
        }
        if (password == null) {
            throw new IllegalArgumentException("password cannot be null");
        }
    }

    @Override
    public String toString() {
        return "UserCredentials{username=" + username + "}";
    }
}
