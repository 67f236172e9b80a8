package com.ryuqq.eventflow.core.model;

/**
 * 스트림 이름 Value Object.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StreamName {

    private final String value;

    private StreamName(String value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static StreamName of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return new StreamName(value);
    }

    public String getValue() {
        return value;
    }

    public StreamName withPrefix(String prefix) {
        return new StreamName(prefix + value);
    }

    public StreamName withSuffix(String suffix) {
        return new StreamName(value + suffix);
    }

    public boolean startsWith(String prefix) {
        return value.startsWith(prefix);
    }

    public boolean endsWith(String suffix) {
        return value.endsWith(suffix);
    }

    public StreamName withoutPrefix(String prefix) {
        return startsWith(prefix) ? new StreamName(value.substring(prefix.length())) : this;
    }

    public StreamName withoutSuffix(String suffix) {
        return endsWith(suffix) ? new StreamName(value.substring(0, value.length() - suffix.length())) : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((StreamName) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
