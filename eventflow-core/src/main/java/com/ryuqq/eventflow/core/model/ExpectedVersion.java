package com.ryuqq.eventflow.core.model;

/**
 * append 시 사용하는 expectedVersion 특수값.
 *
 * <p>0 이상의 값은 "마지막 이벤트 번호가 정확히 이 값"을 의미합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExpectedVersion {

    /** 버전 검사 없음. */
    public static final long ANY = -2L;

    /** 스트림이 없어야 함. */
    public static final long NO_STREAM = -1L;

    /** 비어 있는 스트림 (NO_STREAM과 동일 취급). */
    public static final long EMPTY_STREAM = -1L;

    /** 스트림이 존재해야 함. */
    public static final long STREAM_EXISTS = -4L;

    private ExpectedVersion() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
