package com.ryuqq.eventflow.core.message;

/**
 * Catch-up 구독이 과거 이벤트 재생을 끝내고 live 전송으로 전환되었음을 알리는 마커.
 *
 * <p>리스너마다 정확히 한 번 발행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CatchupSubscriptionBecameLive extends Message {
}
