/**
 * 메시지 모델.
 *
 * <p>모든 버스/큐/Command 프로토콜이 주고받는 메시지 타입을 정의합니다.</p>
 *
 * <h2>계층</h2>
 * <pre>
 * Message
 *   ├─ Event                      (사실, correlated)
 *   ├─ Command                    (요청, correlated, 취소 가능)
 *   ├─ CommandResponse (sealed)
 *   │    ├─ Success
 *   │    └─ Fail
 *   │         └─ Canceled
 *   ├─ AckCommand
 *   ├─ CommandTimeout
 *   │    ├─ AckTimeout
 *   │    └─ CompletionTimeout
 *   ├─ DelaySendEnvelope
 *   └─ CatchupSubscriptionBecameLive
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.core.message;
