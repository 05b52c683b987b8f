package com.ryuqq.breaker.core.event;

/**
 * 전이 이벤트 심각도.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR
}
