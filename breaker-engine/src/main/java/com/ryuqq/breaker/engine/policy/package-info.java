/**
 * BreakDuration 정책.
 *
 * <ul>
 *   <li>{@link com.ryuqq.breaker.engine.policy.FixedBreakDurationPolicy} - 고정값</li>
 *   <li>{@link com.ryuqq.breaker.engine.policy.DynamicBreakDurationPolicy} - 생성기 + 기본값 대체</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.engine.policy;
