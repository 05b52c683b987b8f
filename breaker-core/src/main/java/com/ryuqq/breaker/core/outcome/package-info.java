/**
 * 호출 결과와 분류 판정.
 *
 * <p>{@link com.ryuqq.breaker.core.outcome.Outcome}은 Ok / Fail / Rejected 세 케이스로 고정된
 * sealed interface입니다. Ok와 Fail만 분류기의 입력이 되며, Rejected는 분류되지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.outcome;
