/**
 * 결과 분류 확장점.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.classifier;
