/**
 * 테스트용 시계.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.testkit.clock;
