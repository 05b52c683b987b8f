/**
 * 주입 가능한 시간 공급자.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.clock;
