/**
 * 시간 기반 슬라이딩 윈도우 집계.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.engine.window;
