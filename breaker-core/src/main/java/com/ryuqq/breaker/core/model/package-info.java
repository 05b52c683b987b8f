/**
 * 호출 식별자와 윈도우 집계 값 객체.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.model;
