/**
 * 핸드셰이크 상태 정의.
 *
 * @author HITL Team
 * @since 1.0.0
 */
package com.ryuqq.hitl.core.statemachine;
