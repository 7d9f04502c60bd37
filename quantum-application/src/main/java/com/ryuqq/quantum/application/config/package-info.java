/**
 * 인스턴스 설정과 프로세스 기본값.
 *
 * @author Quantum Team
 * @since 1.0.0
 */
package com.ryuqq.quantum.application.config;
