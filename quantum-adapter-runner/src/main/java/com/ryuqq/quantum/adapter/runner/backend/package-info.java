/**
 * {@link com.ryuqq.quantum.application.backend.ExecutionBackend} 구현체.
 *
 * <table>
 *   <caption>백엔드별 실행 방식</caption>
 *   <tr><th>백엔드</th><th>실행 위치</th><th>종료 시 해제</th></tr>
 *   <tr><td>DedicatedThreadBackend</td><td>전용 스레드</td><td>스레드 종료 대기</td></tr>
 *   <tr><td>ExecutorBackend (owned)</td><td>전용 풀</td><td>shutdown + 종료 대기</td></tr>
 *   <tr><td>ExecutorBackend (shared)</td><td>공유/호출자 Executor</td><td>없음</td></tr>
 *   <tr><td>ExecutorBackend (inline)</td><td>제출 스레드</td><td>없음</td></tr>
 *   <tr><td>CooperativeBackend</td><td>호스트 루프</td><td>없음</td></tr>
 * </table>
 *
 * @author Quantum Team
 * @since 1.0.0
 */
package com.ryuqq.quantum.adapter.runner.backend;
