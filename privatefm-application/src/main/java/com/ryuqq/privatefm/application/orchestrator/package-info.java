/**
 * Private FM Orchestrator Application Layer - Namespace 관리 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.privatefm.application.orchestrator.NamespaceOrchestrator} - 관리 API</li>
 *   <li>{@link com.ryuqq.privatefm.application.orchestrator.DefaultNamespaceOrchestrator} - 서비스 위임 구현</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 외부 협력자는 core 모듈의 SPI로만 접근</li>
 *   <li><strong>명시적 컨텍스트:</strong> 모든 서비스는 {@code OrchestratorContext}를 생성자로 전달받음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.privatefm.application.orchestrator;
