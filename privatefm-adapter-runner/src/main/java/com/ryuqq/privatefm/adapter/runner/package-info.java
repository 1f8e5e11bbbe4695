/**
 * Runner Adapter Layer - 백그라운드 워커와 주기 작업.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.privatefm.adapter.runner.QueueWorkerRunner} - merge/fallback/adapter reset 큐 소비</li>
 *   <li>{@link com.ryuqq.privatefm.adapter.runner.NightlyMergeSweep} - 야간 정기 Merge 트리거</li>
 *   <li>{@link com.ryuqq.privatefm.adapter.runner.HealthCheckSweep} - 건강 검사와 Fallback 시작</li>
 *   <li>{@link com.ryuqq.privatefm.adapter.runner.CleanupSweep} - 오래된 작업/이벤트/체크포인트 정리</li>
 *   <li>{@link com.ryuqq.privatefm.adapter.runner.SupervisedLoop} - 실패 시 backoff 후 재시작하는 루프</li>
 *   <li>{@link com.ryuqq.privatefm.adapter.runner.OrchestratorScheduler} - 모든 루프의 시작/종료</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (QueueWorkerRunner, Sweeps, Scheduler)
 *   ↓ implements
 * application (Runtime, coordinators)
 *   ↓ depends on
 * core (model, statemachine, Outcome, SPI)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.privatefm.adapter.runner;
