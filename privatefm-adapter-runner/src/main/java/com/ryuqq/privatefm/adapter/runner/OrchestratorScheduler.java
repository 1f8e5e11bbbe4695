package com.ryuqq.privatefm.adapter.runner;

import com.ryuqq.privatefm.application.context.OrchestratorServices;
import com.ryuqq.privatefm.application.metrics.OrchestratorMetrics;
import com.ryuqq.privatefm.core.retry.BackoffCalculator;
import com.ryuqq.privatefm.core.retry.Sleeper;
import com.ryuqq.privatefm.core.spi.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 큐 워커와 주기 작업을 감독 루프로 묶어 시작/종료.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>{@link QueueNames#ALL}의 각 큐마다 workersPerQueue개의 {@link QueueWorkerRunner} 루프</li>
 *   <li>활성화된 {@link Sweep}마다 하나의 루프 (실행 후 interval 대기)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OrchestratorScheduler scheduler = OrchestratorScheduler.create(services, env);
 * scheduler.start();
 * ...
 * scheduler.stop();
 * </pre>
 *
 * <p>stop은 주기 작업 fan-out executor까지 종료하므로 한 번 멈춘 스케줄러는 다시 시작할 수 없습니다.
 * 재시작이 필요하면 새 인스턴스를 생성합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OrchestratorScheduler {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorScheduler.class);

    private final OrchestratorServices services;
    private final SchedulerConfig config;
    private final QueueWorkerConfig workerConfig;
    private final List<Sweep> sweeps;
    private final ExecutorService sweepExecutor;
    private final Sleeper sleeper;

    private final List<SupervisedLoop> loops = new ArrayList<>();
    private ExecutorService loopExecutor;
    private boolean stopped;

    /**
     * 생성자.
     *
     * @param services 서비스 묶음
     * @param config 스케줄러 설정
     * @param workerConfig 큐 워커 설정
     * @param sweeps 주기 작업 (비활성화된 작업은 루프를 만들지 않음)
     * @param sweepExecutor 주기 작업 fan-out용 executor (stop 시 함께 종료)
     * @param sleeper 유휴/재시작 대기
     */
    public OrchestratorScheduler(
        OrchestratorServices services,
        SchedulerConfig config,
        QueueWorkerConfig workerConfig,
        List<Sweep> sweeps,
        ExecutorService sweepExecutor,
        Sleeper sleeper
    ) {
        if (services == null || config == null || workerConfig == null || sweeps == null
            || sweepExecutor == null || sleeper == null) {
            throw new IllegalArgumentException("scheduler dependencies cannot be null");
        }
        this.services = services;
        this.config = config;
        this.workerConfig = workerConfig;
        this.sweeps = List.copyOf(sweeps);
        this.sweepExecutor = sweepExecutor;
        this.sleeper = sleeper;
    }

    /**
     * 기본 구성으로 생성 (세 가지 주기 작업, 환경 변수 설정).
     *
     * @param services 서비스 묶음
     * @param env 환경 변수 맵 (보통 {@code System.getenv()})
     */
    public static OrchestratorScheduler create(OrchestratorServices services, Map<String, String> env) {
        SchedulerConfig config = new SchedulerConfig();
        ExecutorService sweepExecutor = Executors.newFixedThreadPool(config.sweepParallelism());
        JobStatsRecorder recorder = new JobStatsRecorder(services.context().checkpointStore(),
            services.context().clock(), services.context().config().jobStatsRetention());
        List<Sweep> sweeps = List.of(
            new NightlyMergeSweep(services, NightlyMergeConfig.fromEnvironment(env), sweepExecutor, recorder),
            new HealthCheckSweep(services, HealthCheckConfig.fromEnvironment(env), recorder),
            new CleanupSweep(services.context(), CleanupConfig.fromEnvironment(env), recorder)
        );
        return new OrchestratorScheduler(services, config, new QueueWorkerConfig(), sweeps, sweepExecutor, Sleeper.SYSTEM);
    }

    /**
     * 모든 루프 시작.
     *
     * @throws IllegalStateException 이미 실행 중이거나 종료된 경우
     */
    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("Scheduler was stopped and cannot be restarted");
        }
        if (loopExecutor != null) {
            throw new IllegalStateException("Scheduler already started");
        }
        OrchestratorMetrics metrics = services.context().metrics();
        BackoffCalculator restartBackoff = new BackoffCalculator(
            config.restartBackoffBaseMs(), config.restartBackoffMaxMs(), 0.1);

        for (String queue : QueueNames.ALL) {
            for (int i = 0; i < workerConfig.workersPerQueue(); i++) {
                QueueWorkerRunner runner = QueueWorkerRunner.forQueue(services, queue, workerConfig);
                loops.add(new SupervisedLoop(queue + "-worker-" + i, runner::pump,
                    workerConfig.idleDelayMs(), restartBackoff, sleeper, metrics));
            }
        }
        for (Sweep sweep : sweeps) {
            if (!sweep.enabled()) {
                log.info("Sweep disabled, not scheduled: {}", sweep.jobName());
                continue;
            }
            loops.add(new SupervisedLoop(sweep.jobName(), () -> {
                sweep.run();
                return false;
            }, sweep.interval().toMillis(), restartBackoff, sleeper, metrics));
        }

        loopExecutor = Executors.newFixedThreadPool(loops.size());
        loops.forEach(loopExecutor::execute);
        log.info("Scheduler started: loops={}", loops.size());
    }

    /**
     * 모든 루프 종료 후 shutdownTimeout까지 대기.
     *
     * @return 제한 시간 안에 모두 종료되었으면 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public synchronized boolean stop() throws InterruptedException {
        if (loopExecutor == null) {
            return true;
        }
        stopped = true;
        loops.forEach(SupervisedLoop::stop);
        loopExecutor.shutdownNow();
        sweepExecutor.shutdownNow();
        long timeoutMs = config.shutdownTimeout().toMillis();
        boolean terminated = loopExecutor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)
            && sweepExecutor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler stopped: terminated={}", terminated);
        loopExecutor = null;
        loops.clear();
        return terminated;
    }

    public synchronized boolean isRunning() {
        return loopExecutor != null;
    }

    /**
     * 현재 루프 목록 (실행 중이 아니면 빈 목록).
     */
    public synchronized List<SupervisedLoop> loops() {
        return List.copyOf(loops);
    }
}
