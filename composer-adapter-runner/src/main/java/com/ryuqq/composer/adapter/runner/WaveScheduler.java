package com.ryuqq.composer.adapter.runner;

import com.ryuqq.composer.application.assembly.ContentAssembler;
import com.ryuqq.composer.application.orchestrator.ModuleExecution;
import com.ryuqq.composer.application.orchestrator.PipelineOrchestrator;
import com.ryuqq.composer.application.orchestrator.PipelineResult;
import com.ryuqq.composer.application.orchestrator.PipelineRun;
import com.ryuqq.composer.application.registry.ModuleRegistry;
import com.ryuqq.composer.core.contract.ContentModule;
import com.ryuqq.composer.core.contract.ModuleContext;
import com.ryuqq.composer.core.contract.ModuleOutput;
import com.ryuqq.composer.core.exception.ModuleInstantiationException;
import com.ryuqq.composer.core.exception.ModuleTimeoutException;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.plan.DependencyResolver;
import com.ryuqq.composer.core.plan.WavePlan;
import com.ryuqq.composer.core.status.ErrorKind;
import com.ryuqq.composer.core.status.ModuleStatus;
import com.ryuqq.composer.core.status.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wave 단위 파이프라인 스케줄러.
 *
 * <p>{@link PipelineOrchestrator}의 기본 구현체입니다. 선택된 모듈을 wave 계획에 따라
 * 순차 wave로 실행하고, 같은 wave의 모듈은 하나의 고정 크기 worker pool에서 동시에 실행합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * 1. 요청 검증 → 실패 시 REJECTED
 * 2. 선택 집합 밖의 의존성 제거 후 wave 계획 계산
 * 3. wave마다:
 *    a. Shared State 스냅샷을 찍고 모든 모듈을 worker pool에 디스패치 (모듈 타이머 시작)
 *    b. wave barrier: 모든 모듈 완료 대기 (실행 deadline까지)
 *    c. 결과 기록, 성공 모듈의 writes를 Shared State에 적용 (스케줄러 스레드)
 *    d. 필수 모듈 실패 → 이후 wave NOT_RUN, PARTIAL_FAILURE
 * 4. 출력 조립 → PipelineResult
 * </pre>
 *
 * <p><strong>타임아웃:</strong></p>
 * <ul>
 *   <li>모듈 타임아웃은 디스패치 시점부터 측정됩니다. worker를 기다리며 큐에 있던 시간도 포함되므로
 *       다른 실행의 멈춘 모듈이 pool을 점유해도 이 실행은 타임아웃 안에 끝납니다.
 *       만료되면 TIMEOUT으로 기록하고 늦게 도착한 결과는 폐기합니다 (스레드 인터럽트 없음).</li>
 *   <li>실행 타임아웃이 지나면 이후 wave는 디스패치하지 않습니다.
 *       실행 중이던 모듈은 CANCELLED, 디스패치되지 않은 모듈은 NOT_RUN입니다.</li>
 *   <li>barrier 대기 중 호출 스레드가 인터럽트되면 같은 방식으로 CANCELLED 처리하고 인터럽트 상태를 복원합니다.</li>
 * </ul>
 *
 * <p><strong>Shared State 격리:</strong> 모듈은 wave 시작 시점의 불변 스냅샷을 읽습니다.
 * 타임아웃 후에도 계속 도는 모듈이 있어도 이후 wave의 쓰기와 경합하지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> worker pool은 모든 wave와 동시 실행 간에 공유됩니다.
 * 실행별 상태는 {@link PipelineRun}이 소유하므로 실행 간 간섭이 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (WaveScheduler scheduler = new WaveScheduler(registry, new SchedulerConfig().withModuleTimeoutMs(5000))) {
 *     PipelineResult result = scheduler.runPipeline(Map.of("term", "vergunning"));
 * }
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class WaveScheduler implements PipelineOrchestrator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WaveScheduler.class);

    private final ModuleRegistry registry;
    private final DependencyResolver resolver;
    private final SchedulerConfig config;
    private final ContentAssembler assembler;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final AtomicLong runSequence = new AtomicLong();

    private volatile boolean closed;

    /**
     * 생성자 (기본 DependencyResolver).
     *
     * @param registry 모듈 레지스트리
     * @param config 스케줄러 설정
     */
    public WaveScheduler(ModuleRegistry registry, SchedulerConfig config) {
        this(registry, new DependencyResolver(), config);
    }

    /**
     * 생성자.
     *
     * @param registry 모듈 레지스트리
     * @param resolver wave 계획 계산기 (계획 메모이즈 보관)
     * @param config 스케줄러 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public WaveScheduler(ModuleRegistry registry, DependencyResolver resolver, SchedulerConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.registry = registry;
        this.resolver = resolver;
        this.config = config;
        this.assembler = new ContentAssembler(config.includeFailurePlaceholders());
        this.workers = Executors.newFixedThreadPool(config.workerPoolSize(), namedThreads("composer-worker"));
        this.timer = Executors.newSingleThreadScheduledExecutor(namedThreads("composer-timer"));
    }

    @Override
    public PipelineResult runPipeline(Map<String, Object> initialContext) {
        Set<String> all = new TreeSet<>();
        registry.descriptors().forEach(descriptor -> all.add(descriptor.id().getValue()));
        return runPipeline(all, initialContext);
    }

    @Override
    public PipelineResult runPipeline(Set<String> moduleSet, Map<String, Object> initialContext) {
        String runId = "run-" + runSequence.incrementAndGet();

        if (closed) {
            return reject(runId, "scheduler is shut down");
        }
        if (moduleSet == null || moduleSet.isEmpty()) {
            return reject(runId, "module set is empty");
        }

        Set<ModuleId> selected = new TreeSet<>();
        for (String raw : moduleSet) {
            if (!ModuleId.isValid(raw)) {
                return reject(runId, "invalid module id: " + raw);
            }
            ModuleId id = ModuleId.of(raw);
            if (!registry.contains(id)) {
                return reject(runId, "unknown module: " + raw);
            }
            selected.add(id);
        }

        Map<ModuleId, ModuleDescriptor> descriptors = new LinkedHashMap<>();
        for (ModuleId id : selected) {
            descriptors.put(id, registry.descriptor(id).restrictTo(selected));
        }
        WavePlan plan = resolver.resolve(descriptors.values());

        PipelineRun run = new PipelineRun(runId, initialContext, plan.waveCount(), registry.producedKeys());
        log.info("Run {} started: {} modules in {} waves", runId, plan.moduleCount(), plan.waveCount());

        RunStatus status = execute(run, plan, descriptors);
        run.complete(status);

        PipelineResult result = assembler.assemble(run);
        log.info("Run {} finished: status={}, wavesCompleted={}/{}, artifactLength={}, durationMs={}",
            runId, status, run.wavesCompleted(), run.waveCount(),
            result.getMetadata().artifactLength(), result.getMetadata().totalDurationMs());
        return result;
    }

    /**
     * 스케줄러 종료 (graceful).
     *
     * <p>새 요청은 REJECTED로 응답합니다. 실행 중인 모듈은 최대 60초 기다린 뒤 강제 종료합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트된 경우
     */
    public void shutdown() throws InterruptedException {
        closed = true;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(60, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } finally {
            timer.shutdownNow();
        }
        log.info("WaveScheduler shut down");
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    private RunStatus execute(PipelineRun run, WavePlan plan, Map<ModuleId, ModuleDescriptor> descriptors) {
        long deadlineNanos = config.runTimeoutMs() > 0
            ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.runTimeoutMs())
            : Long.MAX_VALUE;

        RunStatus status = RunStatus.COMPLETE;
        for (int wave = 0; wave < plan.waveCount(); wave++) {
            List<ModuleId> ids = plan.waves().get(wave);

            if (status == RunStatus.COMPLETE && deadlinePassed(deadlineNanos)) {
                log.warn("{} before wave {}", runTimeoutReason(run), wave);
                status = RunStatus.CANCELLED;
            }
            if (status != RunStatus.COMPLETE) {
                for (ModuleId id : ids) {
                    run.record(notRun(descriptors.get(id), wave));
                }
                continue;
            }

            WaveOutcome outcome = runWave(run, wave, ids, descriptors, deadlineNanos);
            if (outcome == WaveOutcome.CANCELLED) {
                status = RunStatus.CANCELLED;
            } else {
                run.markWaveCompleted();
                if (outcome == WaveOutcome.REQUIRED_FAILED) {
                    status = RunStatus.PARTIAL_FAILURE;
                }
            }
        }
        return status;
    }

    private WaveOutcome runWave(PipelineRun run, int wave, List<ModuleId> ids,
                                Map<ModuleId, ModuleDescriptor> descriptors, long deadlineNanos) {
        log.debug("Run {} dispatching wave {}: {}", run.runId(), wave, ids);

        Map<StateKey, Object> visible = run.sharedState().snapshot();
        List<Attempt> attempts = new ArrayList<>(ids.size());
        for (ModuleId id : ids) {
            Attempt attempt = new Attempt(descriptors.get(id), wave);
            attempts.add(attempt);
            try {
                armTimeout(attempt);
                workers.execute(() -> runModule(run, attempt, visible));
            } catch (RejectedExecutionException e) {
                attempt.result.complete(Completion.cancelled("scheduler is shut down"));
            }
        }

        String reason = awaitBarrier(run, wave, attempts, deadlineNanos);
        boolean cancelled = reason != null;
        if (cancelled) {
            for (Attempt attempt : attempts) {
                attempt.result.complete(attempt.started
                    ? Completion.cancelled(reason)
                    : Completion.notStarted());
            }
            log.warn("Run {} cancelled during wave {}: {}", run.runId(), wave, reason);
        }

        boolean requiredFailed = false;
        for (Attempt attempt : attempts) {
            ModuleExecution execution = settle(run, attempt);
            run.record(execution);
            if (execution.status().isFailure()) {
                log.warn("Module {} in run {} ended {} ({}): {}", execution.moduleId(), run.runId(),
                    execution.status(), execution.errorKind(), execution.errorMessage());
                if (attempt.descriptor.required()) {
                    requiredFailed = true;
                }
            }
        }

        if (cancelled) {
            return WaveOutcome.CANCELLED;
        }
        if (requiredFailed) {
            log.warn("Run {} stops after wave {}: required module failed", run.runId(), wave);
            return WaveOutcome.REQUIRED_FAILED;
        }
        return WaveOutcome.COMPLETED;
    }

    /**
     * wave barrier.
     *
     * @return 모든 모듈이 끝났으면 null, 아니면 취소 사유 (실행 타임아웃 또는 인터럽트)
     */
    private String awaitBarrier(PipelineRun run, int wave, List<Attempt> attempts, long deadlineNanos) {
        CompletableFuture<?>[] futures = attempts.stream()
            .map(attempt -> attempt.result)
            .toArray(CompletableFuture[]::new);
        CompletableFuture<Void> all = CompletableFuture.allOf(futures);
        try {
            if (deadlineNanos == Long.MAX_VALUE) {
                all.get();
            } else {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    return all.isDone() ? null : runTimeoutReason(run);
                }
                all.get(remaining, TimeUnit.NANOSECONDS);
            }
            return null;
        } catch (TimeoutException e) {
            return runTimeoutReason(run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Run " + run.runId() + " interrupted while waiting for wave " + wave;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Module completions never fail exceptionally", e);
        }
    }

    /**
     * 모듈 타이머 시작 (디스패치 시점). 완료 결과가 먼저 채택되면 타이머는 취소됩니다.
     */
    private void armTimeout(Attempt attempt) {
        ModuleId id = attempt.descriptor.id();
        long timeoutMs = config.effectiveModuleTimeoutMs(attempt.descriptor.timeoutMs());
        if (timeoutMs <= 0) {
            return;
        }
        ScheduledFuture<?> expiry = timer.schedule(
            () -> attempt.result.complete(Completion.timeout(new ModuleTimeoutException(id, timeoutMs))),
            timeoutMs, TimeUnit.MILLISECONDS);
        attempt.result.whenComplete((completion, error) -> expiry.cancel(false));
    }

    /**
     * worker 스레드에서 모듈 하나 실행.
     */
    private void runModule(PipelineRun run, Attempt attempt, Map<StateKey, Object> visible) {
        if (attempt.result.isDone()) {
            return;
        }
        ModuleDescriptor descriptor = attempt.descriptor;
        ModuleId id = descriptor.id();
        attempt.startedNanos = System.nanoTime();
        attempt.started = true;

        Completion completion;
        try {
            ContentModule module = registry.instance(id);
            ModuleContext context = new ModuleContext(run.runId(), descriptor, visible, run.initialContext());
            Optional<String> unmet = module.precondition(context);
            if (unmet.isPresent()) {
                completion = Completion.skipped(unmet.get());
            } else {
                ModuleOutput output = module.execute(context);
                completion = output == null
                    ? Completion.failed(ErrorKind.MODULE_EXECUTION_ERROR, "module returned no output")
                    : Completion.of(output);
            }
        } catch (ModuleInstantiationException e) {
            completion = Completion.failed(ErrorKind.INSTANTIATION_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Module {} threw in run {}", id, run.runId(), e);
            completion = Completion.failed(ErrorKind.MODULE_EXECUTION_ERROR, describe(e));
        } catch (Error e) {
            attempt.result.complete(Completion.failed(ErrorKind.MODULE_EXECUTION_ERROR, describe(e)));
            throw e;
        }

        if (!attempt.result.complete(completion)) {
            log.debug("Late result of module {} in run {} discarded", id, run.runId());
        }
    }

    /**
     * 완료 결과를 실행 기록으로 변환하고, 성공 모듈의 writes를 적용 (스케줄러 스레드).
     */
    private ModuleExecution settle(PipelineRun run, Attempt attempt) {
        ModuleDescriptor descriptor = attempt.descriptor;
        ModuleId id = descriptor.id();
        int order = registry.registrationOrder(id);
        Completion completion = attempt.result.join();
        long durationMs = TimeUnit.NANOSECONDS.toMillis(
            completion.finishedNanos - (attempt.started ? attempt.startedNanos : attempt.dispatchedNanos));

        switch (completion.status) {
            case NOT_RUN:
                return ModuleExecution.notRun(id, descriptor.priority(), attempt.wave, order);
            case SKIPPED:
                log.debug("Module {} skipped in run {}: {}", id, run.runId(), completion.message);
                return ModuleExecution.skipped(id, descriptor.priority(), attempt.wave, order, completion.message);
            case SUCCESS:
                break;
            default:
                return ModuleExecution.failed(id, descriptor.priority(), attempt.wave, order,
                    completion.status, completion.errorKind, completion.message, durationMs);
        }

        ModuleOutput output = completion.output;
        if (!output.isSuccess()) {
            return ModuleExecution.failed(id, descriptor.priority(), attempt.wave, order,
                ModuleStatus.FAILURE, ErrorKind.MODULE_EXECUTION_ERROR, output.errorMessage(), durationMs,
                output.metadata());
        }

        for (Map.Entry<StateKey, Object> write : output.writes().entrySet()) {
            if (!descriptor.producesKey(write.getKey())) {
                return ModuleExecution.failed(id, descriptor.priority(), attempt.wave, order,
                    ModuleStatus.FAILURE, ErrorKind.UNDECLARED_WRITE,
                    "write to undeclared key '" + write.getKey() + "'", durationMs);
            }
            if (write.getValue() == null) {
                return ModuleExecution.failed(id, descriptor.priority(), attempt.wave, order,
                    ModuleStatus.FAILURE, ErrorKind.MODULE_EXECUTION_ERROR,
                    "null value written to key '" + write.getKey() + "'", durationMs);
            }
        }
        output.writes().forEach((key, value) -> run.sharedState().set(key, value));

        return ModuleExecution.success(id, descriptor.priority(), attempt.wave, order, durationMs,
            output.content(), output.metadata());
    }

    private String runTimeoutReason(PipelineRun run) {
        return "Run " + run.runId() + " exceeded run timeout of " + config.runTimeoutMs() + "ms";
    }

    private static boolean deadlinePassed(long deadlineNanos) {
        return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
    }

    private ModuleExecution notRun(ModuleDescriptor descriptor, int wave) {
        return ModuleExecution.notRun(descriptor.id(), descriptor.priority(), wave,
            registry.registrationOrder(descriptor.id()));
    }

    private PipelineResult reject(String runId, String reason) {
        log.warn("Run {} rejected: {}", runId, reason);
        return PipelineResult.rejected(runId, reason);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private enum WaveOutcome {
        COMPLETED,
        REQUIRED_FAILED,
        CANCELLED
    }

    /**
     * 디스패치된 모듈 하나의 진행 상태.
     */
    private static final class Attempt {
        private final ModuleDescriptor descriptor;
        private final int wave;
        private final CompletableFuture<Completion> result = new CompletableFuture<>();
        private final long dispatchedNanos = System.nanoTime();
        private volatile boolean started;
        private volatile long startedNanos;

        private Attempt(ModuleDescriptor descriptor, int wave) {
            this.descriptor = descriptor;
            this.wave = wave;
        }
    }

    /**
     * 모듈 완료 결과. 먼저 도착한 하나만 채택됩니다 (정상 완료, 타임아웃, 취소).
     */
    private static final class Completion {
        private final ModuleStatus status;
        private final ErrorKind errorKind;
        private final String message;
        private final ModuleOutput output;
        private final long finishedNanos = System.nanoTime();

        private Completion(ModuleStatus status, ErrorKind errorKind, String message, ModuleOutput output) {
            this.status = status;
            this.errorKind = errorKind;
            this.message = message;
            this.output = output;
        }

        static Completion of(ModuleOutput output) {
            return new Completion(ModuleStatus.SUCCESS, null, null, output);
        }

        static Completion failed(ErrorKind errorKind, String message) {
            return new Completion(ModuleStatus.FAILURE, errorKind, message, null);
        }

        static Completion timeout(ModuleTimeoutException cause) {
            return new Completion(ModuleStatus.TIMEOUT, ErrorKind.TIMEOUT, cause.getMessage(), null);
        }

        static Completion skipped(String reason) {
            return new Completion(ModuleStatus.SKIPPED, null, reason, null);
        }

        static Completion cancelled(String reason) {
            return new Completion(ModuleStatus.CANCELLED, ErrorKind.CANCELLED, reason, null);
        }

        static Completion notStarted() {
            return new Completion(ModuleStatus.NOT_RUN, null, null, null);
        }
    }
}
