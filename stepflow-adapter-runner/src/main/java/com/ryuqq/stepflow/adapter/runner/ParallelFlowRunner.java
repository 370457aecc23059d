package com.ryuqq.stepflow.adapter.runner;

import com.ryuqq.stepflow.application.flow.Flow;
import com.ryuqq.stepflow.application.flow.FlowRunner;
import com.ryuqq.stepflow.application.flow.RunHandle;
import com.ryuqq.stepflow.core.artifact.ArtifactScope;
import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.error.EmptyForeachException;
import com.ryuqq.stepflow.core.error.RunInitializationException;
import com.ryuqq.stepflow.core.error.StepExecutionException;
import com.ryuqq.stepflow.core.error.StepflowException;
import com.ryuqq.stepflow.core.graph.StepDefinition;
import com.ryuqq.stepflow.core.graph.StepGraph;
import com.ryuqq.stepflow.core.graph.StepKind;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.model.RunParameters;
import com.ryuqq.stepflow.core.outcome.Failed;
import com.ryuqq.stepflow.core.outcome.RunOutcome;
import com.ryuqq.stepflow.core.outcome.Succeeded;
import com.ryuqq.stepflow.core.spi.ArtifactStore;
import com.ryuqq.stepflow.core.spi.DirectStepInvoker;
import com.ryuqq.stepflow.core.spi.RunStore;
import com.ryuqq.stepflow.core.spi.StepInvoker;
import com.ryuqq.stepflow.core.spi.StepRecord;
import com.ryuqq.stepflow.core.statemachine.RunState;
import com.ryuqq.stepflow.core.statemachine.StepState;
import com.ryuqq.stepflow.core.step.BranchInput;
import com.ryuqq.stepflow.core.step.JoinContext;
import com.ryuqq.stepflow.core.step.StepContext;
import com.ryuqq.stepflow.core.step.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 병렬 Flow 실행기.
 *
 * <p>step 그래프를 start부터 따라가며 실행하고, split에서는 branch를 worker pool에 병렬로 펼친 뒤
 * 대응 join에서 다시 모읍니다. 모든 step은 {@link CompletableFuture}로 연결되므로 join을 기다리는
 * 동안 worker 스레드를 점유하지 않습니다 (branch 수가 concurrency보다 커도 교착 없음).</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(flow, parameters)
 *   ↓
 * RunStore.begin → RUNNING → RunInitializer (seed Artifact)
 *   ↓
 * runFrom(start):
 *   LINEAR        → body → ArtifactStore.write → successor
 *   SPLIT_STATIC  → body → branch N개 (copy-on-branch) ─┐
 *   SPLIT_FOREACH → body → branch K개 (원소 하나씩)    ─┤
 *                                                      ▼
 *                              JoinBarrier(width) → join body → successor
 *   end step      → Succeeded(최종 Artifact)
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>body 예외는 {@link StepExecutionException}으로 감싸 step 이름/branch 경로 기록
 *       (MergeConflict, EmptyForeach 등 {@link StepflowException}은 그대로)</li>
 *   <li>첫 실패가 Run의 원인으로 보고되고, 이후 새 step은 시작되지 않음</li>
 *   <li>이미 실행 중인 형제 branch는 끝까지 실행되지만 결과는 버려짐</li>
 *   <li>실패한 branch가 있는 join은 실행되지 않음</li>
 * </ul>
 *
 * <p><strong>Artifact 흐름:</strong> 각 step이 만든 Artifact는 (run, branch 경로, step) scope로
 * {@link ArtifactStore}에 기록되고, successor는 상속 Artifact 위에 그 scope를 덮어쓴 값을 봅니다.
 * join 이후에는 join body가 반환한 Artifact만 보입니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class ParallelFlowRunner implements FlowRunner {

    private static final Logger log = LoggerFactory.getLogger(ParallelFlowRunner.class);

    private final ArtifactStore artifactStore;
    private final RunStore runStore;
    private final StepInvoker stepInvoker;
    private final FlowRunnerConfig config;
    private final ExecutorService workers;

    /**
     * 생성자 (기본 StepInvoker, 기본 설정).
     *
     * @param artifactStore Artifact 저장소
     * @param runStore Run 상태 저장소
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ParallelFlowRunner(ArtifactStore artifactStore, RunStore runStore) {
        this(artifactStore, runStore, DirectStepInvoker.getInstance(), new FlowRunnerConfig());
    }

    /**
     * 생성자 (커스텀 StepInvoker, 설정 주입).
     *
     * @param artifactStore Artifact 저장소
     * @param runStore Run 상태 저장소
     * @param stepInvoker step body 실행 기반
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ParallelFlowRunner(ArtifactStore artifactStore, RunStore runStore,
                              StepInvoker stepInvoker, FlowRunnerConfig config) {
        if (artifactStore == null) {
            throw new IllegalArgumentException("artifactStore cannot be null");
        }
        if (runStore == null) {
            throw new IllegalArgumentException("runStore cannot be null");
        }
        if (stepInvoker == null) {
            throw new IllegalArgumentException("stepInvoker cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.artifactStore = artifactStore;
        this.runStore = runStore;
        this.stepInvoker = stepInvoker;
        this.config = config;
        this.workers = Executors.newFixedThreadPool(config.concurrency(), new WorkerThreadFactory());
    }

    @Override
    public RunHandle submit(Flow flow, RunParameters parameters) {
        if (flow == null) {
            throw new IllegalArgumentException("flow cannot be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        if (workers.isShutdown()) {
            throw new IllegalStateException("Runner has been shut down");
        }

        RunId runId = RunId.generate();
        runStore.begin(runId, parameters);
        RunExecution execution = new RunExecution(runId, flow, parameters);
        return RunHandle.of(runId, execution.start());
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>진행 중인 step이 끝나도록 shutdownTimeoutMs 동안 기다린 뒤 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Workers did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            workers.shutdownNow();
        }
    }

    public FlowRunnerConfig getConfig() {
        return config;
    }

    /**
     * Run 한 번의 실행 상태.
     */
    private final class RunExecution {

        private final RunId runId;
        private final Flow flow;
        private final StepGraph graph;
        private final RunParameters parameters;
        private final AtomicBoolean aborted = new AtomicBoolean();
        private final AtomicReference<StepflowException> firstFailure = new AtomicReference<>();

        private RunExecution(RunId runId, Flow flow, RunParameters parameters) {
            this.runId = runId;
            this.flow = flow;
            this.graph = flow.graph();
            this.parameters = parameters;
        }

        CompletableFuture<RunOutcome> start() {
            runStore.transition(runId, RunState.RUNNING);
            log.info("Run {} started: flow={}, steps={}", runId.getValue(), flow.name(), graph.size());

            CompletableFuture<Artifacts> seed;
            try {
                seed = CompletableFuture.supplyAsync(this::initialize, workers);
            } catch (RejectedExecutionException e) {
                seed = CompletableFuture.failedFuture(
                    fail(new RunInitializationException("Runner rejected run " + runId.getValue(), e)));
            }
            return seed
                .thenCompose(artifacts -> runFrom(graph.start().name(),
                    new BranchState(BranchPath.root(), artifacts, null, null)))
                .handle(this::finish);
        }

        private Artifacts initialize() {
            try {
                Artifacts seed = flow.initializer().initialize(runId, parameters);
                if (seed == null) {
                    throw new RunInitializationException("Run initializer returned null artifacts");
                }
                log.debug("Run {} initialized with artifacts {}", runId.getValue(), seed.names());
                return seed;
            } catch (RunInitializationException e) {
                throw new CompletionException(fail(e));
            } catch (Exception e) {
                throw new CompletionException(
                    fail(new RunInitializationException("Run initialization failed: " + e.getMessage(), e)));
            }
        }

        private RunOutcome finish(Arrival arrival, Throwable error) {
            if (error == null && arrival.isEnd()) {
                runStore.transition(runId, RunState.SUCCEEDED);
                log.info("Run {} succeeded: flow={}, artifacts={}",
                    runId.getValue(), flow.name(), arrival.state().artifacts().names());
                return new Succeeded(runId, arrival.state().artifacts());
            }

            StepflowException cause = firstFailure.get();
            if (cause == null) {
                Throwable root = error == null
                    ? new IllegalStateException("Run ended at join " + arrival.joinStep() + " outside of any split")
                    : unwrap(error);
                cause = root instanceof StepflowException stepflowException
                    ? stepflowException
                    : new StepExecutionException(graph.start().name(), BranchPath.root(),
                        "Runner failed unexpectedly: " + root.getMessage(), root);
            }
            runStore.transition(runId, RunState.FAILED);
            log.error("Run {} failed: flow={}, kind={}, step={}, path={}",
                runId.getValue(), flow.name(), cause.getKind(), cause.getStepNameOrNull(), cause.getBranchPathOrNull());
            return Failed.of(runId, cause);
        }

        // ========================================
        // Step 실행
        // ========================================

        private CompletableFuture<Arrival> runFrom(String stepName, BranchState state) {
            StepDefinition step = graph.step(stepName);
            if (step.kind() == StepKind.JOIN) {
                return CompletableFuture.completedFuture(new Arrival(stepName, state));
            }
            if (aborted.get()) {
                return CompletableFuture.failedFuture(new RunAbortedException(stepName, state.path()));
            }
            try {
                return CompletableFuture.supplyAsync(() -> executeStep(step, state), workers)
                    .thenCompose(output -> continueAfter(step, state, output));
            } catch (RejectedExecutionException e) {
                return CompletableFuture.failedFuture(
                    fail(new StepExecutionException(stepName, state.path(), "Runner rejected step", e)));
            }
        }

        private StepOutput executeStep(StepDefinition step, BranchState state) {
            BranchPath path = state.path();
            if (aborted.get()) {
                throw new RunAbortedException(step.name(), path);
            }
            try {
                record(step.name(), path, StepState.RUNNING);
                log.debug("Step {} started at {}", step.name(), path);

                StepContext context = StepContext.of(
                    runId, step.name(), path, parameters, state.artifacts(), state.input());
                StepResult result = stepInvoker.invoke(step, path, () -> step.body().execute(context));
                if (result == null) {
                    throw new IllegalStateException("Step body returned null result");
                }
                List<Launch> launches = launchesFor(step, path, result);

                ArtifactScope scope = ArtifactScope.of(runId, path, step.name());
                artifactStore.write(scope, result.getArtifacts());
                Artifacts visible = state.artifacts().overlay(artifactStore.read(scope));

                record(step.name(), path, StepState.SUCCEEDED);
                log.debug("Step {} succeeded at {}: produced={}", step.name(), path, result.getArtifacts().names());
                return new StepOutput(visible, launches);
            } catch (Exception e) {
                StepflowException error = wrap(step.name(), path, e);
                recordFailure(step.name(), path, error.getMessage());
                throw new CompletionException(fail(error));
            }
        }

        private List<Launch> launchesFor(StepDefinition step, BranchPath path, StepResult result) {
            StepResult.Selection selection = result.getSelection();
            switch (step.kind()) {
                case LINEAR, JOIN -> {
                    if (selection != StepResult.Selection.DECLARED) {
                        throw new StepExecutionException(step.name(), path,
                            step.kind() + " step cannot select branches (returned " + selection + ")", null);
                    }
                    return List.of();
                }
                case SPLIT_STATIC -> {
                    if (selection == StepResult.Selection.FOREACH) {
                        throw new StepExecutionException(step.name(), path,
                            "Static split returned foreach items", null);
                    }
                    List<String> branches = selection == StepResult.Selection.BRANCHES
                        ? result.getBranches()
                        : step.successors();
                    if (branches.size() != step.successors().size()
                        || !new HashSet<>(branches).equals(new HashSet<>(step.successors()))) {
                        throw new StepExecutionException(step.name(), path,
                            "Static split selected " + branches + " but declares " + step.successors(), null);
                    }
                    List<Launch> launches = new ArrayList<>(branches.size());
                    for (String branch : branches) {
                        launches.add(new Launch(branch, null));
                    }
                    return launches;
                }
                case SPLIT_FOREACH -> {
                    if (selection != StepResult.Selection.FOREACH) {
                        throw new StepExecutionException(step.name(), path,
                            "Foreach split must return foreach items (returned " + selection + ")", null);
                    }
                    List<Object> items = result.getForeachItems();
                    if (items.isEmpty() && config.emptyForeachPolicy() == EmptyForeachPolicy.FAIL) {
                        throw new EmptyForeachException(step.name(), path);
                    }
                    String branch = step.successors().get(0);
                    List<Launch> launches = new ArrayList<>(items.size());
                    for (Object item : items) {
                        launches.add(new Launch(branch, item));
                    }
                    return launches;
                }
                default -> throw new IllegalStateException("Unknown step kind: " + step.kind());
            }
        }

        private CompletableFuture<Arrival> continueAfter(StepDefinition step, BranchState state, StepOutput output) {
            BranchState next = new BranchState(state.path(), output.visible(), state.input(), step.name());
            try {
                if (step.isEnd()) {
                    return CompletableFuture.completedFuture(new Arrival(null, next));
                }
                if (step.kind().isSplit()) {
                    return spawn(step, next, output.launches());
                }
                return runFrom(step.successors().get(0), next);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(fail(wrap(step.name(), state.path(), e)));
            }
        }

        // ========================================
        // Split / Join
        // ========================================

        private CompletableFuture<Arrival> spawn(StepDefinition split, BranchState state, List<Launch> launches) {
            StepDefinition join = graph.step(graph.matchingJoin(split.name()));
            BranchPath path = state.path();
            int width = launches.size();

            record(join.name(), path, StepState.AWAITING_JOIN);
            JoinBarrier barrier = new JoinBarrier(join.name(), width);
            log.info("Split {} at {} spawned {} branches toward join {}", split.name(), path, width, join.name());

            for (int i = 1; i <= width; i++) {
                Launch launch = launches.get(i - 1);
                int index = i;
                BranchPath childPath = path.enter(split.name(), index, width);
                Object input = launch.item() != null ? launch.item() : state.input();
                BranchState child = new BranchState(childPath, state.artifacts(), input, split.name());
                runFrom(launch.successor(), child).whenComplete((arrival, error) -> {
                    if (error != null) {
                        barrier.fail(index, unwrap(error));
                    } else if (!join.name().equals(arrival.joinStep())) {
                        barrier.fail(index, new IllegalStateException(
                            "Branch " + childPath + " did not reach join " + join.name()));
                    } else {
                        BranchState arrived = arrival.state();
                        barrier.arrive(new BranchInput(index, arrived.path(), arrived.lastStep(), arrived.artifacts()));
                    }
                });
            }

            return barrier.released()
                .handle((inputs, error) -> {
                    if (error != null) {
                        recordFailure(join.name(), path, "Branch failed before join");
                        log.warn("Join {} at {} will not run: a branch failed", join.name(), path);
                        throw new CompletionException(unwrap(error));
                    }
                    return inputs;
                })
                .thenCompose(inputs -> runJoin(join, state, inputs));
        }

        private CompletableFuture<Arrival> runJoin(StepDefinition join, BranchState outer, List<BranchInput> inputs) {
            if (aborted.get()) {
                recordFailure(join.name(), outer.path(), "Run aborted before join");
                return CompletableFuture.failedFuture(new RunAbortedException(join.name(), outer.path()));
            }
            log.info("Join {} at {} released with {} branches", join.name(), outer.path(), inputs.size());
            try {
                return CompletableFuture.supplyAsync(() -> executeJoin(join, outer, inputs), workers)
                    .thenCompose(visible -> {
                        BranchState next = new BranchState(outer.path(), visible, outer.input(), join.name());
                        if (join.isEnd()) {
                            return CompletableFuture.completedFuture(new Arrival(null, next));
                        }
                        return runFrom(join.successors().get(0), next);
                    });
            } catch (RejectedExecutionException e) {
                recordFailure(join.name(), outer.path(), "Runner rejected join");
                return CompletableFuture.failedFuture(
                    fail(new StepExecutionException(join.name(), outer.path(), "Runner rejected join", e)));
            }
        }

        private Artifacts executeJoin(StepDefinition join, BranchState outer, List<BranchInput> inputs) {
            BranchPath path = outer.path();
            if (aborted.get()) {
                recordFailure(join.name(), path, "Run aborted before join");
                throw new RunAbortedException(join.name(), path);
            }
            try {
                record(join.name(), path, StepState.RUNNING);
                JoinContext context = JoinContext.of(runId, join.name(), path, parameters, outer.artifacts(), inputs);
                StepResult result = stepInvoker.invoke(join, path, () -> join.joinBody().execute(context));
                if (result == null) {
                    throw new IllegalStateException("Join body returned null result");
                }
                launchesFor(join, path, result);

                ArtifactScope scope = ArtifactScope.of(runId, path, join.name());
                artifactStore.write(scope, result.getArtifacts());
                Artifacts visible = artifactStore.read(scope);

                record(join.name(), path, StepState.SUCCEEDED);
                log.debug("Join {} succeeded at {}: forwarded={}", join.name(), path, visible.names());
                return visible;
            } catch (Exception e) {
                StepflowException error = wrap(join.name(), path, e);
                recordFailure(join.name(), path, error.getMessage());
                throw new CompletionException(fail(error));
            }
        }

        // ========================================
        // 실패 / 상태 기록
        // ========================================

        private StepflowException fail(StepflowException error) {
            aborted.set(true);
            if (firstFailure.compareAndSet(null, error)) {
                log.error("Run {} failure origin: {}", runId.getValue(), error.getMessage(), error);
            } else {
                log.warn("Run {} additional failure discarded: {}", runId.getValue(), error.getMessage());
            }
            return error;
        }

        private void record(String stepName, BranchPath path, StepState state) {
            runStore.recordStep(StepRecord.of(runId, stepName, path, state));
        }

        private void recordFailure(String stepName, BranchPath path, String message) {
            try {
                runStore.recordStep(StepRecord.failed(runId, stepName, path, message));
            } catch (IllegalStateException e) {
                log.warn("Could not record failure of step {} at {}: {}", stepName, path, e.getMessage());
            }
        }
    }

    private static StepflowException wrap(String stepName, BranchPath path, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof StepflowException stepflowException) {
            return stepflowException;
        }
        return new StepExecutionException(stepName, path, cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * branch 하나의 진행 상태 (불변).
     *
     * @param path branch 경로
     * @param artifacts 현재 보이는 Artifact
     * @param input foreach 입력 원소 (없으면 null)
     * @param lastStep 마지막으로 실행된 step (시작 전이면 null)
     */
    private record BranchState(BranchPath path, Artifacts artifacts, Object input, String lastStep) {
    }

    /**
     * branch 실행의 도착 지점. joinStep이 null이면 끝 step.
     */
    private record Arrival(String joinStep, BranchState state) {

        boolean isEnd() {
            return joinStep == null;
        }
    }

    private record StepOutput(Artifacts visible, List<Launch> launches) {
    }

    private record Launch(String successor, Object item) {
    }

    /**
     * 다른 branch의 실패로 시작하지 않은 step. Run 실패 원인으로 보고되지 않음.
     */
    private static final class RunAbortedException extends RuntimeException {

        private RunAbortedException(String stepName, BranchPath path) {
            super("Step " + stepName + " at " + path + " not started: run already failed", null, false, false);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "stepflow-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
