package com.ryuqq.stepflow.testkit.step;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.step.JoinBody;
import com.ryuqq.stepflow.core.step.JoinContext;
import com.ryuqq.stepflow.core.step.StepBody;
import com.ryuqq.stepflow.core.step.StepContext;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * step body 실행 기록기.
 *
 * <p>body를 감싸서 어떤 step이 어떤 branch 경로에서 몇 번 실행되었는지, 동시에 몇 개가
 * 실행되었는지를 기록합니다. 실행 엔진 테스트에서 "join 이전에 실행되지 않음",
 * "정확히 K번 실행" 같은 성질을 확인할 때 사용합니다.</p>
 *
 * <pre>
 * ExecutionRecorder recorder = new ExecutionRecorder();
 * StepGraph graph = StepGraph.builder()
 *     .foreach("start", recorder.record(context -&gt; StepResult.foreach(List.of(1, 2, 3))), "work")
 *     ...
 *
 * assertThat(recorder.count("work")).isEqualTo(3);
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class ExecutionRecorder {

    private final List<Execution> executions = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();

    public StepBody record(StepBody delegate) {
        return context -> {
            enter(context.getStepName(), context.getBranchPath(), context.getArtifacts());
            try {
                return delegate.execute(context);
            } finally {
                running.decrementAndGet();
            }
        };
    }

    public JoinBody recordJoin(JoinBody delegate) {
        return context -> {
            enter(context.getStepName(), context.getBranchPath(), Artifacts.empty());
            try {
                return delegate.execute(context);
            } finally {
                running.decrementAndGet();
            }
        };
    }

    private void enter(String stepName, BranchPath branchPath, Artifacts visible) {
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        executions.add(new Execution(executions.size(), stepName, branchPath, visible, Thread.currentThread().getName()));
    }

    public List<Execution> executions() {
        return List.copyOf(executions);
    }

    public List<Execution> executionsOf(String stepName) {
        return executions.stream().filter(execution -> execution.stepName().equals(stepName)).toList();
    }

    public int count(String stepName) {
        return executionsOf(stepName).size();
    }

    public boolean wasExecuted(String stepName) {
        return count(stepName) > 0;
    }

    /**
     * 실행 순서상 위치 (처음 실행 기준).
     *
     * @param stepName step 이름
     * @return 처음 실행된 위치, 실행되지 않았으면 -1
     */
    public int firstPosition(String stepName) {
        List<Execution> snapshot = executions();
        for (int i = 0; i < snapshot.size(); i++) {
            if (snapshot.get(i).stepName().equals(stepName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 마지막으로 실행된 위치.
     *
     * @param stepName step 이름
     * @return 마지막 실행 위치, 실행되지 않았으면 -1
     */
    public int lastPosition(String stepName) {
        List<Execution> snapshot = executions();
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            if (snapshot.get(i).stepName().equals(stepName)) {
                return i;
            }
        }
        return -1;
    }

    public int maxConcurrency() {
        return maxRunning.get();
    }

    /**
     * 기록된 실행 한 건.
     *
     * @param sequence 기록 순번 (근사값)
     * @param stepName step 이름
     * @param branchPath branch 경로
     * @param visibleArtifacts body가 받은 Artifact (join이면 빈 값)
     * @param threadName 실행 스레드 이름
     */
    public record Execution(
        int sequence,
        String stepName,
        BranchPath branchPath,
        Artifacts visibleArtifacts,
        String threadName
    ) {
    }
}
