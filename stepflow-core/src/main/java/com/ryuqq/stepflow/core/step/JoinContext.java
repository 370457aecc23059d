package com.ryuqq.stepflow.core.step;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.error.MergeConflictException;
import com.ryuqq.stepflow.core.merge.MergePolicies;
import com.ryuqq.stepflow.core.merge.MergePolicy;
import com.ryuqq.stepflow.core.merge.MetricSummary;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.model.RunParameters;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * join step에 주어지는 컨텍스트: 완료된 branch 입력과 명시적 병합 도구.
 *
 * <p>join 이후에는 body가 반환한 Artifact만 보입니다. 필요한 이름은 {@link #mergeArtifacts(Set)} 등으로
 * 직접 골라야 합니다. split 이전부터 보이던 Artifact는 {@link #getInherited()}로도 읽을 수 있어,
 * branch가 하나도 없는 빈 foreach 뒤에서도 전달할 수 있습니다.</p>
 *
 * <p><strong>충돌 규칙:</strong></p>
 * <ul>
 *   <li>여러 branch가 같은 이름에 같은 값(deep equals)을 주면 그대로 병합</li>
 *   <li>서로 다른 값을 주는 이름을 해소 없이 고르면 {@link MergeConflictException}</li>
 *   <li>해소 방법: {@link #selectFrom(int, String)}로 한 branch를 고르거나
 *       {@link #aggregate(String, MergePolicy)}로 집계</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * JoinBody averageScores = context -&gt; {
 *     MetricSummary accuracy = context.aggregate("test_accuracy");
 *     return StepResult.next(context.mergeArtifacts(Set.of("tracking_run_id"))
 *         .with("test_accuracy", accuracy.value())
 *         .with("test_accuracy_std", accuracy.spread()));
 * };
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class JoinContext {

    private final RunId runId;
    private final String stepName;
    private final BranchPath branchPath;
    private final RunParameters parameters;
    private final Artifacts inherited;
    private final List<BranchInput> inputs;

    private JoinContext(RunId runId, String stepName, BranchPath branchPath,
                        RunParameters parameters, Artifacts inherited, List<BranchInput> inputs) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
        if (branchPath == null) {
            throw new IllegalArgumentException("branchPath cannot be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        if (inherited == null) {
            throw new IllegalArgumentException("inherited cannot be null");
        }
        if (inputs == null || inputs.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("inputs cannot be null or contain null");
        }
        List<BranchInput> ordered = new ArrayList<>(inputs);
        ordered.sort(Comparator.comparingInt(BranchInput::index));
        this.runId = runId;
        this.stepName = stepName;
        this.branchPath = branchPath;
        this.parameters = parameters;
        this.inherited = inherited;
        this.inputs = List.copyOf(ordered);
    }

    /**
     * JoinContext 생성. 입력은 branch 번호 오름차순으로 정렬됩니다.
     *
     * @param runId Run ID
     * @param stepName join step 이름
     * @param branchPath join이 실행되는 (바깥) branch 경로
     * @param parameters Run 파라미터
     * @param inputs 완료된 branch 입력
     * @return JoinContext
     */
    public static JoinContext of(RunId runId, String stepName, BranchPath branchPath,
                                 RunParameters parameters, List<BranchInput> inputs) {
        return of(runId, stepName, branchPath, parameters, Artifacts.empty(), inputs);
    }

    /**
     * split 이전 Artifact를 포함한 JoinContext 생성.
     *
     * @param runId Run ID
     * @param stepName join step 이름
     * @param branchPath join이 실행되는 (바깥) branch 경로
     * @param parameters Run 파라미터
     * @param inherited split step 완료 시점에 보이던 Artifact
     * @param inputs 완료된 branch 입력
     * @return JoinContext
     */
    public static JoinContext of(RunId runId, String stepName, BranchPath branchPath,
                                 RunParameters parameters, Artifacts inherited, List<BranchInput> inputs) {
        return new JoinContext(runId, stepName, branchPath, parameters, inherited, inputs);
    }

    public RunId getRunId() {
        return runId;
    }

    public String getStepName() {
        return stepName;
    }

    public BranchPath getBranchPath() {
        return branchPath;
    }

    public RunParameters getParameters() {
        return parameters;
    }

    /**
     * split step이 끝난 시점에 보이던 Artifact (조상 + split step 결과).
     *
     * <p>branch 입력과 달리 branch 수와 무관하게 항상 같은 값입니다.</p>
     *
     * @return 상속받은 Artifact
     */
    public Artifacts getInherited() {
        return inherited;
    }

    /**
     * 완료된 branch 입력 (branch 번호 오름차순).
     *
     * @return 입력 목록 (빈 foreach면 비어있음)
     */
    public List<BranchInput> getInputs() {
        return inputs;
    }

    /**
     * 모든 branch에서 같은 값을 갖는 Artifact 선택.
     *
     * @param name Artifact 이름
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 값
     * @throws MergeConflictException branch들이 서로 다른 값을 제공한 경우
     * @throws IllegalStateException 어느 branch에도 없는 경우
     */
    public <T> T select(String name, Class<T> type) {
        Object value = resolve(name);
        if (!type.isInstance(value)) {
            throw new IllegalStateException(
                String.format("Artifact %s has type %s, expected %s", name, value.getClass().getName(), type.getName())
            );
        }
        return type.cast(value);
    }

    /**
     * 특정 branch의 Artifact 선택 (충돌을 명시적으로 해소).
     *
     * @param branchIndex branch 번호 (1부터)
     * @param name Artifact 이름
     * @return 값
     * @throws IllegalArgumentException 해당 번호의 branch가 없는 경우
     * @throws IllegalStateException 해당 branch에 Artifact가 없는 경우
     */
    public Object selectFrom(int branchIndex, String name) {
        for (BranchInput input : inputs) {
            if (input.index() == branchIndex) {
                return input.artifacts().require(name);
            }
        }
        throw new IllegalArgumentException("No branch with index " + branchIndex + " at join " + stepName);
    }

    /**
     * branch별 값 목록 (branch 번호 순서).
     *
     * @param name Artifact 이름
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return branch 순서의 값 목록
     * @throws IllegalStateException 어떤 branch에 Artifact가 없는 경우
     */
    public <T> List<T> collect(String name, Class<T> type) {
        List<T> values = new ArrayList<>(inputs.size());
        for (BranchInput input : inputs) {
            values.add(input.artifacts().get(name, type));
        }
        return values;
    }

    /**
     * 기본 정책(평균 + 모표준편차)으로 수치 Artifact 집계.
     *
     * @param name Artifact 이름
     * @return 집계 결과
     */
    public MetricSummary aggregate(String name) {
        return aggregate(name, MergePolicies.meanAndStd());
    }

    /**
     * 지정한 정책으로 수치 Artifact 집계.
     *
     * @param name Artifact 이름
     * @param policy 병합 정책
     * @return 집계 결과
     */
    public MetricSummary aggregate(String name, MergePolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        List<Double> values = new ArrayList<>(inputs.size());
        for (Number number : collect(name, Number.class)) {
            values.add(number.doubleValue());
        }
        return policy.merge(values);
    }

    /**
     * 지정한 이름만 병합.
     *
     * @param include 병합할 이름
     * @return 병합된 Artifact
     * @throws MergeConflictException 충돌하는 이름이 있는 경우 (모든 충돌 이름을 보고)
     * @throws IllegalStateException 어느 branch에도 없는 이름이 있는 경우
     */
    public Artifacts mergeArtifacts(Set<String> include) {
        if (include == null) {
            throw new IllegalArgumentException("include cannot be null");
        }
        return merge(new LinkedHashSet<>(include), true);
    }

    /**
     * 제외한 이름을 뺀 모든 이름 병합.
     *
     * @param exclude 제외할 이름
     * @return 병합된 Artifact
     * @throws MergeConflictException 충돌하는 이름이 있는 경우
     */
    public Artifacts mergeArtifactsExcept(Set<String> exclude) {
        if (exclude == null) {
            throw new IllegalArgumentException("exclude cannot be null");
        }
        Set<String> names = allNames();
        names.removeAll(exclude);
        return merge(names, false);
    }

    /**
     * 모든 branch의 모든 이름 병합.
     *
     * @return 병합된 Artifact
     * @throws MergeConflictException 충돌하는 이름이 있는 경우
     */
    public Artifacts mergeArtifacts() {
        return merge(allNames(), false);
    }

    private Artifacts merge(Set<String> names, boolean required) {
        Map<String, Object> merged = new LinkedHashMap<>();
        List<String> conflicts = new ArrayList<>();
        for (String name : names) {
            List<Object> values = valuesOf(name);
            if (values.isEmpty()) {
                if (required) {
                    throw new IllegalStateException("Artifact " + name + " not found in any branch of join " + stepName);
                }
                continue;
            }
            if (isConsistent(values)) {
                merged.put(name, values.get(0));
            } else {
                conflicts.add(name);
            }
        }
        if (!conflicts.isEmpty()) {
            throw new MergeConflictException(stepName, branchPath, conflicts);
        }
        return Artifacts.of(merged);
    }

    private Object resolve(String name) {
        List<Object> values = valuesOf(name);
        if (values.isEmpty()) {
            throw new IllegalStateException("Artifact " + name + " not found in any branch of join " + stepName);
        }
        if (!isConsistent(values)) {
            throw new MergeConflictException(stepName, branchPath, List.of(name));
        }
        return values.get(0);
    }

    private List<Object> valuesOf(String name) {
        List<Object> values = new ArrayList<>();
        for (BranchInput input : inputs) {
            input.artifacts().find(name).ifPresent(values::add);
        }
        return values;
    }

    private Set<String> allNames() {
        Set<String> names = new LinkedHashSet<>();
        for (BranchInput input : inputs) {
            names.addAll(input.artifacts().names());
        }
        return names;
    }

    private static boolean isConsistent(List<Object> values) {
        Object first = values.get(0);
        for (int i = 1; i < values.size(); i++) {
            if (!Objects.deepEquals(first, values.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "JoinContext{" + runId.getValue() + ", " + stepName + " @ " + branchPath + ", inputs=" + inputs.size() + '}';
    }
}
