package com.ryuqq.stepflow.core.graph;

import com.ryuqq.stepflow.core.error.InvalidGraphException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Step 그래프 정적 검증.
 *
 * <p>어떤 step도 실행하기 전에 그래프 구조를 검사하고, 발견한 모든 결함을 한 번에 보고합니다.</p>
 *
 * <p><strong>검사 항목:</strong></p>
 * <ul>
 *   <li>step 이름 중복, 정의되지 않은 successor 참조</li>
 *   <li>종류별 successor 개수 (linear/join ≤ 1, static split ≥ 2, foreach = 1)</li>
 *   <li>시작 step(선행 없음)과 끝 step(successor 없음)이 정확히 하나</li>
 *   <li>순환 없음</li>
 *   <li>join의 선언된 선행 수 = 실제 들어오는 edge 수</li>
 *   <li>모든 split은 정확히 하나의 join으로 닫히고, join은 같은 split의 모든 branch를 받음</li>
 *   <li>join이 아닌 step은 선행이 하나 이하</li>
 * </ul>
 *
 * <p>구조 검사는 위상 순서로 각 step에 "열린 split 스택"을 전파하는 방식입니다.
 * split은 branch마다 (split, branch 첫 step) 프레임을 push하고, join은 들어오는 모든 edge의
 * 최상단 프레임이 같은 split을 가리키고 그 split의 branch를 빠짐없이 덮을 때만 pop합니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class GraphValidator {

    // Utility class - prevent instantiation
    private GraphValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 결함 목록 반환 (유효하면 빈 목록).
     *
     * @param definitions step 정의
     * @return 결함 설명 목록
     */
    public static List<String> problems(List<StepDefinition> definitions) {
        return analyze(definitions).problems();
    }

    /**
     * 검증 후 결함이 있으면 예외.
     *
     * @param definitions step 정의
     * @throws InvalidGraphException 결함이 하나 이상 있는 경우
     */
    public static void validate(List<StepDefinition> definitions) {
        List<String> problems = problems(definitions);
        if (!problems.isEmpty()) {
            throw new InvalidGraphException(problems);
        }
    }

    static Analysis analyze(List<StepDefinition> definitions) {
        if (definitions == null || definitions.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("definitions cannot be null or contain null");
        }
        List<String> problems = new ArrayList<>();
        if (definitions.isEmpty()) {
            problems.add("Graph has no steps");
            return Analysis.failed(problems);
        }

        Map<String, StepDefinition> steps = new LinkedHashMap<>();
        for (StepDefinition definition : definitions) {
            if (steps.putIfAbsent(definition.name(), definition) != null) {
                problems.add("Duplicate step name: " + definition.name());
            }
        }

        checkSuccessors(steps, problems);
        if (!problems.isEmpty()) {
            return Analysis.failed(problems);
        }

        Map<String, List<String>> predecessors = predecessorsOf(steps);
        String start = single(steps.keySet(), name -> predecessors.get(name).isEmpty(), "start", problems);
        String end = single(steps.keySet(), name -> steps.get(name).isEnd(), "end", problems);

        List<String> order = topologicalOrder(steps, predecessors);
        if (order.size() < steps.size()) {
            Set<String> cyclic = new LinkedHashSet<>(steps.keySet());
            order.forEach(cyclic::remove);
            problems.add("Graph contains a cycle involving: " + cyclic);
            return Analysis.failed(problems);
        }

        for (StepDefinition step : steps.values()) {
            int incoming = predecessors.get(step.name()).size();
            if (step.kind() == StepKind.JOIN && step.declaredPredecessors() != incoming) {
                problems.add(String.format(
                    "Join %s declares %d predecessors but has %d incoming edges",
                    step.name(), step.declaredPredecessors(), incoming));
            }
        }
        if (!problems.isEmpty()) {
            return Analysis.failed(problems);
        }

        Map<String, String> joinBySplit = new HashMap<>();
        Map<String, String> splitByJoin = new HashMap<>();
        checkStructure(steps, predecessors, order, end, joinBySplit, splitByJoin, problems);
        if (!problems.isEmpty()) {
            return Analysis.failed(problems);
        }
        return new Analysis(List.of(), start, end, List.copyOf(order), predecessors, joinBySplit, splitByJoin);
    }

    private static void checkSuccessors(Map<String, StepDefinition> steps, List<String> problems) {
        for (StepDefinition step : steps.values()) {
            List<String> successors = step.successors();
            for (String successor : successors) {
                if (!steps.containsKey(successor)) {
                    problems.add("Step " + step.name() + " references undefined successor " + successor);
                }
            }
            if (new HashSet<>(successors).size() != successors.size()) {
                problems.add("Step " + step.name() + " lists a successor more than once: " + successors);
            }
            int count = successors.size();
            switch (step.kind()) {
                case LINEAR, JOIN -> {
                    if (count > 1) {
                        problems.add(step.kind() + " step " + step.name() + " must have at most one successor (current: " + count + ")");
                    }
                }
                case SPLIT_STATIC -> {
                    if (count < 2) {
                        problems.add("Static split " + step.name() + " must have at least two successors (current: " + count + ")");
                    }
                }
                case SPLIT_FOREACH -> {
                    if (count != 1) {
                        problems.add("Foreach split " + step.name() + " must have exactly one successor (current: " + count + ")");
                    }
                }
            }
        }
    }

    private static Map<String, List<String>> predecessorsOf(Map<String, StepDefinition> steps) {
        Map<String, List<String>> predecessors = new LinkedHashMap<>();
        steps.keySet().forEach(name -> predecessors.put(name, new ArrayList<>()));
        for (StepDefinition step : steps.values()) {
            for (String successor : step.successors()) {
                predecessors.get(successor).add(step.name());
            }
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        predecessors.forEach((name, list) -> frozen.put(name, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    private static String single(Set<String> names, Predicate<String> test,
                                 String role, List<String> problems) {
        List<String> found = new ArrayList<>();
        for (String name : names) {
            if (test.test(name)) {
                found.add(name);
            }
        }
        if (found.size() != 1) {
            problems.add("Graph must have exactly one " + role + " step (found: " + found + ")");
            return null;
        }
        return found.get(0);
    }

    // Kahn. 동률은 정의 순서로 풀어 결과를 결정적으로 유지
    private static List<String> topologicalOrder(Map<String, StepDefinition> steps,
                                                 Map<String, List<String>> predecessors) {
        Map<String, Integer> remaining = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String name : steps.keySet()) {
            int incoming = predecessors.get(name).size();
            remaining.put(name, incoming);
            if (incoming == 0) {
                ready.add(name);
            }
        }
        List<String> order = new ArrayList<>(steps.size());
        while (!ready.isEmpty()) {
            String name = ready.poll();
            order.add(name);
            for (String successor : steps.get(name).successors()) {
                int left = remaining.merge(successor, -1, Integer::sum);
                if (left == 0) {
                    ready.add(successor);
                }
            }
        }
        return order;
    }

    private static void checkStructure(Map<String, StepDefinition> steps,
                                       Map<String, List<String>> predecessors,
                                       List<String> order,
                                       String end,
                                       Map<String, String> joinBySplit,
                                       Map<String, String> splitByJoin,
                                       List<String> problems) {
        Map<String, List<Frame>> openSplits = new HashMap<>();
        for (String name : order) {
            StepDefinition step = steps.get(name);
            List<String> incoming = predecessors.get(name);
            if (incoming.isEmpty()) {
                openSplits.put(name, List.of());
                continue;
            }
            if (step.kind() != StepKind.JOIN) {
                if (incoming.size() > 1) {
                    problems.add("Step " + name + " has " + incoming.size()
                        + " predecessors " + incoming + " but is not a join");
                    return;
                }
                openSplits.put(name, edgeStack(steps.get(incoming.get(0)), name, openSplits));
                continue;
            }

            List<List<Frame>> edgeStacks = new ArrayList<>();
            for (String predecessor : incoming) {
                edgeStacks.add(edgeStack(steps.get(predecessor), name, openSplits));
            }
            List<Frame> closed = closeSplit(step, edgeStacks, steps, joinBySplit, problems);
            if (closed == null) {
                return;
            }
            openSplits.put(name, closed);
        }
        if (end != null && !openSplits.get(end).isEmpty()) {
            List<String> unclosed = new ArrayList<>();
            for (Frame frame : openSplits.get(end)) {
                unclosed.add(frame.split());
            }
            problems.add("Split " + unclosed + " never joined before end step " + end);
        }
        joinBySplit.forEach((split, join) -> splitByJoin.put(join, split));
    }

    private static List<Frame> edgeStack(StepDefinition from, String to, Map<String, List<Frame>> openSplits) {
        List<Frame> stack = openSplits.get(from.name());
        if (!from.kind().isSplit()) {
            return stack;
        }
        List<Frame> pushed = new ArrayList<>(stack);
        pushed.add(new Frame(from.name(), to));
        return List.copyOf(pushed);
    }

    private static List<Frame> closeSplit(StepDefinition join,
                                          List<List<Frame>> edgeStacks,
                                          Map<String, StepDefinition> steps,
                                          Map<String, String> joinBySplit,
                                          List<String> problems) {
        Set<String> splits = new LinkedHashSet<>();
        for (List<Frame> stack : edgeStacks) {
            if (stack.isEmpty()) {
                problems.add("Join " + join.name() + " has a predecessor outside of any split");
                return null;
            }
            splits.add(stack.get(stack.size() - 1).split());
        }
        if (splits.size() != 1) {
            problems.add("Join " + join.name() + " merges branches of different splits " + splits);
            return null;
        }
        String split = splits.iterator().next();

        List<Frame> prefix = null;
        Set<String> covered = new LinkedHashSet<>();
        for (List<Frame> stack : edgeStacks) {
            List<Frame> outer = stack.subList(0, stack.size() - 1);
            if (prefix == null) {
                prefix = outer;
            } else if (!prefix.equals(outer)) {
                problems.add("Join " + join.name() + " merges branches from different enclosing splits");
                return null;
            }
            covered.add(stack.get(stack.size() - 1).branch());
        }

        Set<String> declared = new LinkedHashSet<>(steps.get(split).successors());
        if (!covered.equals(declared) || covered.size() != edgeStacks.size()) {
            problems.add("Join " + join.name() + " covers branches " + covered
                + " of split " + split + " but the split declares " + declared);
            return null;
        }
        String previous = joinBySplit.putIfAbsent(split, join.name());
        if (previous != null) {
            problems.add("Split " + split + " is joined by both " + previous + " and " + join.name());
            return null;
        }
        return List.copyOf(prefix);
    }

    private record Frame(String split, String branch) {
    }

    /**
     * 검증 결과와 실행에 필요한 파생 정보.
     */
    record Analysis(
        List<String> problems,
        String start,
        String end,
        List<String> topologicalOrder,
        Map<String, List<String>> predecessors,
        Map<String, String> joinBySplit,
        Map<String, String> splitByJoin
    ) {

        static Analysis failed(List<String> problems) {
            return new Analysis(List.copyOf(problems), null, null, List.of(), Map.of(), Map.of(), Map.of());
        }

        boolean isValid() {
            return problems.isEmpty();
        }
    }
}
