package com.ryuqq.stepflow.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 병렬 영역 안에서 현재 실행 경로를 나타내는 불변 경로.
 *
 * <p>조상 split마다 하나의 {@link BranchSegment}를 가지며, 가장 바깥 split이 먼저 옵니다.
 * 병렬 영역 밖(최상위)의 경로는 {@link #root()} 입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * BranchPath path = BranchPath.root()
 *     .enter("start", 1, 2)
 *     .enter("cross_validation", 3, 5);
 * path.toString();   // "start[1/2]/cross_validation[3/5]"
 * path.leave();      // "start[1/2]"
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class BranchPath {

    private static final BranchPath ROOT = new BranchPath(List.of());

    private final List<BranchSegment> segments;

    private BranchPath(List<BranchSegment> segments) {
        this.segments = segments;
    }

    /**
     * 최상위 경로.
     *
     * @return 빈 경로
     */
    public static BranchPath root() {
        return ROOT;
    }

    /**
     * 구간 목록으로 경로 생성.
     *
     * @param segments 바깥 split부터 정렬된 구간 목록
     * @return BranchPath
     * @throws IllegalArgumentException segments가 null이거나 null 원소를 포함한 경우
     */
    public static BranchPath of(List<BranchSegment> segments) {
        if (segments == null || segments.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("segments cannot be null or contain null");
        }
        return segments.isEmpty() ? ROOT : new BranchPath(List.copyOf(segments));
    }

    /**
     * split 진입: 새 구간을 덧붙인 경로를 반환합니다.
     *
     * @param splitStep split step 이름
     * @param index branch 번호 (1부터)
     * @param width branch 수
     * @return 확장된 경로
     */
    public BranchPath enter(String splitStep, int index, int width) {
        List<BranchSegment> next = new ArrayList<>(segments);
        next.add(new BranchSegment(splitStep, index, width));
        return new BranchPath(Collections.unmodifiableList(next));
    }

    /**
     * join 통과: 가장 안쪽 구간을 제거한 경로를 반환합니다.
     *
     * @return 부모 경로
     * @throws IllegalStateException 최상위 경로인 경우
     */
    public BranchPath leave() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("Cannot leave the root branch path");
        }
        return of(segments.subList(0, segments.size() - 1));
    }

    public List<BranchSegment> getSegments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    /**
     * 가장 안쪽 구간.
     *
     * @return 마지막 구간
     * @throws IllegalStateException 최상위 경로인 경우
     */
    public BranchSegment innermost() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("Root branch path has no segments");
        }
        return segments.get(segments.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BranchPath that = (BranchPath) o;
        return segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        if (segments.isEmpty()) {
            return "root";
        }
        StringBuilder sb = new StringBuilder();
        for (BranchSegment segment : segments) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(segment);
        }
        return sb.toString();
    }
}
