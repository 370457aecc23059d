package com.ryuqq.stepflow.core.graph;

/**
 * Step 종류.
 *
 * <pre>
 * LINEAR         a ──► b
 * SPLIT_STATIC   a ──► b, c, ...   (선언된 N개 branch)
 * SPLIT_FOREACH  a ══► b × K       (K는 실행 시 결정)
 * JOIN           b, c ──► j        (대응 split의 모든 branch 완료 후 실행)
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public enum StepKind {

    LINEAR,

    SPLIT_STATIC,

    SPLIT_FOREACH,

    JOIN;

    /**
     * branch를 만드는 종류인지 확인.
     *
     * @return SPLIT_STATIC 또는 SPLIT_FOREACH인 경우 true
     */
    public boolean isSplit() {
        return this == SPLIT_STATIC || this == SPLIT_FOREACH;
    }
}
