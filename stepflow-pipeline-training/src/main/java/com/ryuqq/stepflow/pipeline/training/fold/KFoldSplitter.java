package com.ryuqq.stepflow.pipeline.training.fold;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * K-fold 교차 검증 인덱스 생성기.
 *
 * <p>row 번호를 seed로 섞은 뒤 K개의 연속 구간으로 나누어 각 구간을 한 fold의 평가 집합으로 씁니다.
 * 나머지 row는 학습 집합입니다. 모든 row는 정확히 한 fold의 평가 집합에 속합니다.</p>
 *
 * <p><strong>fold 크기:</strong> {@code rows / K}, 앞쪽 {@code rows % K}개 fold는 1개 더.</p>
 *
 * <pre>
 * KFoldSplitter splitter = new KFoldSplitter(5, 42L);
 * List&lt;Fold&gt; folds = splitter.split(dataset.size());
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class KFoldSplitter {

    private static final Logger log = LoggerFactory.getLogger(KFoldSplitter.class);

    /**
     * 기본 fold 수.
     */
    public static final int DEFAULT_FOLDS = 5;

    private final int folds;
    private final long seed;

    /**
     * 생성자.
     *
     * @param folds fold 수 (2 이상)
     * @param seed 섞기 seed (같은 seed면 같은 분할)
     * @throws IllegalArgumentException folds가 2 미만인 경우
     */
    public KFoldSplitter(int folds, long seed) {
        if (folds < 2) {
            throw new IllegalArgumentException("folds must be at least 2 (current: " + folds + ")");
        }
        this.folds = folds;
        this.seed = seed;
    }

    /**
     * fold 목록 생성.
     *
     * <p>row가 하나도 없으면 빈 목록을 반환합니다 (빈 foreach 처리는 실행기 정책을 따름).</p>
     *
     * @param rows 전체 row 수
     * @return fold 번호 순서의 fold 목록
     * @throws IllegalArgumentException rows가 음수이거나, 0보다 크지만 fold 수보다 작은 경우
     */
    public List<Fold> split(int rows) {
        if (rows < 0) {
            throw new IllegalArgumentException("rows must be non-negative (current: " + rows + ")");
        }
        if (rows == 0) {
            log.warn("Dataset is empty, no folds generated");
            return List.of();
        }
        if (rows < folds) {
            throw new IllegalArgumentException(
                String.format("Cannot split %d rows into %d folds", rows, folds));
        }

        List<Integer> shuffled = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            shuffled.add(i);
        }
        Collections.shuffle(shuffled, new Random(seed));

        List<Fold> result = new ArrayList<>(folds);
        int base = rows / folds;
        int remainder = rows % folds;
        int offset = 0;
        for (int number = 0; number < folds; number++) {
            int size = base + (number < remainder ? 1 : 0);
            List<Integer> test = shuffled.subList(offset, offset + size);
            List<Integer> train = new ArrayList<>(rows - size);
            train.addAll(shuffled.subList(0, offset));
            train.addAll(shuffled.subList(offset + size, rows));
            Collections.sort(train);
            result.add(new Fold(number, train, test));
            offset += size;
        }
        log.debug("Split {} rows into {} folds (seed={})", rows, folds, seed);
        return List.copyOf(result);
    }

    public int getFolds() {
        return folds;
    }

    public long getSeed() {
        return seed;
    }
}
