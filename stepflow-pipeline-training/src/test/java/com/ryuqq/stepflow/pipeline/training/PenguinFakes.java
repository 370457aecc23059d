package com.ryuqq.stepflow.pipeline.training;

import com.ryuqq.stepflow.pipeline.training.spi.Dataset;
import com.ryuqq.stepflow.pipeline.training.spi.Evaluation;
import com.ryuqq.stepflow.pipeline.training.spi.Matrix;
import com.ryuqq.stepflow.pipeline.training.spi.Model;
import com.ryuqq.stepflow.pipeline.training.spi.ModelFactory;
import com.ryuqq.stepflow.pipeline.training.spi.TrainingHistory;
import com.ryuqq.stepflow.pipeline.training.spi.Transformer;
import com.ryuqq.stepflow.pipeline.training.spi.TransformerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 학습 Flow 테스트용 가짜 데이터셋/transformer/모델.
 *
 * <p>행 수와 열 수만 추적하며, 모델 정확도는 생성 시 고정합니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
final class PenguinFakes {

    static final int FEATURE_COLUMNS = 7;
    static final int TARGET_COLUMNS = 3;

    private PenguinFakes() {
    }

    record RowsDataset(int size) implements Dataset {

        @Override
        public Dataset select(List<Integer> rows) {
            return new RowsDataset(rows.size());
        }
    }

    record SimpleMatrix(int rows, int columns) implements Matrix {
    }

    static final class WidthTransformer implements Transformer {

        private final int columns;
        private volatile boolean fitted;

        WidthTransformer(int columns) {
            this.columns = columns;
        }

        @Override
        public Matrix fitTransform(Dataset dataset) {
            fitted = true;
            return new SimpleMatrix(dataset.size(), columns);
        }

        @Override
        public Matrix transform(Dataset dataset) {
            if (!fitted) {
                throw new IllegalStateException("Transformer is not fitted");
            }
            return new SimpleMatrix(dataset.size(), columns);
        }
    }

    static TransformerFactory transformers() {
        return new TransformerFactory() {
            @Override
            public Transformer buildFeaturesTransformer() {
                return new WidthTransformer(FEATURE_COLUMNS);
            }

            @Override
            public Transformer buildTargetTransformer() {
                return new WidthTransformer(TARGET_COLUMNS);
            }
        };
    }

    static final class FixedAccuracyModel implements Model {

        private final int inputWidth;
        private final double accuracy;
        private final int failOnRows;
        private volatile int trainedRows = -1;

        FixedAccuracyModel(int inputWidth, double accuracy, int failOnRows) {
            this.inputWidth = inputWidth;
            this.accuracy = accuracy;
            this.failOnRows = failOnRows;
        }

        @Override
        public TrainingHistory fit(Matrix x, Matrix y, int epochs, int batchSize) {
            if (x.rows() == failOnRows) {
                throw new IllegalStateException("Loss diverged");
            }
            trainedRows = x.rows();
            return new TrainingHistory(List.of(0.9, 0.4), List.of(0.5, accuracy));
        }

        @Override
        public Evaluation evaluate(Matrix x, Matrix y) {
            if (trainedRows < 0) {
                throw new IllegalStateException("Model is not trained");
            }
            return new Evaluation(0.3, accuracy);
        }

        int getInputWidth() {
            return inputWidth;
        }

        int getTrainedRows() {
            return trainedRows;
        }
    }

    static final class FixedAccuracyModelFactory implements ModelFactory {

        private final double accuracy;
        private final int failOnRows;
        private final List<FixedAccuracyModel> built = Collections.synchronizedList(new ArrayList<>());

        FixedAccuracyModelFactory(double accuracy) {
            this(accuracy, -1);
        }

        FixedAccuracyModelFactory(double accuracy, int failOnRows) {
            this.accuracy = accuracy;
            this.failOnRows = failOnRows;
        }

        @Override
        public Model build(int inputWidth) {
            FixedAccuracyModel model = new FixedAccuracyModel(inputWidth, accuracy, failOnRows);
            built.add(model);
            return model;
        }

        List<FixedAccuracyModel> getBuilt() {
            synchronized (built) {
                return List.copyOf(built);
            }
        }
    }
}
