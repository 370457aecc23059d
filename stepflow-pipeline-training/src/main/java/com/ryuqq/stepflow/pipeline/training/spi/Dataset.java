package com.ryuqq.stepflow.pipeline.training.spi;

import java.util.List;

/**
 * Tabular dataset, opaque to the pipeline except for its row count.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public interface Dataset {

    /**
     * @return number of rows
     */
    int size();

    /**
     * Returns the subset formed by the given rows, in the given order.
     *
     * @param rows zero-based row indices
     * @return the selected rows
     */
    Dataset select(List<Integer> rows);
}
