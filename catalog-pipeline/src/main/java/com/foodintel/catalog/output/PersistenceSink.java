package com.foodintel.catalog.output;

import com.foodintel.catalog.model.PipelineRun;
import com.foodintel.catalog.transform.Dataset;

/**
 * Destination of the final cleaned dataset.
 */
public interface PersistenceSink {

    /**
     * @return where the dataset went (a file path, a table name, or both joined by ", ")
     */
    String write(Dataset dataset, String category);

    /** Best-effort: run metadata failures are logged, never thrown. */
    void writePipelineRun(PipelineRun run);
}
