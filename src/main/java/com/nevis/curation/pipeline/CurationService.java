package com.nevis.curation.pipeline;

import com.nevis.curation.model.BatchReport;
import com.nevis.curation.model.ContentCluster;

import java.util.List;
import java.util.UUID;

public interface CurationService {

    /**
     * Registers a batch and schedules it for processing. Returns the pending report.
     */
    BatchReport submit(BatchRequest request);

    BatchReport getReport(UUID batchId);

    List<ContentCluster> getClusters(UUID batchId);
}
