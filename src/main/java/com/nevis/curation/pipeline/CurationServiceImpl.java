package com.nevis.curation.pipeline;

import com.nevis.curation.event.BatchSubmittedEvent;
import com.nevis.curation.exception.EntityNotFoundException;
import com.nevis.curation.exception.WrongQueryException;
import com.nevis.curation.model.BatchReport;
import com.nevis.curation.model.ContentCluster;
import com.nevis.curation.repository.RecordStore;
import com.nevis.curation.scoring.ScoringProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CurationServiceImpl implements CurationService {

    private final RecordStore recordStore;
    private final ApplicationEventPublisher eventPublisher;
    private final ScoringProperties scoringProperties;
    private final PipelineProperties pipelineProperties;

    @Override
    @Transactional
    public BatchReport submit(BatchRequest request) {
        if (request.items() == null || request.items().isEmpty()) {
            throw new WrongQueryException("A batch needs at least one item");
        }
        if (request.items().size() > pipelineProperties.maxBatchSize()) {
            throw new WrongQueryException("Batch too large: " + request.items().size()
                + " items, at most " + pipelineProperties.maxBatchSize() + " allowed");
        }
        scoringProperties.defaultPolicy().withOverrides(request.scoring()).validate();

        UUID batchId = UUID.randomUUID();
        BatchReport report = BatchReport.pending(batchId, request.items().size());
        recordStore.put(RecordStore.BATCHES, batchId.toString(), report);

        log.info("Batch {} accepted with {} items", batchId, request.items().size());
        eventPublisher.publishEvent(new BatchSubmittedEvent(batchId, request));
        return report;
    }

    @Override
    public BatchReport getReport(UUID batchId) {
        return recordStore.get(RecordStore.BATCHES, batchId.toString(), BatchReport.class)
            .orElseThrow(() -> new EntityNotFoundException(batchId));
    }

    @Override
    public List<ContentCluster> getClusters(UUID batchId) {
        getReport(batchId);
        return recordStore.query(RecordStore.CLUSTERS, ContentCluster.class,
            cluster -> batchId.equals(cluster.batchId()));
    }
}
