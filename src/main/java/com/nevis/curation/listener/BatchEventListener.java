package com.nevis.curation.listener;

import com.nevis.curation.event.BatchSubmittedEvent;
import com.nevis.curation.pipeline.CurationPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class BatchEventListener {

    private final CurationPipelineService pipelineService;

    @Async("curationTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleBatchSubmitted(BatchSubmittedEvent event) {
        log.info("Starting async curation for batch: {}", event.batchId());
        pipelineService.process(event.batchId(), event.request());
    }
}
