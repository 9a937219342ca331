package com.nevis.curation.controller;

import com.nevis.curation.model.BatchReport;
import com.nevis.curation.model.ContentCluster;
import com.nevis.curation.pipeline.BatchRequest;
import com.nevis.curation.pipeline.CurationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/batches")
@RequiredArgsConstructor
public class BatchController {

    private final CurationService curationService;

    @PostMapping
    public ResponseEntity<BatchReport> submitBatch(@Valid @RequestBody BatchRequest request) {
        BatchReport report = curationService.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(report);
    }

    @GetMapping("/{id}")
    public ResponseEntity<BatchReport> getBatch(@PathVariable UUID id) {
        return ResponseEntity.ok(curationService.getReport(id));
    }

    @GetMapping("/{id}/clusters")
    public ResponseEntity<List<ContentCluster>> getClusters(@PathVariable UUID id) {
        return ResponseEntity.ok(curationService.getClusters(id));
    }
}
