package com.nevis.curation.controller;

import com.nevis.curation.retrieval.RetrievalRequest;
import com.nevis.curation.retrieval.RetrievalResponse;
import com.nevis.curation.retrieval.RetrievalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/retrieval")
@RequiredArgsConstructor
public class RetrievalController {

    private final RetrievalService retrievalService;

    @PostMapping("/search")
    public ResponseEntity<RetrievalResponse> search(@Valid @RequestBody RetrievalRequest request) {
        return ResponseEntity.ok(retrievalService.search(request));
    }
}
