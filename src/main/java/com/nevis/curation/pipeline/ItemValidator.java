package com.nevis.curation.pipeline;

import com.nevis.curation.exception.MalformedItemException;
import com.nevis.curation.model.ContentItem;
import com.nevis.curation.model.ContentMetadata;
import com.nevis.curation.model.EnrichmentStatus;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

/**
 * Turns submitted items into {@link ContentItem}s, rejecting the ones missing required fields.
 */
final class ItemValidator {

    static final int MAX_ID_LENGTH = 256;

    private ItemValidator() {
    }

    static ContentItem toContentItem(BatchItemRequest request, Set<String> seenIds) {
        String id = request.id();
        if (isBlank(id)) {
            throw new MalformedItemException(null, "id is required");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new MalformedItemException(id.substring(0, 32) + "...",
                "id must not be longer than " + MAX_ID_LENGTH + " characters, got " + id.length());
        }
        if (isBlank(request.title())) {
            throw new MalformedItemException(id, "title is required");
        }
        if (isBlank(request.body())) {
            throw new MalformedItemException(id, "body is required");
        }
        if (isBlank(request.sourceUrl())) {
            throw new MalformedItemException(id, "source_url is required");
        }
        Double confidence = request.extractionConfidence();
        if (confidence == null) {
            throw new MalformedItemException(id, "extraction_confidence is required");
        }
        if (confidence.isNaN() || confidence < 0 || confidence > 1) {
            throw new MalformedItemException(id, "extraction_confidence must be within [0,1]: " + confidence);
        }
        if (request.wordCount() != null && request.wordCount() < 0) {
            throw new MalformedItemException(id, "word_count must not be negative");
        }
        if (!seenIds.add(id)) {
            throw new MalformedItemException(id, "duplicate id within the batch");
        }

        int wordCount = request.wordCount() != null ? request.wordCount() : countWords(request.body());
        String domain = !isBlank(request.domain()) ? request.domain() : domainOf(request.sourceUrl());

        return new ContentItem(
            id,
            request.title().trim(),
            request.body(),
            request.summary(),
            request.sourceUrl().trim(),
            domain,
            wordCount,
            confidence,
            request.publishedAt(),
            new ContentMetadata(request.tags(), request.extractedAt(), request.attributes()),
            null,
            EnrichmentStatus.PENDING,
            null,
            null,
            false,
            0
        );
    }

    static int countWords(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    static String domainOf(String sourceUrl) {
        try {
            String host = URI.create(sourceUrl.trim()).getHost();
            if (host == null) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
