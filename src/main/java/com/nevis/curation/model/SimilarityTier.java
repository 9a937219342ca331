package com.nevis.curation.model;

/**
 * Classification of how close two pieces of content are, ordered from the
 * strongest to the weakest relationship.
 */
public enum SimilarityTier {
    EXACT_DUPLICATE,
    SAME_STORY,
    RELATED_CONTENT,
    UNIQUE_CONTENT
}
