package com.nevis.curation.cluster;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.UUID;

final class ClusterIds {

    private ClusterIds() {
    }

    /**
     * Identifier derived from membership only, so the same members always get the same id.
     */
    static String forMembers(Collection<String> memberIds) {
        String key = String.join("\u0000", memberIds.stream().sorted().toList());
        return "cluster-" + UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }
}
