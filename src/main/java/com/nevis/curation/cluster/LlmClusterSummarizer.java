package com.nevis.curation.cluster;

import com.nevis.curation.model.ContentCluster;
import com.nevis.curation.model.ContentItem;
import com.nevis.curation.model.EnrichmentStatus;
import com.nevis.curation.provider.GenerationPrompt;
import com.nevis.curation.provider.GenerationTask;
import com.nevis.curation.provider.TextGenerationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
public class LlmClusterSummarizer implements ClusterSummarizer {

    private static final String SUMMARY_INSTRUCTIONS =
        """
            Role: Senior Market Intelligence Analyst.
            Task: The numbered sources below report the same story. Write one consolidated summary (3-4 sentences)
            that keeps every distinct fact, names the key actors and states what changed.
            Constraint: Do not speculate beyond the sources. Do not mention the sources by number.

            Output: Output only the summary
            """;

    private final TextGenerationProvider generationProvider;

    @Value("${app.summary.max-chars:20000}")
    private int maxSummaryChars;

    public LlmClusterSummarizer(TextGenerationProvider generationProvider) {
        this.generationProvider = generationProvider;
    }

    @Override
    public ContentCluster summarize(ContentCluster cluster, List<ContentItem> members) {
        log.debug("Summarizing cluster {} with {} members", cluster.id(), members.size());

        String input = renderSources(members);
        if (input.length() > maxSummaryChars) {
            input = input.substring(0, maxSummaryChars);
        }

        try {
            String summary = generationProvider.generate(
                new GenerationPrompt(GenerationTask.CLUSTER_SUMMARY, SUMMARY_INSTRUCTIONS, input));
            log.info("Summary generated for cluster {}", cluster.id());
            return cluster.withSummary(summary).withSummaryStatus(EnrichmentStatus.READY);
        } catch (Exception e) {
            log.warn("Summary generation failed for cluster {}: {}", cluster.id(), e.getMessage());
            return cluster.withSummary(fallbackSummary(cluster, members)).withSummaryStatus(EnrichmentStatus.FAILED);
        }
    }

    private String renderSources(List<ContentItem> members) {
        StringBuilder sb = new StringBuilder();
        int n = 1;
        for (ContentItem member : members) {
            String text = member.summary() != null && !member.summary().isBlank() ? member.summary() : member.body();
            sb.append(n++).append(". ").append(member.title()).append("\n")
                .append(text == null ? "" : text.trim())
                .append("\n\n");
        }
        return sb.toString();
    }

    private String fallbackSummary(ContentCluster cluster, List<ContentItem> members) {
        return members.stream()
            .filter(m -> m.id().equals(cluster.representativeId()))
            .findFirst()
            .map(rep -> rep.summary() != null && !rep.summary().isBlank() ? rep.summary() : rep.title())
            .orElseGet(() -> members.stream().map(ContentItem::title).collect(Collectors.joining("; ")));
    }
}
