package com.legal.citation.qa;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Summary of a link check run.
 */
public record LinkCheckReport(int scannedFiles, long totalLinks, List<BrokenLink> brokenLinks) {

    public LinkCheckReport {
        brokenLinks = brokenLinks != null ? List.copyOf(brokenLinks) : List.of();
    }

    public boolean isClean() {
        return brokenLinks.isEmpty();
    }

    /**
     * Broken links grouped by target, most referenced target first.
     */
    public Map<String, List<BrokenLink>> byTarget() {
        Map<String, List<BrokenLink>> grouped = new LinkedHashMap<>();
        brokenLinks.stream()
                .collect(Collectors.groupingBy(BrokenLink::targetPath))
                .entrySet().stream()
                .sorted((a, b) -> {
                    int bySize = Integer.compare(b.getValue().size(), a.getValue().size());
                    return bySize != 0 ? bySize : a.getKey().compareTo(b.getKey());
                })
                .forEach(e -> grouped.put(e.getKey(), e.getValue()));
        return grouped;
    }

    @Override
    public String toString() {
        return "LinkCheckReport{" +
                "scannedFiles=" + scannedFiles +
                ", totalLinks=" + totalLinks +
                ", broken=" + brokenLinks.size() +
                '}';
    }
}
