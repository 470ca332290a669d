package com.treegrep.search;

import java.util.List;

public record SearchResult(
        List<SearchHit> hits,
        int totalMatches,
        int treeCount,
        long elapsedMs,
        String pattern
) {
}
