package com.bm25index.query;

import java.util.List;

public record SearchResult(
        List<SearchHit> hits,
        int totalMatches,
        long elapsedMs,
        List<String> queryTerms
) {
}
