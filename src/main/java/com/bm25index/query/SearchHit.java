package com.bm25index.query;

/**
 * 单条检索结果。
 *
 * @param key 文档键
 * @param score BM25 得分
 * @param docId 文档ID
 */
public record SearchHit(
        String key,
        double score,
        int docId
) {
}
