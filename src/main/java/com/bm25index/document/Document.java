package com.bm25index.document;

/**
 * 已索引文档的只读视图。
 *
 * @param docId 连续文档ID
 * @param key 文档键
 * @param length 文档词项数（含重复）
 */
public record Document<K>(int docId, K key, int length) {
    public Document {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        if (length < 0) {
            throw new IllegalArgumentException("length不能为负数: " + length);
        }
    }
}
