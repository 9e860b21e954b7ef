package com.bm25index.index;

import com.bm25index.document.Document;
import com.bm25index.document.DocumentLookupException;
import com.bm25index.document.KeyRegistry;
import com.bm25index.storage.PostingList;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 构建完成的不可变索引：BM25 参数、键注册表、文档长度表与词项倒排表。
 *
 * 词项按插入顺序迭代，编码器依赖该顺序输出确定的字节序列。
 */
public final class InvertedIndex {
    private final double k1;
    private final double b;
    private final double avgdl;
    private final KeyRegistry<String> keys;
    private final int[] docLengths;
    private final Map<String, PostingList> postingsByTerm;
    private final long totalPostings;

    /**
     * @param k1 词频饱和系数
     * @param b 长度归一化系数
     * @param avgdl 平均文档长度
     * @param keys 文档键注册表，ID 范围为 [0, keys.size())
     * @param docLengths 按文档ID索引的文档长度
     * @param postingsByTerm 词项到倒排列表的映射，迭代顺序即序列化顺序
     */
    public InvertedIndex(
        double k1,
        double b,
        double avgdl,
        KeyRegistry<String> keys,
        int[] docLengths,
        Map<String, PostingList> postingsByTerm
    ) {
        if (keys == null || docLengths == null || postingsByTerm == null) {
            throw new IllegalArgumentException("keys、docLengths与postingsByTerm不能为null");
        }
        if (docLengths.length != keys.size()) {
            throw new IllegalArgumentException("文档长度表与键注册表大小不一致: " + docLengths.length + " vs " + keys.size());
        }
        long postingCount = 0;
        for (Map.Entry<String, PostingList> entry : postingsByTerm.entrySet()) {
            PostingList postingList = entry.getValue();
            if (postingList.size() > 0 && postingList.docId(postingList.size() - 1) >= keys.size()) {
                throw new IllegalArgumentException("倒排引用了不存在的文档: term=" + entry.getKey());
            }
            postingCount += postingList.size();
        }
        this.k1 = k1;
        this.b = b;
        this.avgdl = avgdl;
        this.keys = keys;
        this.docLengths = Arrays.copyOf(docLengths, docLengths.length);
        this.postingsByTerm = Collections.unmodifiableMap(new LinkedHashMap<>(postingsByTerm));
        this.totalPostings = postingCount;
    }

    public double getK1() {
        return k1;
    }

    public double getB() {
        return b;
    }

    public double getAvgdl() {
        return avgdl;
    }

    public int getNumDocuments() {
        return keys.size();
    }

    public int getNumUniqueTerms() {
        return postingsByTerm.size();
    }

    public long getTotalPostings() {
        return totalPostings;
    }

    public KeyRegistry<String> getKeys() {
        return keys;
    }

    /**
     * 文档词项数。
     *
     * @throws DocumentLookupException docId 不存在时抛出
     */
    public int docLength(int docId) {
        if (!keys.contains(docId)) {
            throw new DocumentLookupException(docId, keys.size());
        }
        return docLengths[docId];
    }

    /**
     * 查找词项倒排列表，词项不存在时返回 null。
     */
    public PostingList postings(String term) {
        return postingsByTerm.get(term);
    }

    /**
     * 文档频率，词项不存在时为 0。
     */
    public int documentFrequency(String term) {
        PostingList postingList = postingsByTerm.get(term);
        return postingList == null ? 0 : postingList.size();
    }

    /**
     * 按序列化顺序返回全部词项。
     */
    public Set<String> terms() {
        return postingsByTerm.keySet();
    }

    public Map<String, PostingList> postingsByTerm() {
        return postingsByTerm;
    }

    public Document<String> document(int docId) {
        return new Document<>(docId, keys.resolve(docId), docLength(docId));
    }

    public IndexStats stats() {
        return new IndexStats(getNumDocuments(), getNumUniqueTerms(), avgdl, k1, b, totalPostings);
    }
}
