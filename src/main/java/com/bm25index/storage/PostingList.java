package com.bm25index.storage;

import java.util.Arrays;

/**
 * 单个词项的倒排列表，按文档ID严格递增排列，每个文档只出现一次。
 *
 * @param docIds 严格递增的文档ID数组
 * @param termFreqs 与docIds同长度的正词频数组
 */
public record PostingList(int[] docIds, int[] termFreqs) {
    /**
     * 构造时校验有序性与取值范围，并复制输入数组。
     */
    public PostingList {
        if (docIds == null || termFreqs == null) {
            throw new IllegalArgumentException("docIds与termFreqs不能为null");
        }
        if (docIds.length != termFreqs.length) {
            throw new IllegalArgumentException("docIds与termFreqs长度不一致: " + docIds.length + " vs " + termFreqs.length);
        }
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (termFreqs[index] <= 0) {
                throw new IllegalArgumentException("termFreq必须为正数，位置=" + index + ", value=" + termFreqs[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
        termFreqs = Arrays.copyOf(termFreqs, termFreqs.length);
    }

    /**
     * 文档频率，即包含该词项的文档数。
     */
    public int size() {
        return docIds.length;
    }

    public int docId(int index) {
        return docIds[index];
    }

    public int termFreq(int index) {
        return termFreqs[index];
    }

    /**
     * 二分查找指定文档的词频。
     *
     * @param docId 文档ID
     * @return 词频，文档不含该词项时返回 0
     */
    public int termFreqOf(int docId) {
        int index = Arrays.binarySearch(docIds, docId);
        return index >= 0 ? termFreqs[index] : 0;
    }

    /**
     * 列表内全部词频之和。
     */
    public long totalTermFreq() {
        long total = 0;
        for (int termFreq : termFreqs) {
            total += termFreq;
        }
        return total;
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public int[] termFreqs() {
        return Arrays.copyOf(termFreqs, termFreqs.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingList that)) {
            return false;
        }
        return Arrays.equals(docIds, that.docIds) && Arrays.equals(termFreqs, that.termFreqs);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(docIds) + Arrays.hashCode(termFreqs);
    }

    @Override
    public String toString() {
        return "PostingList[docIds=" + Arrays.toString(docIds) + ", termFreqs=" + Arrays.toString(termFreqs) + "]";
    }
}
