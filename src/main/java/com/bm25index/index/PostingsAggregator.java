package com.bm25index.index;

import com.bm25index.storage.PostingList;
import com.bm25index.storage.StrictUtf8;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 增量倒排聚合器。
 *
 * 每次 record() 只保留 (词项, 文档) 级别的词频与文档长度，原始词项序列在调用结束后即可释放。
 * 文档ID必须连续递增地提交，因此每个词项的倒排天然按文档ID有序，无需额外排序。
 */
public final class PostingsAggregator {
    private static final int INITIAL_CAPACITY = 4;

    private final Map<String, TermAccumulator> accumulatorsByTerm = new LinkedHashMap<>();
    private int[] docLengths = new int[16];
    private int documentCount;
    private long totalLength;
    private boolean finished;

    /**
     * 记录一篇文档的全部词项。
     *
     * @param docId 文档ID，必须等于已记录的文档数
     * @param tokens 有序词项序列，可为空
     * @throws IllegalArgumentException 词项为 null 或含孤立代理项时抛出，此时不记录任何内容
     */
    public void record(int docId, List<String> tokens) {
        if (finished) {
            throw new IllegalStateException("PostingsAggregator 已完成，不能继续记录");
        }
        if (tokens == null) {
            throw new IllegalArgumentException("tokens不能为null");
        }
        if (docId != documentCount) {
            throw new IllegalArgumentException("文档ID必须连续递增: expected=" + documentCount + ", actual=" + docId);
        }

        // 首次出现顺序决定词项的序列化顺序
        Map<String, int[]> countsInDocument = new LinkedHashMap<>();
        for (String token : tokens) {
            if (token == null) {
                throw new IllegalArgumentException("词项不能为null, docId=" + docId);
            }
            countsInDocument.computeIfAbsent(token, ignored -> new int[1])[0]++;
        }
        for (String term : countsInDocument.keySet()) {
            StrictUtf8.requireEncodable(term, "词项");
        }
        for (Map.Entry<String, int[]> entry : countsInDocument.entrySet()) {
            accumulatorsByTerm
                .computeIfAbsent(entry.getKey(), ignored -> new TermAccumulator())
                .append(docId, entry.getValue()[0]);
        }

        if (documentCount == docLengths.length) {
            docLengths = Arrays.copyOf(docLengths, docLengths.length * 2);
        }
        docLengths[docId] = tokens.size();
        totalLength += tokens.size();
        documentCount++;
    }

    public int documentCount() {
        return documentCount;
    }

    public long totalLength() {
        return totalLength;
    }

    public int uniqueTermCount() {
        return accumulatorsByTerm.size();
    }

    /**
     * 已记录文档的长度。
     */
    public int docLength(int docId) {
        if (docId < 0 || docId >= documentCount) {
            throw new IllegalArgumentException("文档ID超出范围: " + docId);
        }
        return docLengths[docId];
    }

    /**
     * 计算平均文档长度并冻结倒排，之后聚合器不再可用。
     *
     * @return 平均文档长度、文档长度表与按首次出现顺序排列的倒排
     * @throws EmptyIndexException 没有记录任何文档时抛出
     */
    public FinalizedPostings finish() {
        if (finished) {
            throw new IllegalStateException("PostingsAggregator 已完成");
        }
        if (documentCount == 0) {
            throw new EmptyIndexException();
        }

        double avgdl = (double) totalLength / documentCount;
        Map<String, PostingList> postingsByTerm = new LinkedHashMap<>();
        for (Map.Entry<String, TermAccumulator> entry : accumulatorsByTerm.entrySet()) {
            postingsByTerm.put(entry.getKey(), entry.getValue().toPostingList());
        }
        int[] lengths = Arrays.copyOf(docLengths, documentCount);

        accumulatorsByTerm.clear();
        docLengths = new int[0];
        finished = true;
        return new FinalizedPostings(avgdl, lengths, postingsByTerm);
    }

    /**
     * finish() 的结果。
     */
    public record FinalizedPostings(double avgdl, int[] docLengths, Map<String, PostingList> postingsByTerm) {
    }

    /**
     * 单个词项的可增长倒排缓冲。
     */
    private static final class TermAccumulator {
        private int[] docIds = new int[INITIAL_CAPACITY];
        private int[] termFreqs = new int[INITIAL_CAPACITY];
        private int size;

        void append(int docId, int termFreq) {
            if (size == docIds.length) {
                docIds = Arrays.copyOf(docIds, size * 2);
                termFreqs = Arrays.copyOf(termFreqs, size * 2);
            }
            docIds[size] = docId;
            termFreqs[size] = termFreq;
            size++;
        }

        PostingList toPostingList() {
            return new PostingList(Arrays.copyOf(docIds, size), Arrays.copyOf(termFreqs, size));
        }
    }
}
