package com.bm25index.query;

import com.bm25index.document.DocumentLookupException;
import com.bm25index.index.InvertedIndex;
import com.bm25index.scoring.BM25Scorer;
import com.bm25index.storage.PostingList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 基于不可变索引的 BM25 Top-K 评分引擎，无内部可变状态，可被多线程并发调用。
 */
public class ScoringEngine {
    private static final Logger logger = LoggerFactory.getLogger(ScoringEngine.class);

    /** 得分降序，同分按文档ID升序 */
    private static final Comparator<Map.Entry<Integer, Double>> RANKING =
        Comparator.<Map.Entry<Integer, Double>>comparingDouble(Map.Entry::getValue).reversed()
            .thenComparing(Map.Entry::getKey);

    private final InvertedIndex index;
    private final BM25Scorer scorer;

    public ScoringEngine(InvertedIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("index不能为null");
        }
        this.index = index;
        this.scorer = new BM25Scorer(index.getNumDocuments(), index.getAvgdl(), index.getK1(), index.getB());
    }

    /**
     * 执行 Top-K 检索。
     *
     * 查询词按精确字符串匹配，不做大小写归一或词干化；重复查询词只计一次，索引中不存在的词项直接跳过。
     *
     * @param queryTerms 已分词的查询词项
     * @param topK 返回结果上限，小于等于 0 时返回空结果
     * @return 按得分降序排列的结果，同分按文档ID升序
     */
    public SearchResult search(List<String> queryTerms, int topK) {
        if (queryTerms == null) {
            throw new IllegalArgumentException("queryTerms不能为null");
        }
        long startNanos = System.nanoTime();
        if (topK <= 0) {
            return new SearchResult(List.of(), 0, 0L, List.copyOf(queryTerms));
        }

        Map<Integer, Double> accumulatedScores = new HashMap<>();
        for (String term : distinctTerms(queryTerms)) {
            PostingList postingList = index.postings(term);
            if (postingList == null) {
                continue;
            }
            double idf = scorer.computeIDF(postingList.size());
            for (int position = 0; position < postingList.size(); position++) {
                int docId = postingList.docId(position);
                double contribution = scorer.score(postingList.termFreq(position), index.docLength(docId), idf);
                accumulatedScores.merge(docId, contribution, Double::sum);
            }
        }

        List<Map.Entry<Integer, Double>> ranked = accumulatedScores.entrySet().stream()
            .sorted(RANKING)
            .limit(topK)
            .toList();

        List<SearchHit> hits = new ArrayList<>(ranked.size());
        for (Map.Entry<Integer, Double> entry : ranked) {
            int docId = entry.getKey();
            hits.add(new SearchHit(index.getKeys().resolve(docId), entry.getValue(), docId));
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("检索完成: terms={}, matches={}, returned={}, elapsedMs={}",
            queryTerms.size(), accumulatedScores.size(), hits.size(), elapsedMs);
        return new SearchResult(List.copyOf(hits), accumulatedScores.size(), elapsedMs, List.copyOf(queryTerms));
    }

    /**
     * 计算单篇文档对查询的得分，不包含任何查询词的文档得分为 0。
     *
     * @throws DocumentLookupException docId 不存在时抛出
     */
    public double scoreDocument(List<String> queryTerms, int docId) {
        if (queryTerms == null) {
            throw new IllegalArgumentException("queryTerms不能为null");
        }
        int docLength = index.docLength(docId);
        double score = 0.0;
        for (String term : distinctTerms(queryTerms)) {
            PostingList postingList = index.postings(term);
            if (postingList == null) {
                continue;
            }
            int termFrequency = postingList.termFreqOf(docId);
            if (termFrequency > 0) {
                score += scorer.score(termFrequency, docLength, scorer.computeIDF(postingList.size()));
            }
        }
        return score;
    }

    /**
     * 去重并保持首次出现顺序，保证同一查询的累加顺序固定。
     */
    private Set<String> distinctTerms(List<String> queryTerms) {
        Set<String> distinct = new LinkedHashSet<>(queryTerms.size() * 2);
        for (String term : queryTerms) {
            if (term == null) {
                throw new IllegalArgumentException("查询词项不能为null");
            }
            distinct.add(term);
        }
        return distinct;
    }
}
