package com.bm25index.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BM25评分器测试
 */
class BM25ScorerTest {

    private static final double EPSILON = 1e-12;

    @Test
    @DisplayName("计算IDF：文档频率越低，IDF越高")
    void testComputeIDF() {
        BM25Scorer scorer = new BM25Scorer(1000, 100.0, 1.5, 0.75);

        double idfRare = scorer.computeIDF(1);
        double idfCommon = scorer.computeIDF(500);

        assertTrue(idfRare > idfCommon, "稀有词的IDF应该高于常见词");
        assertTrue(idfCommon > 0, "IDF应该为正数");
    }

    @Test
    @DisplayName("IDF公式：ln(1 + (N - df + 0.5) / (df + 0.5))")
    void testIdfFormula() {
        BM25Scorer scorer = new BM25Scorer(3, 3.0, 1.5, 0.75);

        assertEquals(Math.log(1 + 1.5 / 2.5), scorer.computeIDF(2), EPSILON);
        // 出现在全部文档中的词项IDF仍为正
        assertEquals(Math.log(1 + 0.5 / 3.5), scorer.computeIDF(3), EPSILON);
    }

    @Test
    @DisplayName("单词项得分与公式一致")
    void testScoreFormula() {
        BM25Scorer scorer = new BM25Scorer(3, 3.0, 1.5, 0.75);
        double idf = scorer.computeIDF(2);

        // tf=1, |d|=avgdl 时长度归一化因子为1
        double expected = idf * (1 * 2.5) / (1 + 1.5);
        assertEquals(expected, scorer.score(1, 3, idf), EPSILON);
    }

    @Test
    @DisplayName("词频越高，分数越高（其他条件相同）")
    void testScoreIncreasesWithTF() {
        BM25Scorer scorer = new BM25Scorer(100, 50.0, 1.5, 0.75);
        double idf = scorer.computeIDF(10);

        assertTrue(scorer.score(10, 50, idf) > scorer.score(1, 50, idf), "词频越高，分数应该越高");
    }

    @Test
    @DisplayName("文档越短，分数越高（词频相同）")
    void testScoreHigherForShorterDoc() {
        BM25Scorer scorer = new BM25Scorer(100, 100.0, 1.5, 0.75);
        double idf = scorer.computeIDF(10);

        assertTrue(scorer.score(5, 50, idf) > scorer.score(5, 200, idf), "短文档应该有更高分数");
    }

    @Test
    @DisplayName("b=0时不做长度归一化")
    void testNoLengthNormalization() {
        BM25Scorer scorer = new BM25Scorer(100, 100.0, 1.2, 0.0);
        double idf = scorer.computeIDF(10);

        assertEquals(scorer.score(5, 50, idf), scorer.score(5, 500, idf), EPSILON);
    }

    @Test
    @DisplayName("词频为0时得分为0")
    void testZeroTermFrequency() {
        BM25Scorer scorer = new BM25Scorer(10, 5.0, 1.5, 0.75);

        assertEquals(0.0, scorer.score(0, 5, scorer.computeIDF(3)));
    }

    @Test
    @DisplayName("平均长度为0时不发生除零")
    void testZeroAverageLength() {
        BM25Scorer scorer = new BM25Scorer(2, 0.0, 1.5, 0.75);

        assertEquals(1.0, scorer.getAvgDocLength());
        assertTrue(Double.isFinite(scorer.score(1, 0, scorer.computeIDF(1))));
    }

    @Test
    @DisplayName("自定义BM25参数")
    void testCustomParameters() {
        BM25Scorer scorer = new BM25Scorer(100, 50.0, 2.0, 0.5);

        assertEquals(2.0, scorer.getK1());
        assertEquals(0.5, scorer.getB());
        assertEquals(100, scorer.getTotalDocs());
    }
}
