package com.bm25index.scoring;

public class BM25Scorer {
    private final int totalDocs;
    private final double avgDocLength;
    private final double k1;
    private final double b;

    public BM25Scorer(int totalDocs, double avgDocLength, double k1, double b) {
        this.totalDocs = Math.max(totalDocs, 1);
        // 全部文档为空时不存在倒排项，此处仅避免除零
        this.avgDocLength = avgDocLength <= 0 ? 1.0 : avgDocLength;
        this.k1 = k1;
        this.b = b;
    }

    /**
     * Okapi IDF，带 +1 平滑，即使词项出现在全部文档中 IDF 也不为负。
     */
    public double computeIDF(int docFrequency) {
        int boundedDf = Math.max(0, Math.min(docFrequency, totalDocs));
        return Math.log(1 + (totalDocs - boundedDf + 0.5) / (boundedDf + 0.5));
    }

    /**
     * 在已知 IDF 的情况下计算单个词项对单篇文档的得分贡献。
     */
    public double score(int termFrequency, int docLength, double idf) {
        if (termFrequency <= 0) {
            return 0.0;
        }
        double norm = 1 - b + b * (Math.max(docLength, 0) / avgDocLength);
        return idf * (termFrequency * (k1 + 1)) / (termFrequency + k1 * norm);
    }

    public double getK1() {
        return k1;
    }

    public double getB() {
        return b;
    }

    public int getTotalDocs() {
        return totalDocs;
    }

    public double getAvgDocLength() {
        return avgDocLength;
    }
}
