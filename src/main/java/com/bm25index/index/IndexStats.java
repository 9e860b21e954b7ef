package com.bm25index.index;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 索引统计信息。
 *
 * @param numDocuments 文档数
 * @param numUniqueTerms 不同词项数
 * @param averageDocumentLength 平均文档长度
 * @param k1 词频饱和系数
 * @param b 长度归一化系数
 * @param totalPostings 全部倒排项数量，即不同 (词项, 文档) 对的数量
 */
public record IndexStats(
    int numDocuments,
    int numUniqueTerms,
    double averageDocumentLength,
    double k1,
    double b,
    long totalPostings
) {
    /**
     * 以 snake_case 键导出，便于与其他语言实现的统计结果对照。
     */
    public Map<String, Object> toMap() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("num_documents", numDocuments);
        stats.put("num_unique_terms", numUniqueTerms);
        stats.put("average_document_length", averageDocumentLength);
        stats.put("k1", k1);
        stats.put("b", b);
        stats.put("total_postings", totalPostings);
        return stats;
    }
}
