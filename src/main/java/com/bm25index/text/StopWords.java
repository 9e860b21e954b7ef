package com.bm25index.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 英文停用词表，仅在 EnglishTokenizer 开启过滤时生效。
 */
public final class StopWords {

    public static final Set<String> ENGLISH = Set.of(
        "a", "about", "all", "also", "an", "and", "are", "as", "at",
        "be", "been", "but", "by", "can", "could", "did", "do", "does",
        "for", "from", "had", "has", "have", "if", "in", "into", "is",
        "it", "its", "just", "may", "might", "no", "not", "of", "on",
        "or", "out", "should", "so", "such", "than", "that", "the",
        "their", "then", "there", "these", "this", "those", "to", "up",
        "very", "was", "were", "which", "will", "with", "would"
    );

    private StopWords() {
    }

    /**
     * 判断词项是否为英文停用词，大小写不敏感。
     */
    public static boolean isStopWord(String term) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        return ENGLISH.contains(term.toLowerCase(Locale.ROOT));
    }

    /**
     * 返回去除停用词后的新列表，保持原有顺序。
     */
    public static List<String> remove(List<String> terms) {
        List<String> kept = new ArrayList<>(terms.size());
        for (String term : terms) {
            if (!isStopWord(term)) {
                kept.add(term);
            }
        }
        return kept;
    }
}
