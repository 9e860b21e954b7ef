package com.bm25index.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 英文分词器：按非字母数字字符切分并转小写，丢弃单字符词项，可选过滤停用词。
 */
public class EnglishTokenizer implements Tokenizer {

    private static final Pattern SPLIT_PATTERN = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final boolean enableStopWords;

    /**
     * 创建英文分词器。
     */
    public EnglishTokenizer(boolean enableStopWords) {
        this.enableStopWords = enableStopWords;
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        for (String segment : SPLIT_PATTERN.split(text)) {
            if (segment.length() <= 1) {
                continue;
            }
            tokens.add(segment.toLowerCase(Locale.ROOT));
        }

        return List.copyOf(enableStopWords ? StopWords.remove(tokens) : tokens);
    }
}
