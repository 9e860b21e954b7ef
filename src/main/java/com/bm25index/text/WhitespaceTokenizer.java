package com.bm25index.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 默认分词器：整体转小写后按空白切分，不做任何标点处理。
 *
 * 空白包含 Unicode 空白（如 U+00A0、U+3000）以及 U+001C 至 U+001F 分隔符。
 */
public class WhitespaceTokenizer implements Tokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("(?U)[\\s\\x1C-\\x1F]+");

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        String[] pieces = WHITESPACE.split(text.toLowerCase(Locale.ROOT));
        List<String> tokens = new ArrayList<>(pieces.length);
        for (String piece : pieces) {
            // 前导空白会产生一个空片段
            if (!piece.isEmpty()) {
                tokens.add(piece);
            }
        }
        return List.copyOf(tokens);
    }
}
