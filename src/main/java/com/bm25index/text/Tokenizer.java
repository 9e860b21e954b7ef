package com.bm25index.text;

import java.util.List;

@FunctionalInterface
public interface Tokenizer {

    /**
     * 将输入文本切分为有序词项列表，null 或空文本返回空列表。
     */
    List<String> tokenize(String text);
}
