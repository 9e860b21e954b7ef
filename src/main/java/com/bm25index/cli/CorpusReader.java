package com.bm25index.cli;

import com.bm25index.index.IndexBuilder;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 流式读取 JSON 语料并逐篇送入构建器，不在内存中保留整个语料。
 *
 * 语料为一个 JSON 对象，字段名即文档键，值为原文字符串（使用构建器的分词器）或已分词的字符串数组。
 */
final class CorpusReader {
    private final JsonFactory jsonFactory;

    CorpusReader(JsonFactory jsonFactory) {
        this.jsonFactory = jsonFactory;
    }

    /**
     * @return 读取的文档数
     * @throws IOException 文件无法读取或 JSON 结构不符合要求时抛出
     */
    int readInto(Path corpusFile, IndexBuilder<String> builder) throws IOException {
        int documentCount = 0;
        try (JsonParser parser = jsonFactory.createParser(corpusFile.toFile())) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("语料文件必须是 JSON 对象: " + corpusFile);
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String key = parser.currentName();
                JsonToken valueToken = parser.nextToken();
                if (valueToken == JsonToken.VALUE_STRING) {
                    builder.add(key, parser.getText());
                } else if (valueToken == JsonToken.START_ARRAY) {
                    builder.addTokenized(key, readTokens(parser, key));
                } else {
                    throw new IOException("文档值必须是字符串或字符串数组: key=" + key + ", token=" + valueToken);
                }
                documentCount++;
            }
        }
        return documentCount;
    }

    private List<String> readTokens(JsonParser parser, String key) throws IOException {
        List<String> tokens = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token != JsonToken.VALUE_STRING) {
                throw new IOException("词项必须是字符串: key=" + key + ", token=" + token);
            }
            tokens.add(parser.getText());
        }
        return tokens;
    }
}
