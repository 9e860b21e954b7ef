package com.bm25index.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 分词器测试
 */
class TokenizerTest {

    @Test
    @DisplayName("空白分词器：转小写并按任意空白切分")
    void testWhitespaceTokenizer() {
        Tokenizer tokenizer = new WhitespaceTokenizer();

        assertEquals(List.of("the", "quick", "brown", "fox"), tokenizer.tokenize("  The Quick\tbrown\n\nFOX "));
    }

    @Test
    @DisplayName("空白分词器不处理标点")
    void testWhitespaceTokenizerKeepsPunctuation() {
        Tokenizer tokenizer = new WhitespaceTokenizer();

        assertEquals(List.of("hello,", "world!"), tokenizer.tokenize("Hello, World!"));
    }

    @Test
    @DisplayName("null或空文本返回空列表")
    void testEmptyInput() {
        assertTrue(new WhitespaceTokenizer().tokenize(null).isEmpty());
        assertTrue(new WhitespaceTokenizer().tokenize("   ").isEmpty());
        assertTrue(new EnglishTokenizer(true).tokenize("").isEmpty());
    }

    @Test
    @DisplayName("英文分词器：按非字母数字切分并丢弃单字符词项")
    void testEnglishTokenizer() {
        Tokenizer tokenizer = new EnglishTokenizer(false);

        assertEquals(List.of("it", "state", "of", "the", "art", "ml", "v2"),
            tokenizer.tokenize("It's state-of-the-art ML, v2!"));
    }

    @Test
    @DisplayName("英文分词器开启停用词过滤")
    void testEnglishTokenizerWithStopWords() {
        Tokenizer tokenizer = new EnglishTokenizer(true);

        assertEquals(List.of("quick", "fox", "jumps", "lazy", "dog"),
            tokenizer.tokenize("The quick fox jumps to the lazy dog"));
    }

    @Test
    @DisplayName("停用词判断大小写不敏感")
    void testStopWords() {
        assertTrue(StopWords.isStopWord("The"));
        assertFalse(StopWords.isStopWord("search"));
        assertFalse(StopWords.isStopWord(null));
        assertEquals(List.of("index"), StopWords.remove(List.of("an", "index", "OF")));
    }

    @Test
    @DisplayName("按类型创建分词器")
    void testTokenizerTypeCreate() {
        assertInstanceOf(WhitespaceTokenizer.class, TokenizerType.WHITESPACE.create(true));
        assertInstanceOf(EnglishTokenizer.class, TokenizerType.ENGLISH.create(false));
        assertEquals(List.of("quick"), TokenizerType.ENGLISH.create(true).tokenize("the quick"));
    }

    @Test
    @DisplayName("空白分词器识别Unicode空白与信息分隔符")
    void testWhitespaceTokenizerUnicodeWhitespace() {
        Tokenizer tokenizer = new WhitespaceTokenizer();

        assertEquals(List.of("alpha", "beta", "gamma", "delta", "epsilon"),
            tokenizer.tokenize("alpha\u00A0beta\u3000gamma\u2003delta\u001Fepsilon"));
        // 零宽空格不是空白
        assertEquals(List.of("a\u200Bb"), tokenizer.tokenize("a\u200Bb"));
    }
}
