package com.bm25index.text;

/**
 * 可通过配置或命令行选择的内置分词器。
 */
public enum TokenizerType {
    /** 小写 + 空白切分，与索引默认行为一致 */
    WHITESPACE,
    /** 按非字母数字切分，可选停用词过滤 */
    ENGLISH;

    /**
     * 创建对应的分词器实例。
     *
     * @param stopWords 是否过滤英文停用词，仅 ENGLISH 生效
     * @return 分词器
     */
    public Tokenizer create(boolean stopWords) {
        return switch (this) {
            case WHITESPACE -> new WhitespaceTokenizer();
            case ENGLISH -> new EnglishTokenizer(stopWords);
        };
    }
}
