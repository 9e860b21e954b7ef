package com.bm25index.index;

import com.bm25index.config.IndexConfig;
import com.bm25index.document.KeyFormatter;
import com.bm25index.document.KeyRegistry;
import com.bm25index.storage.IndexCodec;
import com.bm25index.storage.StrictUtf8;
import com.bm25index.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * BM25 索引构建器。
 *
 * 文档逐篇提交后立即折叠为词频与长度统计，不保留原文；build() 冻结倒排并计算平均文档长度，
 * 之后只能保存或查看统计。同一个键重复添加会得到两篇独立文档。非线程安全。
 *
 * @param <K> 文档键类型
 */
public final class IndexBuilder<K> {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final double k1;
    private final double b;
    private final Tokenizer tokenizer;
    private final KeyFormatter<? super K> keyFormatter;
    private final KeyRegistry<K> keyRegistry = new KeyRegistry<>();
    private final PostingsAggregator aggregator = new PostingsAggregator();

    private BuilderState state = BuilderState.OPEN;
    private InvertedIndex builtIndex;

    /**
     * @param config BM25 参数，构造时校验
     * @param tokenizer add() 使用的分词器
     * @param keyFormatter 键到字符串的转换，保存时使用
     * @throws com.bm25index.config.ConfigException 参数非法时抛出
     */
    public IndexBuilder(IndexConfig config, Tokenizer tokenizer, KeyFormatter<? super K> keyFormatter) {
        if (config == null || tokenizer == null || keyFormatter == null) {
            throw new IllegalArgumentException("config、tokenizer与keyFormatter不能为null");
        }
        config.validate();
        this.k1 = config.getK1();
        this.b = config.getB();
        this.tokenizer = tokenizer;
        this.keyFormatter = keyFormatter;
    }

    /**
     * 默认参数、默认分词器、字符串键。
     */
    public static IndexBuilder<String> create() {
        return create(IndexConfig.defaults());
    }

    /**
     * 使用配置中的 BM25 参数与分词器，字符串键。
     */
    public static IndexBuilder<String> create(IndexConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config不能为null");
        }
        config.validate();
        return new IndexBuilder<>(config, config.getTokenizer().create(config.isStopWords()), KeyFormatter.identity());
    }

    public static IndexBuilder<String> create(double k1, double b) {
        return create(IndexConfig.of(k1, b));
    }

    /**
     * 分词后添加文档。
     *
     * @return 新文档ID
     */
    public int add(K key, String text) {
        ensureState(BuilderState.OPEN, "add");
        return addTokenized(key, tokenizer.tokenize(text));
    }

    /**
     * 添加已分词的文档，词项按原样参与索引，区分大小写。
     *
     * @param key 文档键
     * @param tokens 有序词项，文档长度即其元素个数
     * @return 新文档ID
     * @throws IndexStateException build() 之后调用时抛出
     * @throws IllegalArgumentException 键或词项无法无损写入索引时抛出，构建器状态不变
     */
    public int addTokenized(K key, List<String> tokens) {
        ensureState(BuilderState.OPEN, "addTokenized");
        if (key == null || tokens == null) {
            throw new IllegalArgumentException("key与tokens不能为null");
        }
        String keyString = keyFormatter.toKeyString(key);
        if (keyString == null) {
            throw new IllegalArgumentException("键的字符串表示不能为null: " + key);
        }
        StrictUtf8.requireEncodable(keyString, "文档键");
        // 先记录词频再登记键，词项非法时两者都不变
        int docId = keyRegistry.size();
        aggregator.record(docId, tokens);
        keyRegistry.register(key);
        return docId;
    }

    /**
     * 冻结索引。
     *
     * @throws IndexStateException 重复调用时抛出
     * @throws EmptyIndexException 没有任何文档时抛出，构建器保持 OPEN
     */
    public void build() {
        ensureState(BuilderState.OPEN, "build");
        long startNanos = System.nanoTime();
        KeyRegistry<String> formattedKeys = keyRegistry.format(keyFormatter);
        PostingsAggregator.FinalizedPostings finalized = aggregator.finish();
        builtIndex = new InvertedIndex(k1, b, finalized.avgdl(), formattedKeys, finalized.docLengths(), finalized.postingsByTerm());
        state = BuilderState.BUILT;
        logger.info("索引构建完成: documents={}, terms={}, postings={}, avgdl={}, elapsedMs={}",
            builtIndex.getNumDocuments(), builtIndex.getNumUniqueTerms(), builtIndex.getTotalPostings(),
            builtIndex.getAvgdl(), (System.nanoTime() - startNanos) / 1_000_000);
    }

    /**
     * 将索引写入文件。
     *
     * @throws IndexStateException build() 之前调用时抛出
     * @throws IOException 写入失败时原样抛出
     */
    public void save(Path file) throws IOException {
        ensureState(BuilderState.BUILT, "save");
        IndexCodec.write(builtIndex, file);
        logger.info("索引已保存: {}", file);
    }

    /**
     * 编码为字节数组。
     */
    public byte[] toBytes() {
        ensureState(BuilderState.BUILT, "toBytes");
        return IndexCodec.encode(builtIndex);
    }

    public IndexStats getStats() {
        ensureState(BuilderState.BUILT, "getStats");
        return builtIndex.stats();
    }

    /**
     * 返回构建完成的索引，可直接交给 ScoringEngine 或 IndexReader 使用。
     */
    public InvertedIndex toIndex() {
        ensureState(BuilderState.BUILT, "toIndex");
        return builtIndex;
    }

    /**
     * 调用方原始键，保存后只保留其字符串形式。
     */
    public K keyOf(int docId) {
        return keyRegistry.resolve(docId);
    }

    /**
     * 已添加文档的长度。
     */
    public int docLength(int docId) {
        return state == BuilderState.BUILT ? builtIndex.docLength(docId) : aggregator.docLength(docId);
    }

    public int documentCount() {
        return keyRegistry.size();
    }

    public BuilderState getState() {
        return state;
    }

    public double getK1() {
        return k1;
    }

    public double getB() {
        return b;
    }

    private void ensureState(BuilderState expected, String operation) {
        if (state != expected) {
            throw new IndexStateException(operation, expected, state);
        }
    }
}
