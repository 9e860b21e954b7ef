package com.bm25index.index;

import com.bm25index.document.Document;
import com.bm25index.query.ScoringEngine;
import com.bm25index.query.SearchHit;
import com.bm25index.query.SearchResult;
import com.bm25index.storage.IndexCodec;
import com.bm25index.text.Tokenizer;
import com.bm25index.text.WhitespaceTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * BM25 索引读取器。
 *
 * load() 只能成功执行一次，之后索引不可变，search 系列方法可被多线程并发调用。
 * 查询分词器必须与构建时一致，否则请直接使用 searchTokenized()。
 */
public final class IndexReader {
    private static final Logger logger = LoggerFactory.getLogger(IndexReader.class);

    private final Tokenizer tokenizer;

    private volatile ReaderState state = ReaderState.UNLOADED;
    private InvertedIndex index;
    private ScoringEngine scoringEngine;

    public IndexReader() {
        this(new WhitespaceTokenizer());
    }

    public IndexReader(Tokenizer tokenizer) {
        if (tokenizer == null) {
            throw new IllegalArgumentException("tokenizer不能为null");
        }
        this.tokenizer = tokenizer;
    }

    /**
     * 创建默认分词器的读取器并加载索引文件。
     */
    public static IndexReader open(Path file) throws IOException {
        IndexReader reader = new IndexReader();
        reader.load(file);
        return reader;
    }

    /**
     * 加载索引文件。失败时读取器保持 UNLOADED。
     *
     * @throws IndexStateException 已加载过索引时抛出
     * @throws IOException 文件无法读取，或格式非法（IndexFormatException 及其子类）
     */
    public synchronized void load(Path file) throws IOException {
        ensureState(ReaderState.UNLOADED, "load");
        long startNanos = System.nanoTime();
        publish(IndexCodec.read(file));
        logger.info("索引已加载: file={}, documents={}, terms={}, elapsedMs={}",
            file, index.getNumDocuments(), index.getNumUniqueTerms(), (System.nanoTime() - startNanos) / 1_000_000);
    }

    /**
     * 从内存中的编码数据加载索引。
     */
    public synchronized void load(byte[] data) throws IOException {
        ensureState(ReaderState.UNLOADED, "load");
        publish(IndexCodec.decode(data));
        logger.debug("索引已从内存加载: bytes={}, documents={}", data.length, index.getNumDocuments());
    }

    /**
     * 直接使用已构建的索引，跳过编解码。
     */
    public synchronized void load(InvertedIndex builtIndex) {
        ensureState(ReaderState.UNLOADED, "load");
        if (builtIndex == null) {
            throw new IllegalArgumentException("builtIndex不能为null");
        }
        publish(builtIndex);
    }

    /**
     * 使用读取器的分词器切分查询后检索。
     */
    public List<SearchHit> search(String queryText, int topK) {
        ensureState(ReaderState.LOADED, "search");
        return scoringEngine.search(tokenizer.tokenize(queryText), topK).hits();
    }

    /**
     * 以已分词的查询检索，词项需与构建时的分词结果精确一致。
     *
     * @return 按得分降序排列的 (键, 得分) 结果
     */
    public List<SearchHit> searchTokenized(List<String> queryTokens, int topK) {
        ensureState(ReaderState.LOADED, "searchTokenized");
        return scoringEngine.search(queryTokens, topK).hits();
    }

    /**
     * 检索并返回匹配总数与耗时。
     */
    public SearchResult searchDetailed(String queryText, int topK) {
        ensureState(ReaderState.LOADED, "searchDetailed");
        return scoringEngine.search(tokenizer.tokenize(queryText), topK);
    }

    public double scoreDocument(List<String> queryTokens, int docId) {
        ensureState(ReaderState.LOADED, "scoreDocument");
        return scoringEngine.scoreDocument(queryTokens, docId);
    }

    public Document<String> document(int docId) {
        ensureState(ReaderState.LOADED, "document");
        return index.document(docId);
    }

    public int documentFrequency(String term) {
        ensureState(ReaderState.LOADED, "documentFrequency");
        return index.documentFrequency(term);
    }

    public IndexStats getStats() {
        ensureState(ReaderState.LOADED, "getStats");
        return index.stats();
    }

    public InvertedIndex getIndex() {
        ensureState(ReaderState.LOADED, "getIndex");
        return index;
    }

    public ReaderState getState() {
        return state;
    }

    /**
     * 先写入索引与评分引擎，最后写 volatile 状态，读线程看到 LOADED 时两者必然可见。
     */
    private void publish(InvertedIndex loadedIndex) {
        this.index = loadedIndex;
        this.scoringEngine = new ScoringEngine(loadedIndex);
        this.state = ReaderState.LOADED;
    }

    private void ensureState(ReaderState expected, String operation) {
        ReaderState current = state;
        if (current != expected) {
            throw new IndexStateException(operation, expected, current);
        }
    }
}
