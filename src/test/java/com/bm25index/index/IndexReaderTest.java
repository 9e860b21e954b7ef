package com.bm25index.index;

import com.bm25index.query.SearchHit;
import com.bm25index.storage.CorruptIndexException;
import com.bm25index.storage.IndexFormatException;
import com.bm25index.text.EnglishTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 索引读取器测试
 */
class IndexReaderTest {

    @TempDir
    Path tempDir;

    private Path indexFile;

    @BeforeEach
    void setUp() throws Exception {
        IndexBuilder<String> builder = IndexBuilder.create();
        builder.add("doc1", "machine learning algorithms");
        builder.add("doc2", "deep learning neural networks");
        builder.add("doc3", "database systems");
        builder.build();
        indexFile = tempDir.resolve("index.bm25");
        builder.save(indexFile);
    }

    @Test
    @DisplayName("加载前检索抛出IndexStateException")
    void testSearchBeforeLoad() {
        IndexReader reader = new IndexReader();

        assertEquals(ReaderState.UNLOADED, reader.getState());
        IndexStateException exception = assertThrows(IndexStateException.class, () -> reader.search("learning", 5));
        assertEquals(ReaderState.LOADED, exception.getExpectedState());
        assertThrows(IndexStateException.class, reader::getStats);
    }

    @Test
    @DisplayName("加载后检索")
    void testLoadAndSearch() throws Exception {
        IndexReader reader = IndexReader.open(indexFile);

        List<SearchHit> hits = reader.search("Machine Learning", 10);

        assertEquals(ReaderState.LOADED, reader.getState());
        assertEquals("doc1", hits.get(0).key());
        assertEquals(2, hits.size());
        assertEquals(3, reader.getStats().numDocuments());
        assertEquals(2, reader.documentFrequency("learning"));
        assertEquals("doc3", reader.document(2).key());
        assertEquals(2, reader.document(2).length());
    }

    @Test
    @DisplayName("searchTokenized不经过分词器")
    void testSearchTokenized() throws Exception {
        IndexReader reader = IndexReader.open(indexFile);

        assertTrue(reader.searchTokenized(List.of("Machine"), 10).isEmpty());
        assertEquals("doc1", reader.searchTokenized(List.of("machine"), 10).get(0).key());
    }

    @Test
    @DisplayName("重复加载抛出IndexStateException")
    void testDoubleLoad() throws Exception {
        IndexReader reader = IndexReader.open(indexFile);

        assertThrows(IndexStateException.class, () -> reader.load(indexFile));
    }

    @Test
    @DisplayName("文件不存在时原样抛出IO异常，读取器保持UNLOADED")
    void testLoadMissingFile() {
        IndexReader reader = new IndexReader();

        assertThrows(NoSuchFileException.class, () -> reader.load(tempDir.resolve("missing.bm25")));
        assertEquals(ReaderState.UNLOADED, reader.getState());
    }

    @Test
    @DisplayName("加载损坏文件失败后可重新加载有效索引")
    void testLoadCorruptThenValid() throws Exception {
        Path corrupt = tempDir.resolve("corrupt.bm25");
        byte[] valid = Files.readAllBytes(indexFile);
        Files.write(corrupt, Arrays.copyOf(valid, valid.length - 3));
        IndexReader reader = new IndexReader();

        assertThrows(CorruptIndexException.class, () -> reader.load(corrupt));
        assertEquals(ReaderState.UNLOADED, reader.getState());

        reader.load(indexFile);
        assertEquals(ReaderState.LOADED, reader.getState());
    }

    @Test
    @DisplayName("非索引文件抛出IndexFormatException")
    void testLoadNonIndexFile() throws Exception {
        Path textFile = tempDir.resolve("notes.txt");
        Files.writeString(textFile, "just some text, not an index");

        assertThrows(IndexFormatException.class, () -> new IndexReader().load(textFile));
    }

    @Test
    @DisplayName("从内存字节与已构建索引加载，结果与文件加载一致")
    void testLoadFromBytesAndIndex() throws Exception {
        IndexReader fromFile = IndexReader.open(indexFile);
        IndexReader fromBytes = new IndexReader();
        fromBytes.load(Files.readAllBytes(indexFile));

        assertEquals(fromFile.search("learning", 10), fromBytes.search("learning", 10));

        IndexReader fromIndex = new IndexReader();
        fromIndex.load(fromFile.getIndex());
        assertEquals(fromFile.search("learning", 10), fromIndex.search("learning", 10));
    }

    @Test
    @DisplayName("自定义查询分词器")
    void testCustomTokenizer() throws Exception {
        IndexReader reader = new IndexReader(new EnglishTokenizer(false));
        reader.load(indexFile);

        assertEquals("doc3", reader.search("database-systems!", 10).get(0).key());
    }

    @Test
    @DisplayName("多线程并发检索结果一致")
    void testConcurrentSearch() throws Exception {
        IndexReader reader = IndexReader.open(indexFile);
        List<SearchHit> expected = reader.search("learning systems", 10);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<SearchHit>>> futures = new ArrayList<>();
            for (int task = 0; task < 32; task++) {
                futures.add(executor.submit(() -> reader.search("learning systems", 10)));
            }
            for (Future<List<SearchHit>> future : futures) {
                assertEquals(expected, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("scoreDocument与search得分一致，未命中文档得分为0")
    void testScoreDocument() throws Exception {
        IndexReader reader = IndexReader.open(indexFile);
        SearchHit top = reader.search("learning", 1).get(0);

        assertEquals(top.score(), reader.scoreDocument(List.of("learning"), top.docId()));
        assertEquals(0.0, reader.scoreDocument(Collections.singletonList("learning"), 2));
    }
}
