package com.bm25index.integration;

import com.bm25index.index.IndexBuilder;
import com.bm25index.index.IndexReader;
import com.bm25index.index.IndexStats;
import com.bm25index.query.SearchHit;
import com.bm25index.storage.PostingList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 索引集成测试
 *
 * 覆盖完整流程：添加文档 → 构建 → 保存 → 加载 → 检索
 */
class IndexIntegrationTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("构建、保存、加载后检索，同时包含两个查询词的文档排第一")
    void testBuildSaveLoadSearch() throws IOException {
        IndexBuilder<String> builder = IndexBuilder.create();
        builder.add("doc1", "machine learning algorithms");
        builder.add("doc2", "deep learning neural networks");
        builder.add("doc3", "database systems and indexing");
        builder.build();
        Path indexFile = tempDir.resolve("corpus.bm25");
        builder.save(indexFile);

        IndexReader reader = IndexReader.open(indexFile);
        List<SearchHit> hits = reader.search("machine learning", 10);

        assertEquals("doc1", hits.get(0).key());
        assertEquals("doc2", hits.get(1).key());
        assertEquals(2, hits.size());
        assertTrue(hits.get(0).score() > hits.get(1).score());
    }

    @Test
    @DisplayName("加载后的统计与构建时一致（浮点参数为float32精度）")
    void testStatsSurviveRoundTrip() throws IOException {
        IndexBuilder<String> builder = IndexBuilder.create(1.2, 0.6);
        builder.add("a", "one two three");
        builder.add("b", "two three");
        builder.add("c", "three");
        builder.build();
        Path indexFile = tempDir.resolve("stats.bm25");
        builder.save(indexFile);

        IndexStats built = builder.getStats();
        IndexStats loaded = IndexReader.open(indexFile).getStats();

        assertEquals(built.numDocuments(), loaded.numDocuments());
        assertEquals(built.numUniqueTerms(), loaded.numUniqueTerms());
        assertEquals(built.totalPostings(), loaded.totalPostings());
        assertEquals((float) built.averageDocumentLength(), (float) loaded.averageDocumentLength());
        assertEquals((float) built.k1(), (float) loaded.k1());
        assertEquals((float) built.b(), (float) loaded.b());
    }

    @Test
    @DisplayName("超长键与空文档可以完整往返")
    void testLongKeysAndEmptyDocuments() throws IOException {
        String longKey = "k".repeat(70_000) + "/终";
        IndexBuilder<String> builder = IndexBuilder.create();
        builder.add(longKey, "payload term");
        builder.add("empty", "   ");
        builder.build();
        Path indexFile = tempDir.resolve("long.bm25");
        builder.save(indexFile);

        IndexReader reader = IndexReader.open(indexFile);

        assertEquals(longKey, reader.search("payload", 1).get(0).key());
        assertEquals(0, reader.document(1).length());
        assertEquals(1.0, reader.getStats().averageDocumentLength());
    }

    @Test
    @DisplayName("随机语料：长度守恒且加载前后检索结果一致")
    void testRandomCorpusConsistency() throws IOException {
        Random random = new Random(42);
        IndexBuilder<String> builder = IndexBuilder.create();
        long totalLength = 0;
        for (int docId = 0; docId < 300; docId++) {
            List<String> tokens = new ArrayList<>();
            int length = random.nextInt(30);
            for (int position = 0; position < length; position++) {
                tokens.add("w" + random.nextInt(200));
            }
            totalLength += length;
            builder.addTokenized("doc-" + docId, tokens);
        }
        builder.build();
        Path indexFile = tempDir.resolve("random.bm25");
        builder.save(indexFile);

        IndexReader inMemory = new IndexReader();
        inMemory.load(builder.toIndex());
        IndexReader fromDisk = IndexReader.open(indexFile);

        long frequencySum = fromDisk.getIndex().postingsByTerm().values().stream()
            .mapToLong(PostingList::totalTermFreq)
            .sum();
        assertEquals(totalLength, frequencySum);
        assertEquals((float) ((double) totalLength / 300), (float) fromDisk.getStats().averageDocumentLength());

        List<String> query = List.of("w1", "w17", "w150", "w199");
        List<SearchHit> expected = inMemory.searchTokenized(query, 25);
        List<SearchHit> actual = fromDisk.searchTokenized(query, 25);
        // 文件中的 avgdl 为 float32，得分只在精度范围内一致
        assertEquals(expected.size(), actual.size());
        for (SearchHit hit : expected) {
            assertEquals(hit.score(), fromDisk.scoreDocument(query, hit.docId()), 1e-4);
        }
    }

    @Test
    @DisplayName("覆盖已有索引文件")
    void testOverwriteExistingIndex() throws IOException {
        Path indexFile = tempDir.resolve("overwrite.bm25");
        Files.writeString(indexFile, "stale");

        IndexBuilder<String> builder = IndexBuilder.create();
        builder.add("fresh", "new content");
        builder.build();
        builder.save(indexFile);

        assertEquals("fresh", IndexReader.open(indexFile).search("content", 5).get(0).key());
    }
}
