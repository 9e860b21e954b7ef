package com.bm25index.storage;

import com.bm25index.config.Constants;
import com.bm25index.document.KeyRegistry;
import com.bm25index.index.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetEncoder;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 索引二进制编解码器。
 *
 * 文件布局（大端序，全部长度为 uint32）：
 * <pre>
 * Header:     magic | version | k1 f32 | b f32 | avgdl f32 | num_documents | num_unique_terms
 * KeyMapping: count, count × { doc_id, key_len, key_bytes }
 * DocLengths: count, count × { doc_id, length }
 * Postings:   num_unique_terms × { term_len, term_bytes, num_postings, num_postings × { doc_id, tf } }
 * </pre>
 */
public final class IndexCodec {
    private static final Logger logger = LoggerFactory.getLogger(IndexCodec.class);

    /** KeyMapping 单条记录的最小字节数：doc_id + key_len */
    private static final int MIN_KEY_ENTRY_BYTES = 2 * Integer.BYTES;
    /** DocLengths 单条记录字节数：doc_id + length */
    private static final int DOC_LENGTH_ENTRY_BYTES = 2 * Integer.BYTES;
    /** 单个词项块的最小字节数：term_len + num_postings */
    private static final int MIN_TERM_BLOCK_BYTES = 2 * Integer.BYTES;
    /** 单条倒排项字节数：doc_id + tf */
    private static final int POSTING_ENTRY_BYTES = 2 * Integer.BYTES;

    private IndexCodec() {
    }

    /**
     * 将索引编码为字节数组。对同一逻辑内容的多次编码输出完全相同。
     *
     * @param index 构建完成的索引
     * @return 编码结果
     * @throws IllegalArgumentException 键或词项含孤立代理项，无法无损写出时抛出
     */
    public static byte[] encode(InvertedIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("index不能为null");
        }
        CharsetEncoder utf8Encoder = StrictUtf8.newEncoder();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(estimateSize(index));
        try (DataOutputStream output = new DataOutputStream(bytes)) {
            output.writeInt(Constants.INDEX_MAGIC);
            output.writeInt(Constants.FORMAT_VERSION);
            output.writeFloat((float) index.getK1());
            output.writeFloat((float) index.getB());
            output.writeFloat((float) index.getAvgdl());
            output.writeInt(index.getNumDocuments());
            output.writeInt(index.getNumUniqueTerms());

            KeyRegistry<String> keys = index.getKeys();
            output.writeInt(keys.size());
            for (int docId = 0; docId < keys.size(); docId++) {
                byte[] keyBytes = StrictUtf8.encode(utf8Encoder, keys.resolve(docId), "文档键");
                output.writeInt(docId);
                output.writeInt(keyBytes.length);
                output.write(keyBytes);
            }

            output.writeInt(index.getNumDocuments());
            for (int docId = 0; docId < index.getNumDocuments(); docId++) {
                output.writeInt(docId);
                output.writeInt(index.docLength(docId));
            }

            for (Map.Entry<String, PostingList> entry : index.postingsByTerm().entrySet()) {
                byte[] termBytes = StrictUtf8.encode(utf8Encoder, entry.getKey(), "词项");
                PostingList postingList = entry.getValue();
                output.writeInt(termBytes.length);
                output.write(termBytes);
                output.writeInt(postingList.size());
                for (int position = 0; position < postingList.size(); position++) {
                    output.writeInt(postingList.docId(position));
                    output.writeInt(postingList.termFreq(position));
                }
            }
        } catch (IOException exception) {
            // ByteArrayOutputStream 不会产生 IO 异常
            throw new UncheckedIOException("编码索引失败", exception);
        }
        return bytes.toByteArray();
    }

    /**
     * 从字节数组解码索引。输入视为不可信数据，每个长度字段在消费对应字节前都会校验。
     *
     * @param data 编码后的索引
     * @return 解码得到的不可变索引
     * @throws IndexFormatException magic 不匹配
     * @throws UnsupportedVersionException 版本号不支持
     * @throws CorruptIndexException 数据截断、计数不一致或 ID 非法
     */
    public static InvertedIndex decode(byte[] data) throws IndexFormatException {
        if (data == null) {
            throw new IllegalArgumentException("data不能为null");
        }
        IndexByteReader reader = new IndexByteReader(data);

        long magic = reader.readUint32("magic");
        if (magic != Integer.toUnsignedLong(Constants.INDEX_MAGIC)) {
            throw new IndexFormatException("索引文件 magic 不匹配: 0x" + Long.toHexString(magic));
        }
        long version = reader.readUint32("version");
        if (version != Constants.FORMAT_VERSION) {
            throw new UnsupportedVersionException(version, Constants.FORMAT_VERSION);
        }

        int parameterOffset = reader.position();
        float k1 = reader.readFloat32("k1");
        float b = reader.readFloat32("b");
        float avgdl = reader.readFloat32("avgdl");
        if (!Float.isFinite(k1) || k1 <= 0 || Float.isNaN(b) || b < 0 || b > 1 || !Float.isFinite(avgdl) || avgdl < 0) {
            throw new CorruptIndexException("BM25 参数非法: k1=" + k1 + ", b=" + b + ", avgdl=" + avgdl, parameterOffset);
        }
        int numDocuments = reader.readNonNegativeInt("num_documents");
        int numUniqueTerms = reader.readNonNegativeInt("num_unique_terms");

        String[] keys = readKeyMapping(reader, numDocuments);
        int[] docLengths = readDocLengths(reader, numDocuments);
        Map<String, PostingList> postingsByTerm = readPostings(reader, numDocuments, numUniqueTerms);

        if (reader.remaining() > 0) {
            throw new CorruptIndexException(
                "倒排区之后存在 " + reader.remaining() + " 个未解析字节，与 num_unique_terms=" + numUniqueTerms + " 不一致",
                reader.position());
        }

        return new InvertedIndex(k1, b, avgdl, KeyRegistry.of(Arrays.asList(keys)), docLengths, postingsByTerm);
    }

    /**
     * 编码并写入文件。先写临时文件再替换目标，失败时不会留下半成品。
     *
     * @throws IOException 底层写入失败时原样抛出
     */
    public static void write(InvertedIndex index, Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("索引文件不能为空");
        }
        byte[] encoded = encode(index);
        Path tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.write(tempFile, encoded);
            try {
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException exception) {
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
        logger.debug("索引已写入: file={}, bytes={}", file, encoded.length);
    }

    /**
     * 读取并解码索引文件。
     *
     * @throws IOException 文件不存在或无法读取时原样抛出，格式错误时为 IndexFormatException 及其子类
     */
    public static InvertedIndex read(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("索引文件不能为空");
        }
        byte[] data = Files.readAllBytes(file);
        logger.debug("读取索引文件: file={}, bytes={}", file, data.length);
        return decode(data);
    }

    private static String[] readKeyMapping(IndexByteReader reader, int numDocuments) throws CorruptIndexException {
        int countOffset = reader.position();
        int count = reader.readCount("KeyMapping.count", MIN_KEY_ENTRY_BYTES);
        if (count != numDocuments) {
            throw new CorruptIndexException(
                "KeyMapping 条目数与 num_documents 不一致: " + count + " vs " + numDocuments, countOffset);
        }
        String[] keys = new String[count];
        for (int index = 0; index < count; index++) {
            int entryOffset = reader.position();
            int docId = reader.readNonNegativeInt("KeyMapping.doc_id");
            String key = reader.readLengthPrefixedUtf8("KeyMapping.key");
            if (docId >= count || keys[docId] != null) {
                throw new CorruptIndexException("KeyMapping 文档ID非法或重复: docId=" + docId, entryOffset);
            }
            keys[docId] = key;
        }
        return keys;
    }

    private static int[] readDocLengths(IndexByteReader reader, int numDocuments) throws CorruptIndexException {
        int countOffset = reader.position();
        int count = reader.readCount("DocLengths.count", DOC_LENGTH_ENTRY_BYTES);
        if (count != numDocuments) {
            throw new CorruptIndexException(
                "DocLengths 条目数与 num_documents 不一致: " + count + " vs " + numDocuments, countOffset);
        }
        int[] docLengths = new int[count];
        boolean[] seen = new boolean[count];
        for (int index = 0; index < count; index++) {
            int entryOffset = reader.position();
            int docId = reader.readNonNegativeInt("DocLengths.doc_id");
            int length = reader.readNonNegativeInt("DocLengths.length");
            if (docId >= count || seen[docId]) {
                throw new CorruptIndexException("DocLengths 文档ID非法或重复: docId=" + docId, entryOffset);
            }
            seen[docId] = true;
            docLengths[docId] = length;
        }
        return docLengths;
    }

    private static Map<String, PostingList> readPostings(IndexByteReader reader, int numDocuments, int numUniqueTerms)
            throws CorruptIndexException {
        reader.require((long) numUniqueTerms * MIN_TERM_BLOCK_BYTES, "Postings");
        Map<String, PostingList> postingsByTerm = new LinkedHashMap<>();
        for (int termIndex = 0; termIndex < numUniqueTerms; termIndex++) {
            int termOffset = reader.position();
            String term = reader.readLengthPrefixedUtf8("term");
            if (postingsByTerm.containsKey(term)) {
                throw new CorruptIndexException("词项重复: " + term, termOffset);
            }

            int postingCount = reader.readCount("num_postings", POSTING_ENTRY_BYTES);
            if (postingCount > numDocuments) {
                throw new CorruptIndexException(
                    "倒排长度超过文档总数: term=" + term + ", num_postings=" + postingCount, termOffset);
            }
            int[] docIds = new int[postingCount];
            int[] termFreqs = new int[postingCount];
            for (int position = 0; position < postingCount; position++) {
                int entryOffset = reader.position();
                int docId = reader.readNonNegativeInt("posting.doc_id");
                int termFreq = reader.readNonNegativeInt("posting.term_frequency");
                if (docId >= numDocuments) {
                    throw new CorruptIndexException("倒排引用了不存在的文档: term=" + term + ", docId=" + docId, entryOffset);
                }
                if (position > 0 && docId <= docIds[position - 1]) {
                    throw new CorruptIndexException("倒排文档ID未严格递增: term=" + term + ", docId=" + docId, entryOffset);
                }
                if (termFreq == 0) {
                    throw new CorruptIndexException("词频为 0: term=" + term + ", docId=" + docId, entryOffset);
                }
                docIds[position] = docId;
                termFreqs[position] = termFreq;
            }
            postingsByTerm.put(term, new PostingList(docIds, termFreqs));
        }
        return postingsByTerm;
    }

    private static int estimateSize(InvertedIndex index) {
        long estimate = Constants.HEADER_BYTES + 2L * Integer.BYTES
            + (long) index.getNumDocuments() * (MIN_KEY_ENTRY_BYTES + DOC_LENGTH_ENTRY_BYTES + 16)
            + (long) index.getNumUniqueTerms() * (MIN_TERM_BLOCK_BYTES + 8)
            + index.getTotalPostings() * POSTING_ENTRY_BYTES;
        return (int) Math.min(estimate, Integer.MAX_VALUE - 8);
    }
}
