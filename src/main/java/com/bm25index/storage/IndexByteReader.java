package com.bm25index.storage;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 带边界检查的大端字节读取器，任何越界读取都转换为 CorruptIndexException。
 */
final class IndexByteReader {
    private final ByteBuffer buffer;
    private final CharsetDecoder utf8Decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);

    IndexByteReader(byte[] data) {
        // ByteBuffer 默认即为大端序
        this.buffer = ByteBuffer.wrap(data);
    }

    int position() {
        return buffer.position();
    }

    int remaining() {
        return buffer.remaining();
    }

    /**
     * 确认剩余字节足够，否则抛出损坏异常。
     */
    void require(long byteCount, String field) throws CorruptIndexException {
        if (byteCount > buffer.remaining()) {
            throw new CorruptIndexException(
                "数据被截断: 读取 " + field + " 需要 " + byteCount + " 字节，剩余 " + buffer.remaining(), buffer.position());
        }
    }

    long readUint32(String field) throws CorruptIndexException {
        require(Integer.BYTES, field);
        return Integer.toUnsignedLong(buffer.getInt());
    }

    float readFloat32(String field) throws CorruptIndexException {
        require(Float.BYTES, field);
        return buffer.getFloat();
    }

    /**
     * 读取可用 int 表示的非负 uint32，例如文档ID、长度与词频。
     */
    int readNonNegativeInt(String field) throws CorruptIndexException {
        int start = buffer.position();
        long value = readUint32(field);
        if (value > Integer.MAX_VALUE) {
            throw new CorruptIndexException(field + " 超出支持范围: " + value, start);
        }
        return (int) value;
    }

    /**
     * 读取元素个数，并确认剩余字节至少能容纳 count 个最小尺寸的元素，避免按伪造计数分配内存。
     */
    int readCount(String field, int minBytesPerEntry) throws CorruptIndexException {
        int start = buffer.position();
        int count = readNonNegativeInt(field);
        if ((long) count * minBytesPerEntry > buffer.remaining()) {
            throw new CorruptIndexException(
                "数据被截断: " + field + "=" + count + " 需要至少 " + ((long) count * minBytesPerEntry)
                    + " 字节，剩余 " + buffer.remaining(), start);
        }
        return count;
    }

    /**
     * 读取长度前缀 + UTF-8 字节，长度在消费字节前完成校验。
     */
    String readLengthPrefixedUtf8(String field) throws CorruptIndexException {
        int length = readNonNegativeInt(field + "长度");
        require(length, field);
        int start = buffer.position();
        ByteBuffer slice = buffer.slice();
        slice.limit(length);
        buffer.position(start + length);
        try {
            return utf8Decoder.decode(slice).toString();
        } catch (CharacterCodingException exception) {
            throw new CorruptIndexException(field + " 不是合法的 UTF-8", start, exception);
        }
    }
}
