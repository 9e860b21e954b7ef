package com.bm25index.storage;

/**
 * 索引数据被截断或内部计数、ID 不一致。
 */
public class CorruptIndexException extends IndexFormatException {
    private final long offset;

    public CorruptIndexException(String message, long offset) {
        super(message + ", offset=" + offset);
        this.offset = offset;
    }

    public CorruptIndexException(String message, long offset, Throwable cause) {
        super(message + ", offset=" + offset, cause);
        this.offset = offset;
    }

    /**
     * 检测到损坏时的字节偏移。
     */
    public long getOffset() {
        return offset;
    }
}
