package com.bm25index.document;

/**
 * 文档键到稳定字符串表示的转换能力，索引文件只保存键的 UTF-8 字符串。
 *
 * @param <K> 调用方的文档键类型
 */
@FunctionalInterface
public interface KeyFormatter<K> {

    /**
     * 返回键的稳定字符串表示，同一键多次调用必须得到相同结果。
     */
    String toKeyString(K key);

    /**
     * 字符串键原样输出。
     */
    static KeyFormatter<String> identity() {
        return key -> key;
    }

    /**
     * 使用 {@link Object#toString()}，适用于整数、UUID、Path 等具有稳定字符串形式的值类型。
     */
    static <K> KeyFormatter<K> toStringFormatter() {
        return String::valueOf;
    }
}
