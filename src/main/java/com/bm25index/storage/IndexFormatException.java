package com.bm25index.storage;

import java.io.IOException;

/**
 * 输入不是合法的 BM25 索引文件时抛出，例如 magic 不匹配。
 *
 * 版本不支持与数据损坏分别由子类表示，调用方可统一按"不是有效索引"处理。
 */
public class IndexFormatException extends IOException {

    public IndexFormatException(String message) {
        super(message);
    }

    public IndexFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
