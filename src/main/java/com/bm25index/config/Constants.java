package com.bm25index.config;

/**
 * 全局常量定义
 *
 * 包含索引文件格式魔数、BM25默认参数和查询限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 存储格式 ====================
    /** 索引文件魔数 "BM25" */
    public static final int INDEX_MAGIC = 0x424D3235;
    /** 当前写出的文件格式版本号 */
    public static final int FORMAT_VERSION = 1;
    /** 文件头字节数：magic、version、k1、b、avgdl、文档数、词项数 */
    public static final int HEADER_BYTES = 7 * Integer.BYTES;

    // ==================== BM25参数 ====================
    /** 词频饱和系数 */
    public static final double BM25_K1 = 1.5;
    /** 长度归一化系数 */
    public static final double BM25_B = 0.75;

    // ==================== 查询参数 ====================
    /** 默认返回结果数 */
    public static final int DEFAULT_TOP_K = 10;
    /** CLI 单次查询结果上限 */
    public static final int MAX_SEARCH_LIMIT = 1000;
    /** CLI 查询字符串长度上限 */
    public static final int MAX_QUERY_LENGTH = 1024;
}
