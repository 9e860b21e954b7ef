package com.bm25index.config;

import com.bm25index.text.TokenizerType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 索引运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class IndexConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private double k1 = Constants.BM25_K1;
    private double b = Constants.BM25_B;
    private int topK = Constants.DEFAULT_TOP_K;
    private TokenizerType tokenizer = TokenizerType.WHITESPACE;
    private boolean stopWords;

    public double getK1() {
        return k1;
    }

    public void setK1(double k1) {
        this.k1 = k1;
    }

    public double getB() {
        return b;
    }

    public void setB(double b) {
        this.b = b;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public TokenizerType getTokenizer() {
        return tokenizer;
    }

    public void setTokenizer(TokenizerType tokenizer) {
        this.tokenizer = tokenizer;
    }

    public boolean isStopWords() {
        return stopWords;
    }

    public void setStopWords(boolean stopWords) {
        this.stopWords = stopWords;
    }

    /**
     * 校验 BM25 参数取值范围。
     *
     * 索引文件以 float32 保存参数，k1 按 float 精度检查，溢出为 Infinity 或下溢为 0 的值同样非法。
     *
     * @return 当前实例，便于链式调用
     * @throws ConfigException k1 非正或非有限值、b 不在 [0,1] 区间、tokenizer 为空时抛出
     */
    public IndexConfig validate() {
        if (!Double.isFinite(k1) || k1 <= 0) {
            throw new ConfigException("k1 必须为正有限数: " + k1);
        }
        float storedK1 = (float) k1;
        if (Float.isInfinite(storedK1) || storedK1 <= 0) {
            throw new ConfigException("k1 超出 float32 可表示范围: " + k1);
        }
        if (Double.isNaN(b) || b < 0 || b > 1) {
            throw new ConfigException("b 必须位于 [0,1] 区间: " + b);
        }
        if (tokenizer == null) {
            throw new ConfigException("tokenizer 不能为空");
        }
        return this;
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexConfig defaults() {
        return new IndexConfig();
    }

    /**
     * 以给定 BM25 参数创建配置，其余字段取默认值。
     */
    public static IndexConfig of(double k1, double b) {
        IndexConfig config = new IndexConfig();
        config.setK1(k1);
        config.setB(b);
        return config;
    }

    /**
     * 从 JSON 配置文件读取并校验配置，未出现的字段保留默认值。
     *
     * @param file 配置文件
     * @return 校验通过的配置
     * @throws IOException 文件不存在或无法读取时抛出
     * @throws ConfigException 内容无法解析或取值非法时抛出
     */
    public static IndexConfig load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        byte[] content = Files.readAllBytes(file);
        IndexConfig config;
        try {
            config = OBJECT_MAPPER.readValue(content, IndexConfig.class);
        } catch (IOException exception) {
            throw new ConfigException("解析配置文件失败: " + file.toAbsolutePath(), exception);
        }
        return config.validate();
    }
}
