package com.bm25index.config;

/**
 * 配置参数非法时抛出，例如 k1 非正数或 b 不在 [0,1] 区间。
 */
public class ConfigException extends IllegalArgumentException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
