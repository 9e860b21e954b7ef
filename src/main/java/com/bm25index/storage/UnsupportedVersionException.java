package com.bm25index.storage;

/**
 * 索引文件版本号不受当前读取器支持。
 */
public class UnsupportedVersionException extends IndexFormatException {
    private final long version;

    public UnsupportedVersionException(long version, int supportedVersion) {
        super("索引文件版本不支持: " + version + ", 支持的版本=" + supportedVersion);
        this.version = version;
    }

    public long getVersion() {
        return version;
    }
}
