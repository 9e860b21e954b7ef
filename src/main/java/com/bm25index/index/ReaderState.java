package com.bm25index.index;

/**
 * 读取器生命周期：加载成功后进入 LOADED，此后索引不可变。
 */
public enum ReaderState {
    UNLOADED,
    LOADED
}
