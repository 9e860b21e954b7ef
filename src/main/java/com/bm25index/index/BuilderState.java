package com.bm25index.index;

/**
 * 构建器生命周期：OPEN 阶段可添加文档，build() 后进入 BUILT，只能保存与查看统计。
 */
public enum BuilderState {
    OPEN,
    BUILT
}
