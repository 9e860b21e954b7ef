package com.bm25index.index;

/**
 * 没有任何文档时无法定义平均文档长度，build() 抛出此异常。
 */
public class EmptyIndexException extends IllegalStateException {

    public EmptyIndexException() {
        super("索引中没有任何文档，无法计算平均文档长度");
    }
}
