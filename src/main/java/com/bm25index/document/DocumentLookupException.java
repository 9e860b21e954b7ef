package com.bm25index.document;

/**
 * 文档ID未在键注册表中登记时抛出。构建完成或解码校验后的索引不应出现此情况，出现即视为数据损坏。
 */
public class DocumentLookupException extends RuntimeException {
    private final int docId;

    public DocumentLookupException(int docId, int registeredCount) {
        super("文档不存在: docId=" + docId + ", 已登记文档数=" + registeredCount);
        this.docId = docId;
    }

    public int getDocId() {
        return docId;
    }
}
