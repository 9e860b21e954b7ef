package com.bm25index.index;

/**
 * 在错误的生命周期阶段调用 API 时抛出，例如 build() 之后继续添加文档、build() 之前保存、load() 之前查询。
 */
public class IndexStateException extends IllegalStateException {
    private final Enum<?> expectedState;
    private final Enum<?> actualState;

    public IndexStateException(String operation, Enum<?> expectedState, Enum<?> actualState) {
        super(operation + " 要求状态 " + expectedState + "，当前状态 " + actualState);
        this.expectedState = expectedState;
        this.actualState = actualState;
    }

    public Enum<?> getExpectedState() {
        return expectedState;
    }

    public Enum<?> getActualState() {
        return actualState;
    }
}
