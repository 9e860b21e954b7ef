package com.bm25index.document;

import com.bm25index.storage.StrictUtf8;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 文档键与连续整数ID之间的双向映射。
 *
 * ID 从 0 开始按登记顺序分配，每次登记都分配新ID；同一个键登记两次会得到两个不同的ID。
 * 非线程安全。
 *
 * @param <K> 文档键类型
 */
public final class KeyRegistry<K> {
    private final List<K> keysById;

    public KeyRegistry() {
        this.keysById = new ArrayList<>();
    }

    private KeyRegistry(List<K> keysById) {
        this.keysById = keysById;
    }

    /**
     * 按 ID 顺序给出的键列表构建注册表，第 i 个键对应 docId=i。
     */
    public static <K> KeyRegistry<K> of(List<K> keysInIdOrder) {
        if (keysInIdOrder == null) {
            throw new IllegalArgumentException("keysInIdOrder不能为null");
        }
        return new KeyRegistry<>(new ArrayList<>(keysInIdOrder));
    }

    /**
     * 登记文档键并分配下一个连续ID。
     *
     * @param key 文档键
     * @return 新分配的文档ID
     * @throws IllegalStateException 文档数超过 int 可表示的ID范围时抛出
     */
    public int register(K key) {
        if (key == null) {
            throw new IllegalArgumentException("文档键不能为null");
        }
        if (keysById.size() == Integer.MAX_VALUE) {
            throw new IllegalStateException("文档数量超过上限: " + Integer.MAX_VALUE);
        }
        int docId = keysById.size();
        keysById.add(key);
        return docId;
    }

    /**
     * 查找文档ID对应的键。
     *
     * @throws DocumentLookupException docId 未登记时抛出
     */
    public K resolve(int docId) {
        if (!contains(docId)) {
            throw new DocumentLookupException(docId, keysById.size());
        }
        return keysById.get(docId);
    }

    public boolean contains(int docId) {
        return docId >= 0 && docId < keysById.size();
    }

    public int size() {
        return keysById.size();
    }

    /**
     * 返回按 ID 升序排列的只读键视图。
     */
    public List<K> keys() {
        return Collections.unmodifiableList(keysById);
    }

    /**
     * 将全部键转换为字符串形式，得到可序列化的注册表，ID 保持不变。
     *
     * @throws IllegalArgumentException 字符串形式为 null 或含孤立代理项时抛出
     */
    public KeyRegistry<String> format(KeyFormatter<? super K> formatter) {
        if (formatter == null) {
            throw new IllegalArgumentException("formatter不能为null");
        }
        List<String> formatted = new ArrayList<>(keysById.size());
        for (int docId = 0; docId < keysById.size(); docId++) {
            String keyString = formatter.toKeyString(keysById.get(docId));
            if (keyString == null) {
                throw new IllegalArgumentException("键的字符串表示不能为null, docId=" + docId);
            }
            StrictUtf8.requireEncodable(keyString, "文档键, docId=" + docId);
            formatted.add(keyString);
        }
        return new KeyRegistry<>(formatted);
    }
}
