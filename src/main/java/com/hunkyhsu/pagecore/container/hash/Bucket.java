package com.hunkyhsu.pagecore.container.hash;

import lombok.Getter;

import java.util.AbstractMap.SimpleEntry;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bucket - 可扩展哈希表的桶
 *
 * <p>最多保存 {@code capacity} 个 key/value 对（key 唯一），按插入顺序排列。
 * 满了以后只能由 {@link ExtendibleHashTable} 分裂，桶本身不会扩容。
 *
 * <p>本类不是线程安全的，只在哈希表的锁保护下访问。
 *
 * @param <K> key 类型
 * @param <V> value 类型
 * @author hunkyhsu
 */
public class Bucket<K, V> {

    @Getter
    private final int capacity;

    /**
     * local depth：区分本桶内容所用的低位 hash 位数
     */
    @Getter
    private final int depth;

    private final List<Map.Entry<K, V>> items;

    public Bucket(int capacity, int depth) {
        this.capacity = capacity;
        this.depth = depth;
        this.items = new LinkedList<>();
    }

    public Optional<V> find(K key) {
        for (Map.Entry<K, V> item : items) {
            if (Objects.equals(item.getKey(), key)) {
                return Optional.of(item.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * 按 key 删除（不比较 value）
     *
     * @return 是否删除了一个 key/value 对
     */
    public boolean remove(K key) {
        Iterator<Map.Entry<K, V>> it = items.iterator();
        while (it.hasNext()) {
            if (Objects.equals(it.next().getKey(), key)) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * key 已存在时原地更新 value；否则在未满时追加
     *
     * @return false 表示桶已满且 key 不存在，调用方需要分裂
     */
    public boolean insert(K key, V value) {
        for (Map.Entry<K, V> item : items) {
            if (Objects.equals(item.getKey(), key)) {
                item.setValue(value);
                return true;
            }
        }
        if (isFull()) {
            return false;
        }
        items.add(new SimpleEntry<>(key, value));
        return true;
    }

    public boolean isFull() {
        return items.size() >= capacity;
    }

    public int size() {
        return items.size();
    }

    /**
     * 当前内容的只读快照，entry 也不可修改
     */
    public List<Map.Entry<K, V>> getItems() {
        List<Map.Entry<K, V>> snapshot = new ArrayList<>(items.size());
        for (Map.Entry<K, V> item : items) {
            snapshot.add(new SimpleImmutableEntry<>(item));
        }
        return Collections.unmodifiableList(snapshot);
    }
}
