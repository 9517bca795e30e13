package com.hunkyhsu.pagecore.container.hash;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.ToIntFunction;

/**
 * ExtendibleHashTable - 可扩展哈希表
 *
 * <p>用于 key 到 value 的快速映射（例如 pageId -> frameId 的 page table）。
 * 目录（directory）长度始终为 {@code 2^globalDepth}，slot 下标取 hash 的低 globalDepth 位。
 * 多个 slot 可以指向同一个桶，local depth 为 d 的桶被 {@code 2^(globalDepth - d)} 个 slot 共享。
 *
 * <h2>插入与分裂</h2>
 * <pre>
 * 目标桶满了：
 *   localDepth == globalDepth  →  目录翻倍（上半部分复制下半部分）
 *   旧桶按 hash 第 localDepth 位拆成两个 depth+1 的新桶，并重新指向所有引用旧桶的 slot
 *   重新定位目标桶，仍然满则继续分裂
 * </pre>
 *
 * <h2>线程安全</h2>
 * <p>一个 ReentrantLock 保护整张表，所有 public 方法在整个执行期间持有锁。
 *
 * @param <K> key 类型，需要正确实现 equals/hashCode（或在构造时传入 hash 函数）
 * @param <V> value 类型，需要正确实现 equals
 * @author hunkyhsu
 * @see Bucket
 */
public class ExtendibleHashTable<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(ExtendibleHashTable.class);

    /**
     * 目录下标来自 int hash，且目录是一个 List，globalDepth 不能超过 30
     */
    public static final int MAX_GLOBAL_DEPTH = 30;

    @Getter
    private final int bucketSize;

    private final ToIntFunction<? super K> hashFunction;

    private final List<Bucket<K, V>> directory;

    private final ReentrantLock lock;

    private int globalDepth;

    private int numBuckets;

    private int size;

    public ExtendibleHashTable(int bucketSize) {
        this(bucketSize, Objects::hashCode);
    }

    public ExtendibleHashTable(int bucketSize, ToIntFunction<? super K> hashFunction) {
        if (bucketSize < 1) {
            throw new IllegalArgumentException(String.format(
                    "Invalid bucketSize: %d (must be positive)", bucketSize));
        }
        if (hashFunction == null) {
            throw new IllegalArgumentException("hashFunction is null");
        }
        this.bucketSize = bucketSize;
        this.hashFunction = hashFunction;
        this.directory = new ArrayList<>();
        this.directory.add(new Bucket<>(bucketSize, 0));
        this.lock = new ReentrantLock();
        this.globalDepth = 0;
        this.numBuckets = 1;
        logger.info("Extendible Hash Table initialized with bucketSize {}", bucketSize);
    }

    /**
     * 计算 key 所在的目录 slot
     */
    public int indexOf(K key) {
        lock.lock();
        try {
            return indexOfInternal(key);
        } finally {
            lock.unlock();
        }
    }

    public Optional<V> find(K key) {
        lock.lock();
        try {
            return directory.get(indexOfInternal(key)).find(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 是否删除了一个 key/value 对
     */
    public boolean remove(K key) {
        lock.lock();
        try {
            boolean removed = directory.get(indexOfInternal(key)).remove(key);
            if (removed) {
                size--;
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 插入或更新一个 key/value 对，必要时翻倍目录并分裂桶
     *
     * @throws IllegalArgumentException value 为 null
     * @throws IllegalStateException    桶内 key 的 hash 低位与新 key 完全相同，分裂到
     *                                  {@link #MAX_GLOBAL_DEPTH} 也无法分开；此时表不做任何修改
     */
    public void insert(K key, V value) {
        if (value == null) {
            throw new IllegalArgumentException("value is null");
        }
        lock.lock();
        try {
            Bucket<K, V> target = directory.get(indexOfInternal(key));
            Optional<V> existing = target.find(key);
            if (existing.isPresent()) {
                if (existing.get().equals(value)) {
                    return;
                }
                target.remove(key);
                size--;
            }

            if (target.isFull() && requiredDepth(target, key) < 0) {
                logger.warn("Cannot insert key: bucket keys share all {} low hash bits with it", MAX_GLOBAL_DEPTH);
                throw new IllegalStateException(String.format(
                        "Bucket cannot be split within globalDepth %d: too many keys share the same hash bits",
                        MAX_GLOBAL_DEPTH));
            }

            // 一次分裂不一定能腾出位置（key 可能集中在同一个新桶），所以循环
            while (target.isFull()) {
                if (target.getDepth() == globalDepth) {
                    growDirectory();
                }
                splitBucket(target);
                target = directory.get(indexOfInternal(key));
            }

            target.insert(key, value);
            size++;
        } finally {
            lock.unlock();
        }
    }

    public int getGlobalDepth() {
        lock.lock();
        try {
            return globalDepth;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param dirIndex 目录 slot 下标
     * @throws IndexOutOfBoundsException dirIndex 不在 [0, 2^globalDepth) 范围内
     */
    public int getLocalDepth(int dirIndex) {
        lock.lock();
        try {
            Objects.checkIndex(dirIndex, directory.size());
            return directory.get(dirIndex).getDepth();
        } finally {
            lock.unlock();
        }
    }

    public int getNumBuckets() {
        lock.lock();
        try {
            return numBuckets;
        } finally {
            lock.unlock();
        }
    }

    public int getDirectorySize() {
        lock.lock();
        try {
            return directory.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 表中 key/value 对的总数
     */
    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    // 以下方法调用方必须持有 lock

    private int indexOfInternal(K key) {
        int mask = (1 << globalDepth) - 1;
        return hashFunction.applyAsInt(key) & mask;
    }

    /**
     * 分裂到能放下 key 所需的 local depth；-1 表示到 MAX_GLOBAL_DEPTH 仍然放不下
     */
    private int requiredDepth(Bucket<K, V> bucket, K key) {
        int keyHash = hashFunction.applyAsInt(key);
        for (int depth = bucket.getDepth() + 1; depth <= MAX_GLOBAL_DEPTH; depth++) {
            int mask = (1 << depth) - 1;
            int sharing = 0;
            for (Map.Entry<K, V> item : bucket.getItems()) {
                if ((hashFunction.applyAsInt(item.getKey()) & mask) == (keyHash & mask)) {
                    sharing++;
                }
            }
            if (sharing < bucketSize) {
                return depth;
            }
        }
        return -1;
    }

    private void growDirectory() {
        // addAll 失败时目录保持不变，成功后才增加 globalDepth
        directory.addAll(new ArrayList<>(directory));
        globalDepth++;
        logger.debug("Directory doubled: globalDepth={}, slots={}", globalDepth, directory.size());
    }

    private void splitBucket(Bucket<K, V> bucket) {
        int oldDepth = bucket.getDepth();
        int mask = 1 << oldDepth;
        Bucket<K, V> bucket0 = new Bucket<>(bucketSize, oldDepth + 1);
        Bucket<K, V> bucket1 = new Bucket<>(bucketSize, oldDepth + 1);

        for (Map.Entry<K, V> item : bucket.getItems()) {
            if ((hashFunction.applyAsInt(item.getKey()) & mask) != 0) {
                bucket1.insert(item.getKey(), item.getValue());
            } else {
                bucket0.insert(item.getKey(), item.getValue());
            }
        }
        for (int i = 0; i < directory.size(); i++) {
            if (directory.get(i) == bucket) {
                directory.set(i, (i & mask) != 0 ? bucket1 : bucket0);
            }
        }
        numBuckets++;

        if (logger.isDebugEnabled()) {
            logger.debug("Bucket split at localDepth {} -> {} (sizes {}/{}, numBuckets={})",
                    oldDepth, oldDepth + 1, bucket0.size(), bucket1.size(), numBuckets);
        }
    }
}
