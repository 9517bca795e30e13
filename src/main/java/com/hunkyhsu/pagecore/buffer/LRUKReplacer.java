package com.hunkyhsu.pagecore.buffer;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LRU-K Replacer - 基于 LRU-K 算法的页面替换器
 *
 * 核心设计：
 * - 访问次数 < k 的 Frame 放在 cold list（历史队列），按第一次访问的顺序排列
 * - 访问次数 >= k 的 Frame 放在 hot list（缓存队列），每次访问都移到末尾
 * - 淘汰时优先从 cold list 中选（backward k-distance 视为无穷大），其次才是 hot list
 * - 线程安全：所有操作加锁保护
 *
 * 数据结构：
 * - LinkedHashSet 的迭代顺序 = 插入顺序，头部最旧，最先被淘汰
 * - remove + add 即可把 Frame 移到最近访问的一端
 *
 * 注意：hot list 按最近一次访问排序，而不是严格的第 k 次访问时间，
 * 这是 LRU-K 的近似实现。
 *
 * @author hunkyhsu
 */
public class LRUKReplacer implements Replacer {

    private static final Logger logger = LoggerFactory.getLogger(LRUKReplacer.class);

    private static final int INVALID_FRAME_ID = -1;

    /**
     * 可跟踪的 Frame 数量上限，同时也是 frameId 的上界（不含）
     */
    @Getter
    private final int replacerSize;

    @Getter
    private final int k;

    private final Map<Integer, FrameEntry> frames;

    private final LinkedHashSet<Integer> coldList;

    private final LinkedHashSet<Integer> hotList;

    private final ReentrantLock lock;

    private int evictableCount;

    public LRUKReplacer(int numFrames, int k) {
        if (numFrames < 1) {
            throw new IllegalArgumentException(String.format(
                    "Invalid numFrames: %d (must be positive)", numFrames));
        }
        if (k < 1) {
            throw new IllegalArgumentException(String.format(
                    "Invalid k: %d (must be positive)", k));
        }
        this.replacerSize = numFrames;
        this.k = k;
        this.frames = new HashMap<>(numFrames);
        this.coldList = new LinkedHashSet<>();
        this.hotList = new LinkedHashSet<>();
        this.lock = new ReentrantLock();
        logger.info("LRU-K Replacer initialized with capacity {}, k={}", numFrames, k);
    }

    @Override
    public void recordAccess(int frameId) {
        checkFrameId(frameId);
        lock.lock();
        try {
            FrameEntry entry = frames.get(frameId);
            if (entry == null) {
                // 已满：先淘汰一个腾出位置，淘汰不了就丢弃这次访问
                // frameId 限定在 [0, replacerSize)，所以这里只是保护性检查，正常不会满
                if (frames.size() >= replacerSize && evictInternal() == INVALID_FRAME_ID) {
                    logger.debug("Access to frame {} dropped: replacer full and nothing evictable", frameId);
                    return;
                }
                entry = new FrameEntry();
                frames.put(frameId, entry);
                coldList.add(frameId);
            }

            boolean wasHot = entry.accessCount >= k;
            if (entry.accessCount < Integer.MAX_VALUE) {
                entry.accessCount++;
            }

            if (wasHot) {
                // 移到 hot list 末尾（最近访问）
                hotList.remove(frameId);
                hotList.add(frameId);
            } else if (entry.accessCount >= k) {
                coldList.remove(frameId);
                hotList.add(frameId);
                logger.trace("Frame {} promoted to hot list (accessCount={})", frameId, entry.accessCount);
            }
            logger.trace("Recorded access to frame {} (accessCount={})", frameId, entry.accessCount);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setEvictable(int frameId, boolean evictable) {
        checkFrameId(frameId);
        lock.lock();
        try {
            FrameEntry entry = frames.get(frameId);
            if (entry == null || entry.evictable == evictable) {
                return;
            }
            entry.evictable = evictable;
            if (evictable) {
                evictableCount++;
            } else {
                evictableCount--;
            }
            logger.trace("Frame {} set evictable={} (size={})", frameId, evictable, evictableCount);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 选择一个 Frame 进行淘汰
     *
     * 实现：先按第一次访问顺序扫描 cold list，再按最近访问顺序扫描 hot list，
     * 返回第一个可淘汰的 Frame
     *
     * @return Frame ID，如果没有可淘汰的 Frame 则返回 empty
     */
    @Override
    public OptionalInt evict() {
        lock.lock();
        try {
            int frameId = evictInternal();
            if (frameId == INVALID_FRAME_ID) {
                logger.debug("No victim available (all frames are pinned)");
                return OptionalInt.empty();
            }
            return OptionalInt.of(frameId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(int frameId) {
        checkFrameId(frameId);
        lock.lock();
        try {
            FrameEntry entry = frames.get(frameId);
            if (entry == null || entry.accessCount == 0) {
                return;
            }
            if (!entry.evictable) {
                logger.warn("Cannot remove frame {}: frame is pinned", frameId);
                throw new IllegalStateException(String.format(
                        "Cannot remove pinned frame %d", frameId));
            }
            if (entry.accessCount < k) {
                coldList.remove(frameId);
            } else {
                hotList.remove(frameId);
            }
            frames.remove(frameId);
            evictableCount--;
            logger.debug("Frame {} removed from replacer", frameId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return evictableCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 访问次数不足 k 的 Frame 数量
     */
    public int coldSize() {
        lock.lock();
        try {
            return coldList.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 访问次数达到 k 的 Frame 数量
     */
    public int hotSize() {
        lock.lock();
        try {
            return hotList.size();
        } finally {
            lock.unlock();
        }
    }

    // 调用方必须持有 lock
    private int evictInternal() {
        if (evictableCount == 0) {
            return INVALID_FRAME_ID;
        }
        int frameId = evictFrom(coldList);
        if (frameId == INVALID_FRAME_ID) {
            frameId = evictFrom(hotList);
        }
        if (frameId != INVALID_FRAME_ID) {
            logger.debug("Victim selected: frameId={}", frameId);
        }
        return frameId;
    }

    private int evictFrom(LinkedHashSet<Integer> list) {
        Iterator<Integer> it = list.iterator();
        while (it.hasNext()) {
            int frameId = it.next();
            if (frames.get(frameId).evictable) {
                it.remove();
                frames.remove(frameId);
                evictableCount--;
                return frameId;
            }
        }
        return INVALID_FRAME_ID;
    }

    private void checkFrameId(int frameId) {
        if (frameId < 0 || frameId >= replacerSize) {
            throw new IllegalArgumentException(String.format(
                    "Invalid frameId: %d (replacer size: %d)", frameId, replacerSize));
        }
    }

    private static final class FrameEntry {
        private int accessCount;
        private boolean evictable;
    }
}
