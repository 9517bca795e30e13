package com.hunkyhsu.pagecore.buffer;

import java.util.OptionalInt;

/**
 * Replacer - 页面替换策略接口
 *
 * 职责：
 * - 记录每个 Frame 的访问历史
 * - 决定当 BufferPool 满时应该淘汰哪个 Frame
 * - 维护 Frame 的可淘汰状态（pinned / evictable）
 * - 提供线程安全的操作接口
 *
 * 调用约定（由 BufferPoolManager 负责）：
 * - 每次访问 Page 时调用 {@link #recordAccess(int)}
 * - 使用 Frame 前调用 setEvictable(frameId, false)，可以回收时调用 setEvictable(frameId, true)
 *
 * @author hunkyhsu
 */
public interface Replacer {

    /**
     * 记录一次对 Frame 的访问
     *
     * @param frameId Frame ID，必须在 [0, replacerSize) 范围内
     * @throws IllegalArgumentException frameId 越界
     */
    void recordAccess(int frameId);

    /**
     * 设置 Frame 是否可以被淘汰
     *
     * 对未记录过访问的 Frame 无效果；重复设置相同的值也不会改变 size()
     *
     * @param frameId   Frame ID
     * @param evictable true 表示 Frame 可被淘汰（unpin），false 表示被 pin 住
     * @throws IllegalArgumentException frameId 越界
     */
    void setEvictable(int frameId, boolean evictable);

    /**
     * 选择一个 Frame 进行淘汰（Evict），并停止跟踪它
     *
     * @return 被淘汰的 Frame ID，如果没有可淘汰的 Frame 则返回 empty
     */
    OptionalInt evict();

    /**
     * 移除一个 Frame 的全部访问历史（例如 Page 被删除时）
     *
     * @param frameId Frame ID
     * @throws IllegalArgumentException frameId 越界
     * @throws IllegalStateException    Frame 当前被 pin 住
     */
    void remove(int frameId);

    /**
     * 获取当前可淘汰的 Frame 数量
     *
     * @return 可淘汰的 Frame 数量
     */
    int size();

}
