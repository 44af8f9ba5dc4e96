package org.csits.reportd.manager.lock;

/**
 * 命名互斥：同一标识同一时刻只允许一个特权操作在进行中。
 */
public interface NamedOperationLock {

    long DEFAULT_TIMEOUT_SECONDS = 300L;

    /**
     * 注册操作。标识已被占用时返回 false；超时后注册自动失效。
     *
     * @throws IllegalArgumentException 标识为空，或超时不为正数
     */
    boolean begin(String identifier, long timeoutSeconds);

    default boolean begin(String identifier) {
        return begin(identifier, DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * 释放操作，未注册的标识同样返回 true。
     */
    boolean end(String identifier);

    boolean isActive(String identifier);
}
