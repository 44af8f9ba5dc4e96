package org.csits.reportd.manager.lock;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 内存表 + 单把锁 + 定时驱逐的命名互斥实现。
 * 驱逐任务只移除创建它的那次注册，之后的重新注册不受旧定时器影响。
 */
@Slf4j
@Component
public class TimedNamedOperationLock implements NamedOperationLock {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, NamedOperation> operations = new HashMap<>();
    private final ScheduledExecutorService evictor;
    private final Clock clock;
    private long sequence;

    public TimedNamedOperationLock() {
        this(Clock.systemUTC());
    }

    public TimedNamedOperationLock(Clock clock) {
        this.clock = clock;
        this.evictor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reportd-operation-evictor");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public boolean begin(String identifier, long timeoutSeconds) {
        if (identifier == null || identifier.trim().isEmpty()) {
            throw new IllegalArgumentException("操作标识不能为空");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("超时时间必须为正数: " + timeoutSeconds);
        }
        NamedOperation operation;
        lock.lock();
        try {
            if (operations.containsKey(identifier)) {
                log.info("操作已在进行中: identifier={}", identifier);
                return false;
            }
            operation = new NamedOperation(identifier, clock.instant(), timeoutSeconds, ++sequence);
            operations.put(identifier, operation);
        } finally {
            lock.unlock();
        }
        final long seq = operation.getSequence();
        evictor.schedule(() -> evict(identifier, seq), timeoutSeconds, TimeUnit.SECONDS);
        log.info("操作开始: identifier={}, timeout={}s", identifier, timeoutSeconds);
        return true;
    }

    @Override
    public boolean end(String identifier) {
        lock.lock();
        try {
            if (identifier != null && operations.remove(identifier) != null) {
                log.info("操作结束: identifier={}", identifier);
            }
        } finally {
            lock.unlock();
        }
        return true;
    }

    @Override
    public boolean isActive(String identifier) {
        lock.lock();
        try {
            return operations.containsKey(identifier);
        } finally {
            lock.unlock();
        }
    }

    private void evict(String identifier, long seq) {
        lock.lock();
        try {
            NamedOperation current = operations.get(identifier);
            if (current != null && current.getSequence() == seq) {
                operations.remove(identifier);
                log.warn("操作超时，已自动释放: identifier={}, startedAt={}", identifier, current.getStartedAt());
            }
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        evictor.shutdownNow();
    }
}
