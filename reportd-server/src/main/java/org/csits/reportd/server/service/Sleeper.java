package org.csits.reportd.server.service;

import java.time.Duration;

/**
 * 轮询等待，测试中可替换为推进时钟。
 */
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
