package com.capflow.core.compose;

import java.time.Duration;

/**
 * 重试间隔的等待方式，测试中可替换为不真正休眠的实现
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
