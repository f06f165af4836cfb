package com.esplora.auth.proxy;

import java.time.Duration;
import java.util.concurrent.Future;

public interface RefreshTimer extends AutoCloseable {

    Future<?> schedule(Runnable task, Duration delay);

    @Override
    void close();
}
