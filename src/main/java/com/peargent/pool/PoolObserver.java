package com.peargent.pool;

@FunctionalInterface
public interface PoolObserver {
    void onEvent(PoolEvent event);
}
