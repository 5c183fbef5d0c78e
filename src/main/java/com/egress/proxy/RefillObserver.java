package com.egress.proxy;

@FunctionalInterface
public interface RefillObserver {

    RefillObserver NONE = progress -> { };

    void onAttempt(RefillProgress progress);
}
