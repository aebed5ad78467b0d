package com.example.syncengine.session;

/**
 * Where a running sync reports its progress. The sync never writes its session directly.
 */
@FunctionalInterface
public interface ProgressChannel {

    void publish(SyncProgressEvent event);
}
