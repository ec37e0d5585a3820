package com.toolhub.tools;

/**
 * Contract for resource cleanup when a tool instance is discarded. Tools holding resources
 * (connections, threads, caches) implement this and release them in {@link #onExit()}. The instance
 * cache invokes {@code onExit()} when it evicts an instance and when the engine shuts down.
 */
public interface ResourceCleanup {

    /**
     * Called once when the instance is discarded. Exceptions are logged by the caller and not
     * rethrown so other instances still get a chance to clean up.
     */
    void onExit();
}
