package com.toolhub.registry;

import com.toolhub.tools.ExecutionContext;
import com.toolhub.tools.ResourceCleanup;
import com.toolhub.tools.Tool;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wraps a tool that must not run concurrently: one {@link #execute} at a time. Waiting for the
 * lock is interruptible so cancelled calls do not queue behind a slow one.
 */
final class SerializedTool implements Tool, ResourceCleanup {

    private final Tool delegate;
    private final ReentrantLock lock = new ReentrantLock(true);

    SerializedTool(Tool delegate) {
        this.delegate = delegate;
    }

    Tool getDelegate() {
        return delegate;
    }

    @Override
    public Object execute(Map<String, Object> arguments, ExecutionContext context) throws Exception {
        lock.lockInterruptibly();
        try {
            return delegate.execute(arguments, context);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean supportsConcurrentExecute() {
        return false;
    }

    @Override
    public void onExit() {
        if (delegate instanceof ResourceCleanup) {
            ((ResourceCleanup) delegate).onExit();
        }
    }
}
