package com.flowmetrics.service.core.buffer;

import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.service.core.config.MetricsProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * In-memory, unflushed tail of records. The lock is held only for the append or the swap in {@link #drain()},
 * never across storage I/O. Readers must not treat anything held here as durable.
 */
@Component
@RequiredArgsConstructor
public class MetricsWriteBuffer {

    /** Returned by {@link #append} when the buffer is at its hard cap. */
    public static final int REJECTED = -1;

    private final MetricsProperties properties;

    private final ReentrantLock lock = new ReentrantLock();
    private List<MetricRecord> pending = new ArrayList<>();

    /** @return buffered count after the append, or {@link #REJECTED} */
    public int append(MetricRecord record) {
        int maxPending = properties.getBuffer().getMaxPending();
        lock.lock();
        try {
            if (pending.size() >= maxPending) {
                return REJECTED;
            }
            pending.add(record);
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /** Detaches the current contents, leaving a fresh empty buffer behind. */
    public List<MetricRecord> drain() {
        lock.lock();
        try {
            if (pending.isEmpty()) {
                return List.of();
            }
            List<MetricRecord> drained = pending;
            pending = new ArrayList<>(Math.max(16, properties.getBuffer().getMaxSize()));
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }
}
