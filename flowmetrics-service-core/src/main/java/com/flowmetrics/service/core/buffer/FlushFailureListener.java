package com.flowmetrics.service.core.buffer;

import com.flowmetrics.model.MetricRecord;
import java.util.List;

/** Receives records a flush could not persist. They are not re-queued. */
@FunctionalInterface
public interface FlushFailureListener {

    void onFlushFailure(List<MetricRecord> dropped, Throwable cause);
}
