package com.flowmetrics.service.core.buffer;

import com.flowmetrics.model.MetricRecord;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingFlushFailureListener implements FlushFailureListener {

    @Override
    public void onFlushFailure(List<MetricRecord> dropped, Throwable cause) {
        log.error("Metrics flush failed; dropped {} buffered records", dropped.size(), cause);
    }
}
