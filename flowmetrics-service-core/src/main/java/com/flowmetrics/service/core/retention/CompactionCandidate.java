package com.flowmetrics.service.core.retention;

import com.flowmetrics.model.MetricRecord;

/** A detailed row old enough to be compacted, with its storage id so the same row can be deleted afterwards. */
public record CompactionCandidate(long rowId, MetricRecord record) {}
