package com.security.iocgraph.service;

import com.security.iocgraph.model.IndicatorRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 时间线条目：指标及其解析后的时间戳（毫秒）
 */
@Getter
@AllArgsConstructor
public class TimelineEntry {
    private final IndicatorRecord record;
    private final long timestamp;
}
