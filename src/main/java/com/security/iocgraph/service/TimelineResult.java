package com.security.iocgraph.service;

import com.security.iocgraph.model.IndicatorRecord;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 时间线结果
 */
@Getter
@Setter
public class TimelineResult {

    /** 有时间的条目（按时间升序，同一时间保持输入顺序） */
    private List<TimelineEntry> entries = new ArrayList<>();

    /** 没有时间或时间无法解析的指标（输入顺序） */
    private List<IndicatorRecord> untimed = new ArrayList<>();

    /** 数据时间范围，没有条目时为 null */
    private Long minTime;
    private Long maxTime;
}
