package com.security.iocgraph.service;

import com.security.iocgraph.model.IndicatorRecord;
import com.security.iocgraph.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 时间线构建器
 *
 * 按事件时间排列指标，并支持按时间范围过滤（闭区间）
 */
@Slf4j
public class ChronologicalTimelineBuilder {

    /**
     * 构建时间线
     *
     * @param records 指标列表
     * @return 时间线结果
     */
    public TimelineResult build(List<IndicatorRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }

        TimelineResult result = new TimelineResult();
        List<TimelineEntry> entries = new ArrayList<>();

        for (IndicatorRecord record : records) {
            if (record == null) {
                continue;
            }
            Long timestamp = TimeUtil.parseEpochMillis(record.getTime());
            if (timestamp == null) {
                result.getUntimed().add(record);
            } else {
                entries.add(new TimelineEntry(record, timestamp));
            }
        }

        entries.sort(Comparator.comparingLong(TimelineEntry::getTimestamp));
        result.setEntries(entries);

        if (!entries.isEmpty()) {
            result.setMinTime(entries.get(0).getTimestamp());
            result.setMaxTime(entries.get(entries.size() - 1).getTimestamp());
        }

        log.info("【时间线】构建完成: 有时间={}, 无时间={}, 范围=[{}, {}]",
                entries.size(), result.getUntimed().size(), result.getMinTime(), result.getMaxTime());
        return result;
    }

    /**
     * 按时间范围过滤（闭区间），边界为 null 表示不限
     *
     * 数据范围 minTime/maxTime 保持不变，便于展示层画完整刻度
     */
    public TimelineResult filterRange(TimelineResult timeline, Long from, Long to) {
        if (timeline == null) {
            throw new IllegalArgumentException("timeline cannot be null");
        }
        if (from != null && to != null && from > to) {
            throw new IllegalArgumentException("from must not be after to");
        }

        TimelineResult filtered = new TimelineResult();
        for (TimelineEntry entry : timeline.getEntries()) {
            long ts = entry.getTimestamp();
            if ((from == null || ts >= from) && (to == null || ts <= to)) {
                filtered.getEntries().add(entry);
            }
        }
        filtered.setUntimed(new ArrayList<>(timeline.getUntimed()));
        filtered.setMinTime(timeline.getMinTime());
        filtered.setMaxTime(timeline.getMaxTime());

        log.debug("【时间线】范围过滤: [{}, {}], {} -> {} 条",
                from, to, timeline.getEntries().size(), filtered.getEntries().size());
        return filtered;
    }
}
