package com.security.iocgraph.util;

import com.security.iocgraph.constants.IocGraphConstants;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * 时间工具类
 * 使用 Java 8+ 的 DateTimeFormatter（线程安全）
 *
 * 支持的格式（按顺序尝试）：
 * 1. yyyy-MM-dd HH:mm:ss（卡片 Time of Event 格式）
 * 2. ISO 本地时间 2026-02-14T15:34:00
 * 3. ISO 带偏移时间 2026-02-14T15:34:00+08:00 / ...Z
 * 4. ISO 日期 2026-02-14
 *
 * 不带时区的时间统一按 UTC 解释，只用于相对排序
 */
@Slf4j
public class TimeUtil {

    private static final DateTimeFormatter DATE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern(IocGraphConstants.Time.DATE_TIME_FORMAT);

    private static final List<Function<String, Long>> PARSERS = Arrays.asList(
            text -> LocalDateTime.parse(text, DATE_TIME_FORMATTER).toInstant(ZoneOffset.UTC).toEpochMilli(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC).toEpochMilli(),
            text -> OffsetDateTime.parse(text).toInstant().toEpochMilli(),
            text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli()
    );

    private TimeUtil() {
    }

    /**
     * 解析时间字符串为毫秒时间戳
     *
     * @param timeStr 时间字符串
     * @return 毫秒时间戳，为空或无法解析时返回 null
     */
    public static Long parseEpochMillis(String timeStr) {
        if (timeStr == null || timeStr.trim().isEmpty()) {
            return null;
        }
        String text = timeStr.trim();

        DateTimeParseException lastError = null;
        for (Function<String, Long> parser : PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        log.debug("时间字符串解析失败: {}, 错误: {}", timeStr, lastError != null ? lastError.getMessage() : "");
        return null;
    }

    /**
     * 验证时间字符串是否可解析
     */
    public static boolean isValidTime(String timeStr) {
        return parseEpochMillis(timeStr) != null;
    }

    /**
     * 按时间升序原地排序
     *
     * 每个元素的时间只解析一次。可解析的时间按先后排序，无法解析的排在
     * 所有可解析的之后；排序稳定，相同时间和无法解析的元素保持输入顺序。
     *
     * @param items 待排序列表（原地修改）
     * @param timeOf 从元素取时间字符串的函数
     */
    public static <T> void sortByTime(List<T> items, Function<T, String> timeOf) {
        List<TimedItem<T>> keyed = new ArrayList<>(items.size());
        for (T item : items) {
            keyed.add(new TimedItem<>(item, parseEpochMillis(timeOf.apply(item))));
        }
        keyed.sort((a, b) -> compareTimes(a.timestamp, b.timestamp));

        for (int i = 0; i < keyed.size(); i++) {
            items.set(i, keyed.get(i).item);
        }
    }

    /**
     * 比较两个可能为空的时间戳，空值排后
     */
    public static int compareTimes(Long a, Long b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        return Long.compare(a, b);
    }

    /**
     * 排序用：元素 + 解析后的时间戳
     */
    private static final class TimedItem<T> {
        private final T item;
        private final Long timestamp;

        private TimedItem(T item, Long timestamp) {
            this.item = item;
            this.timestamp = timestamp;
        }
    }
}
