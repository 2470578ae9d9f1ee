package com.security.iocgraph.util;

import com.security.iocgraph.constants.IocGraphConstants;
import com.security.iocgraph.model.GraphEdge;
import com.security.iocgraph.model.IndicatorRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 链路边规范化工具类
 *
 * 检查项目：
 * 1. 删除无效边（null/空端点）
 * 2. 删除重复边（相同 from、to、label，保留第一次出现的）
 * 3. 统计端点不在指标集合中的边（保留，由层级构建阶段忽略并计数）
 *
 * 自环边保留，由层级构建的路径去重处理。
 * 不修改输入列表，返回新列表。
 */
@Slf4j
public class LinkEdgeValidator {

    private LinkEdgeValidator() {
    }

    /**
     * 规范化边列表
     *
     * @param records 指标列表
     * @param edges 解析后的边列表
     * @return 规范化后的边列表（新列表）
     */
    public static List<GraphEdge> normalize(List<IndicatorRecord> records, List<GraphEdge> edges) {
        if (records == null || edges == null) {
            throw new IllegalArgumentException("records and edges cannot be null");
        }

        log.info("【边规范化】-> 开始检查，指标数: {}, 边数: {}", records.size(), edges.size());

        Set<String> nodeIds = buildNodeIdSet(records);

        List<GraphEdge> normalized = new ArrayList<>(edges);

        int invalidBefore = normalized.size();
        removeInvalidEdges(normalized);
        int invalidRemoved = invalidBefore - normalized.size();

        int duplicateBefore = normalized.size();
        removeDuplicateEdges(normalized);
        int duplicateRemoved = duplicateBefore - normalized.size();

        int unknownEndpoints = countUnknownEndpoints(normalized, nodeIds);

        log.info("【边规范化】-> 检查完成: 删除无效边 {} 条, 删除重复边 {} 条, 端点不存在 {} 条, 剩余边数 {} 条",
                invalidRemoved, duplicateRemoved, unknownEndpoints, normalized.size());

        return normalized;
    }

    private static Set<String> buildNodeIdSet(List<IndicatorRecord> records) {
        Set<String> nodeIds = new HashSet<>();
        for (IndicatorRecord record : records) {
            if (record != null && record.getId() != null && !record.getId().isEmpty()) {
                nodeIds.add(record.getId());
            }
        }
        return nodeIds;
    }

    /**
     * 删除边为 null 或 from/to 为空的边
     */
    private static void removeInvalidEdges(List<GraphEdge> edges) {
        Iterator<GraphEdge> iterator = edges.iterator();
        while (iterator.hasNext()) {
            GraphEdge edge = iterator.next();
            if (edge == null) {
                iterator.remove();
                continue;
            }
            if (isBlank(edge.getFromId()) || isBlank(edge.getToId())) {
                log.warn("【边规范化-无效边】删除空端点边: {}", edge);
                iterator.remove();
            }
        }
    }

    /**
     * 删除重复边，保留第一次出现的
     */
    private static void removeDuplicateEdges(List<GraphEdge> edges) {
        Set<String> signatures = new HashSet<>();
        Iterator<GraphEdge> iterator = edges.iterator();
        while (iterator.hasNext()) {
            GraphEdge edge = iterator.next();
            String signature = edge.getFromId() + IocGraphConstants.Layering.EDGE_KEY_SEPARATOR
                    + edge.getToId() + "#" + edge.getLabel();
            if (!signatures.add(signature)) {
                log.debug("【边规范化-重复边】删除重复边: {}", edge);
                iterator.remove();
            }
        }
    }

    private static int countUnknownEndpoints(List<GraphEdge> edges, Set<String> nodeIds) {
        int count = 0;
        for (GraphEdge edge : edges) {
            if (!nodeIds.contains(edge.getFromId()) || !nodeIds.contains(edge.getToId())) {
                log.debug("【边规范化-节点不存在】{} → {}", edge.getFromId(), edge.getToId());
                count++;
            }
        }
        return count;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
