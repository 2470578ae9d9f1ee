package com.security.iocgraph.service.hierarchy;

import com.security.iocgraph.model.GraphEdge;
import com.security.iocgraph.model.IndicatorRecord;
import com.security.iocgraph.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 父子层级构建器
 *
 * 规则：
 * 1. 根父指标：有出边，且（是父卡片 [P] 或 没有入边）
 * 2. 从根向下递归：父卡片 [P] 永远不被嵌套；有出边的子指标形成嵌套分组，否则为叶子
 * 3. 同一路径上不重复访问（每次递归复制已访问集合），不同分支可以重复出现
 * 4. 每层子条目、顶层分组、方向错误列表都按时间升序（稳定排序）
 * 5. 方向错误：父卡片 [P] 的入边来源中有子卡片 [C]
 */
@Slf4j
public class ParentChildHierarchyBuilder {

    /**
     * 构建父子层级
     *
     * @param records 指标列表
     * @param edges 规范化后的边列表
     * @return 层级结果
     */
    public HierarchyResult build(List<IndicatorRecord> records, List<GraphEdge> edges) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        if (edges == null) {
            throw new IllegalArgumentException("edges cannot be null");
        }

        log.info("【层级构建】开始: 指标数={}, 边数={}", records.size(), edges.size());

        Map<String, IndicatorRecord> recordIndex = new LinkedHashMap<>();
        for (IndicatorRecord record : records) {
            if (record != null && record.getId() != null) {
                recordIndex.put(record.getId(), record);
            }
        }

        // 邻接表（Set 去重）
        Map<String, Set<String>> outgoingEdges = new LinkedHashMap<>();
        Map<String, Set<String>> incomingFrom = new HashMap<>();
        Set<String> hasIncoming = new HashSet<>();
        int ignoredEdgeCount = 0;

        for (GraphEdge edge : edges) {
            if (edge == null
                    || !recordIndex.containsKey(edge.getFromId())
                    || !recordIndex.containsKey(edge.getToId())) {
                ignoredEdgeCount++;
                log.debug("【层级构建】忽略端点不在指标集合中的边: {}", edge);
                continue;
            }
            outgoingEdges.computeIfAbsent(edge.getFromId(), k -> new LinkedHashSet<>()).add(edge.getToId());
            incomingFrom.computeIfAbsent(edge.getToId(), k -> new LinkedHashSet<>()).add(edge.getFromId());
            hasIncoming.add(edge.getToId());
        }

        HierarchyResult result = new HierarchyResult();
        result.setIgnoredEdgeCount(ignoredEdgeCount);

        // 根父指标
        List<ParentChildGroup> groups = new ArrayList<>();
        for (String nodeId : outgoingEdges.keySet()) {
            IndicatorRecord record = recordIndex.get(nodeId);
            if (!record.childRole() || !hasIncoming.contains(nodeId)) {
                Set<String> visited = new HashSet<>();
                visited.add(nodeId);
                groups.add(buildGroup(record, recordIndex, outgoingEdges, visited));
            }
        }
        TimeUtil.sortByTime(groups, group -> group.getParent().getTime());
        result.setGroups(groups);

        result.setDirectionalErrors(findDirectionalErrors(recordIndex, incomingFrom));

        log.info("【层级构建】完成: 分组数={}, 方向错误数={}, 忽略边数={}",
                groups.size(), result.getDirectionalErrors().size(), ignoredEdgeCount);
        return result;
    }

    /**
     * 递归构建以 parent 为父的分组
     *
     * @param visited 当前路径上已访问的节点（调用方的副本，不会被本层修改）
     */
    private ParentChildGroup buildGroup(IndicatorRecord parent,
                                        Map<String, IndicatorRecord> recordIndex,
                                        Map<String, Set<String>> outgoingEdges,
                                        Set<String> visited) {
        List<HierarchyNode> children = new ArrayList<>();

        for (String targetId : outgoingEdges.getOrDefault(parent.getId(), Collections.emptySet())) {
            if (visited.contains(targetId)) {
                log.debug("【层级构建】路径上已访问，跳过: {} -> {}", parent.getId(), targetId);
                continue;
            }
            IndicatorRecord target = recordIndex.get(targetId);
            if (!target.childRole()) {
                // 父卡片只作为自己的根分组出现
                continue;
            }

            if (outgoingEdges.containsKey(targetId)) {
                Set<String> branchVisited = new HashSet<>(visited);
                branchVisited.add(targetId);
                children.add(buildGroup(target, recordIndex, outgoingEdges, branchVisited));
            } else {
                children.add(new HierarchyLeaf(target));
            }
        }

        TimeUtil.sortByTime(children, child -> child.getAnchor().getTime());
        return new ParentChildGroup(parent, children);
    }

    /**
     * 查找方向错误：入边来源中有子卡片 [C] 的父卡片 [P]
     */
    private List<IndicatorRecord> findDirectionalErrors(Map<String, IndicatorRecord> recordIndex,
                                                        Map<String, Set<String>> incomingFrom) {
        List<IndicatorRecord> errors = new ArrayList<>();
        for (IndicatorRecord record : recordIndex.values()) {
            if (record.childRole()) {
                continue;
            }
            for (String sourceId : incomingFrom.getOrDefault(record.getId(), Collections.emptySet())) {
                if (recordIndex.get(sourceId).childRole()) {
                    log.warn("【层级构建】方向错误: 子卡片 {} 指向父卡片 {}", sourceId, record.getId());
                    errors.add(record);
                    break;
                }
            }
        }
        TimeUtil.sortByTime(errors, IndicatorRecord::getTime);
        return errors;
    }
}
