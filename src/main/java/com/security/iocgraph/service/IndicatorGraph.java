package com.security.iocgraph.service;

import com.security.iocgraph.constants.IocGraphConstants;
import com.security.iocgraph.model.IndicatorRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * IOC 链路图（有向图）
 *
 * 采用邻接表表示：
 * 1. 同一对节点之间的多条边全部保留（不去重）
 * 2. 不拒绝自环和反向边，环由后续分层阶段处理
 * 3. 节点顺序与输入顺序一致，保证同一快照多次计算结果一致
 */
@Slf4j
public class IndicatorGraph {

    // ========== 核心数据结构 ==========

    /** 节点存储：nodeId -> IndicatorRecord（保持输入顺序） */
    private final Map<String, IndicatorRecord> nodes;

    /** 出边（邻接表）：nodeId -> [child1, child2, ...]，允许重复 */
    private final Map<String, List<String>> outEdges;

    /** 入边（反向邻接表）：nodeId -> [parent1, parent2, ...]，允许重复 */
    private final Map<String, List<String>> inEdges;

    /** 边的标签：key="source->target"，后写入的覆盖先写入的 */
    private final Map<String, String> edgeLabels;

    /** 有效边数（含重复边） */
    private int edgeCount;

    /** 被丢弃的原始边数（端点无法解析或不是指标节点） */
    private int droppedEdgeCount;

    /** 因ID为空被跳过的指标数 */
    private int skippedNodeCount;

    public IndicatorGraph() {
        this.nodes = new LinkedHashMap<>();
        this.outEdges = new HashMap<>();
        this.inEdges = new HashMap<>();
        this.edgeLabels = new HashMap<>();
    }

    // ========== 基础操作 ==========

    /**
     * 添加节点，同时初始化空的出边/入边列表
     *
     * @return 是否添加成功（ID 为空时失败）
     */
    public boolean addNode(IndicatorRecord record) {
        if (record == null || record.getId() == null) {
            return false;
        }

        String nodeId = record.getId();
        if (nodes.containsKey(nodeId)) {
            log.warn("【链路图】节点ID重复，后者覆盖前者: {}", nodeId);
        }
        nodes.put(nodeId, record);
        outEdges.computeIfAbsent(nodeId, k -> new ArrayList<>());
        inEdges.computeIfAbsent(nodeId, k -> new ArrayList<>());
        return true;
    }

    /**
     * 添加边（两端必须都是已索引节点）
     *
     * @param source 源节点
     * @param target 目标节点
     * @param label 边标签
     * @return 是否添加成功
     */
    public boolean addEdge(String source, String target, String label) {
        if (source == null || target == null) {
            return false;
        }
        if (!nodes.containsKey(source) || !nodes.containsKey(target)) {
            return false;
        }

        outEdges.get(source).add(target);
        inEdges.get(target).add(source);
        edgeLabels.put(edgeKey(source, target), label != null ? label : IocGraphConstants.EdgeField.DEFAULT_LABEL);
        edgeCount++;

        if (source.equals(target)) {
            log.debug("【链路图】自环边: {}", source);
        }
        return true;
    }

    /**
     * 获取边的标签
     *
     * @return 边标签，边不存在时返回 null
     */
    public String getEdgeLabel(String source, String target) {
        if (source == null || target == null) {
            return null;
        }
        return edgeLabels.get(edgeKey(source, target));
    }

    /**
     * 获取节点
     */
    public IndicatorRecord getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    /**
     * 检查节点是否存在
     */
    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    /**
     * 获取节点的所有子节点（含重复）
     */
    public List<String> getChildren(String nodeId) {
        List<String> children = outEdges.get(nodeId);
        return children != null ? Collections.unmodifiableList(children) : Collections.emptyList();
    }

    /**
     * 获取节点的入度
     */
    public int getInDegree(String nodeId) {
        List<String> parents = inEdges.get(nodeId);
        return parents != null ? parents.size() : 0;
    }

    /**
     * 获取节点的出度
     */
    public int getOutDegree(String nodeId) {
        List<String> children = outEdges.get(nodeId);
        return children != null ? children.size() : 0;
    }

    /**
     * 节点是否有任何边
     */
    public boolean hasAnyEdge(String nodeId) {
        return getInDegree(nodeId) > 0 || getOutDegree(nodeId) > 0;
    }

    // ========== 图分析方法 ==========

    /**
     * 识别根节点（源节点）
     *
     * 规则：入度为0 且 出度大于0
     * 没有任何边的节点是孤立节点，不算根节点
     *
     * @return 根节点ID列表（输入顺序）
     */
    public List<String> findRootNodes() {
        List<String> roots = new ArrayList<>();
        for (String nodeId : nodes.keySet()) {
            if (getInDegree(nodeId) == 0 && getOutDegree(nodeId) > 0) {
                roots.add(nodeId);
            }
        }
        log.debug("【链路图】根节点: {}", roots);
        return roots;
    }

    /**
     * 识别孤立节点（入度和出度都为0）
     *
     * @return 孤立节点ID列表（输入顺序）
     */
    public List<String> findIsolatedNodes() {
        List<String> isolated = new ArrayList<>();
        for (String nodeId : nodes.keySet()) {
            if (!hasAnyEdge(nodeId)) {
                isolated.add(nodeId);
            }
        }
        return isolated;
    }

    /**
     * 检测环（使用DFS着色法）
     *
     * @return 所有环中的节点集合
     */
    public Set<String> detectCycles() {
        Set<String> cycleNodes = new LinkedHashSet<>();
        Map<String, VisitState> colors = new HashMap<>();

        // 初始化：所有节点为白色（未访问）
        for (String nodeId : nodes.keySet()) {
            colors.put(nodeId, VisitState.WHITE);
        }

        // 对每个白色节点进行DFS
        for (String nodeId : nodes.keySet()) {
            if (colors.get(nodeId) == VisitState.WHITE) {
                detectCyclesDFS(nodeId, colors, new ArrayDeque<>(), cycleNodes);
            }
        }

        if (!cycleNodes.isEmpty()) {
            log.warn("【环检测】检测到 {} 个环中的节点", cycleNodes.size());
        }

        return cycleNodes;
    }

    /**
     * DFS检测环，发现回边时把路径上从回边目标到当前节点的所有节点都记为环节点
     */
    private void detectCyclesDFS(String nodeId,
                                 Map<String, VisitState> colors,
                                 Deque<String> path,
                                 Set<String> cycleNodes) {
        // 标记为灰色（正在访问）
        colors.put(nodeId, VisitState.GRAY);
        path.addLast(nodeId);

        for (String child : getChildren(nodeId)) {
            VisitState childColor = colors.get(child);

            if (childColor == VisitState.GRAY) {
                // 发现环：子节点是灰色，说明还在当前DFS路径中
                boolean inCycle = false;
                for (String onPath : path) {
                    if (onPath.equals(child)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycleNodes.add(onPath);
                    }
                }
                log.debug("【环检测】发现环: {} -> {}", nodeId, child);
            } else if (childColor == VisitState.WHITE) {
                detectCyclesDFS(child, colors, path, cycleNodes);
            }
        }

        // 标记为黑色（已完成）
        path.removeLast();
        colors.put(nodeId, VisitState.BLACK);
    }

    // ========== Getters ==========

    public Set<String> getNodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return edgeCount;
    }

    public int getDroppedEdgeCount() {
        return droppedEdgeCount;
    }

    public int getSkippedNodeCount() {
        return skippedNodeCount;
    }

    void markEdgeDropped() {
        droppedEdgeCount++;
    }

    void markNodeSkipped() {
        skippedNodeCount++;
    }

    private static String edgeKey(String source, String target) {
        return source + IocGraphConstants.Layering.EDGE_KEY_SEPARATOR + target;
    }

    /**
     * 环检测时的访问状态：WHITE 未访问，GRAY 在当前DFS路径上，BLACK 子树已处理完
     */
    private enum VisitState {
        WHITE, GRAY, BLACK
    }
}
