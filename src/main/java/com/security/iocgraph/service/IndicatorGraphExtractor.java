package com.security.iocgraph.service;

import com.security.iocgraph.model.GraphEdge;
import com.security.iocgraph.model.GraphSnapshot;
import com.security.iocgraph.model.IndicatorRecord;
import com.security.iocgraph.service.edge.EdgeResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * IOC 链路图提取器（分层 DAG）
 *
 * 流程：
 * 1. 指标索引 + 边解析（IndicatorGraphBuilder）
 * 2. 根节点识别：入度为0且有出边
 * 3. 最大深度计算 + 孤儿分量补偿（MaxDepthCalculator）
 * 4. 按深度分层，0..maxDepth 连续输出，空层保留
 * 5. 孤立节点单独输出，不进入任何层
 * 6. 重新解析全部原始边，输出所有有效边用于画箭头
 *
 * 每次调用只读输入快照，不修改输入，不保留状态
 */
@Slf4j
public class IndicatorGraphExtractor {

    private final EdgeResolver edgeResolver;
    private final MaxDepthCalculator depthCalculator;
    private final AttackChainBuilder chainBuilder;

    public IndicatorGraphExtractor(EdgeResolver edgeResolver) {
        this(edgeResolver, new MaxDepthCalculator(), new AttackChainBuilder());
    }

    /**
     * @param chainBuilder 攻击链构建器，为 null 时不输出攻击链
     */
    public IndicatorGraphExtractor(EdgeResolver edgeResolver,
                                   MaxDepthCalculator depthCalculator,
                                   AttackChainBuilder chainBuilder) {
        if (edgeResolver == null || depthCalculator == null) {
            throw new IllegalArgumentException("EdgeResolver and MaxDepthCalculator cannot be null");
        }
        this.edgeResolver = edgeResolver;
        this.depthCalculator = depthCalculator;
        this.chainBuilder = chainBuilder;
    }

    /**
     * 提取分层链路图
     *
     * @param snapshot 画布快照
     * @return 分层结果
     */
    public LinkGraphResult extract(GraphSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("GraphSnapshot cannot be null");
        }
        return extract(snapshot.effectiveTotalNodes(), snapshot.getIndicators(), snapshot.getRawEdges());
    }

    /**
     * 提取分层链路图
     *
     * @param totalNodes 画布原始节点总数（统计用）
     * @param indicators 指标列表
     * @param rawEdges 原始边列表
     * @return 分层结果
     */
    public LinkGraphResult extract(int totalNodes,
                                   List<IndicatorRecord> indicators,
                                   List<? extends Map<String, ?>> rawEdges) {
        if (indicators == null) {
            throw new IllegalArgumentException("indicators cannot be null");
        }
        if (rawEdges == null) {
            throw new IllegalArgumentException("rawEdges cannot be null");
        }

        LinkGraphResult result = new LinkGraphResult();
        GraphDiagnostics diagnostics = result.getDiagnostics();
        diagnostics.setTotalNodes(totalNodes);
        diagnostics.setTotalEdges(rawEdges.size());

        log.info("【链路图】-> ========================================");
        log.info("【链路图】-> 开始提取: 节点总数={}, 指标数={}, 原始边数={}",
                totalNodes, indicators.size(), rawEdges.size());

        // ========== 阶段1：建图 ==========
        IndicatorGraph graph = new IndicatorGraphBuilder(edgeResolver).buildGraph(indicators, rawEdges);
        diagnostics.setIndicatorCount(graph.getNodeCount());
        diagnostics.setValidConnectionCount(graph.getEdgeCount());
        diagnostics.setDroppedEdgeCount(graph.getDroppedEdgeCount());

        if (graph.getNodeCount() == 0) {
            log.warn("【链路图】-> 没有指标节点，返回空结果");
            result.setGraphFound(false);
            return result;
        }
        result.setGraphFound(true);

        // ========== 阶段2：根节点识别 ==========
        List<String> rootIds = graph.findRootNodes();
        diagnostics.setRootCount(rootIds.size());
        if (rootIds.isEmpty() && graph.getEdgeCount() > 0) {
            log.warn("【链路图】-> 所有有边节点都有入边，没有根节点，依赖孤儿补偿分层");
        }

        Set<String> cycleNodes = graph.detectCycles();
        diagnostics.setCycleNodeCount(cycleNodes.size());

        // ========== 阶段3：最大深度 ==========
        DepthAssignment assignment = depthCalculator.calculate(graph, rootIds);
        diagnostics.setOrphanSeedCount(assignment.getOrphanSeedCount());

        // ========== 阶段4：分层 ==========
        result.setLayers(assembleLayers(graph, assignment));
        diagnostics.setMaxDepth(assignment.getMaxDepth());

        // ========== 阶段5：孤立节点 ==========
        List<IndicatorRecord> isolatedNodes = new ArrayList<>();
        for (String nodeId : graph.findIsolatedNodes()) {
            isolatedNodes.add(graph.getNode(nodeId));
        }
        result.setIsolatedNodes(isolatedNodes);

        // ========== 阶段6：展示用边 ==========
        result.setEdges(collectDisplayEdges(graph, rawEdges));

        if (chainBuilder != null) {
            result.setChains(chainBuilder.buildChains(graph));
        }

        log.info("【链路图】-> 提取完成: 层数={}, 孤立节点数={}, 展示边数={}, 攻击链数={}",
                result.getLayers().size(), isolatedNodes.size(),
                result.getEdges().size(), result.getChains().size());
        log.info("【链路图】-> 统计: {}", diagnostics);
        log.info("【链路图】-> ========================================");

        return result;
    }

    /**
     * 按深度分层
     *
     * 层内顺序与指标输入顺序一致
     */
    private List<List<LayeredNode>> assembleLayers(IndicatorGraph graph, DepthAssignment assignment) {
        int maxDepth = assignment.getMaxDepth();
        List<List<LayeredNode>> layers = new ArrayList<>();
        for (int depth = 0; depth <= maxDepth; depth++) {
            layers.add(new ArrayList<>());
        }

        for (String nodeId : graph.getNodeIds()) {
            Integer depth = assignment.getDepth(nodeId);
            if (depth == null) {
                continue;
            }
            layers.get(depth).add(new LayeredNode(graph.getNode(nodeId), nodeId, depth));
        }

        for (int depth = 0; depth < layers.size(); depth++) {
            if (layers.get(depth).isEmpty()) {
                log.debug("【链路图-分层】第{}层为空", depth);
            }
        }
        return layers;
    }

    /**
     * 重新解析全部原始边，输出两端都是指标节点的边（含重复边）
     */
    private List<GraphEdge> collectDisplayEdges(IndicatorGraph graph, List<? extends Map<String, ?>> rawEdges) {
        List<GraphEdge> edges = new ArrayList<>();
        for (Map<String, ?> rawEdge : rawEdges) {
            GraphEdge edge = edgeResolver.resolve(rawEdge);
            if (edge != null && graph.hasNode(edge.getFromId()) && graph.hasNode(edge.getToId())) {
                edges.add(edge);
            }
        }
        return edges;
    }
}
