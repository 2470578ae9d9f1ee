package com.security.iocgraph.service;

import com.security.iocgraph.model.GraphEdge;
import com.security.iocgraph.model.IndicatorRecord;
import com.security.iocgraph.service.edge.EdgeResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;

/**
 * IOC 链路图构建器
 *
 * 职责：
 * 1. 为每个指标建立索引，初始化空的出边/入边列表
 * 2. 通过 EdgeResolver 解析原始边，只保留两端都是指标节点的边
 * 3. 统计被丢弃的边，不抛异常
 */
@Slf4j
public class IndicatorGraphBuilder {

    private final EdgeResolver edgeResolver;

    public IndicatorGraphBuilder(EdgeResolver edgeResolver) {
        if (edgeResolver == null) {
            throw new IllegalArgumentException("EdgeResolver cannot be null");
        }
        this.edgeResolver = edgeResolver;
    }

    /**
     * 从指标和原始边构建图
     *
     * @param indicators 指标列表
     * @param rawEdges 原始边列表
     * @return 链路图
     */
    public IndicatorGraph buildGraph(Collection<IndicatorRecord> indicators,
                                     Collection<? extends Map<String, ?>> rawEdges) {
        if (indicators == null) {
            throw new IllegalArgumentException("indicators cannot be null");
        }
        if (rawEdges == null) {
            throw new IllegalArgumentException("rawEdges cannot be null");
        }

        IndicatorGraph graph = new IndicatorGraph();

        log.info("【建图】开始构建链路图: 指标数={}, 原始边数={}", indicators.size(), rawEdges.size());

        // 阶段1：指标索引
        for (IndicatorRecord record : indicators) {
            if (!graph.addNode(record)) {
                graph.markNodeSkipped();
                log.debug("【建图-指标】跳过无ID指标: {}", record);
            }
        }

        // 阶段2：边解析
        int edgeIndex = 0;
        for (Map<String, ?> rawEdge : rawEdges) {
            GraphEdge edge = edgeResolver.resolve(rawEdge);
            if (edge == null) {
                graph.markEdgeDropped();
                log.debug("【建图-边】第{}条边端点无法解析，丢弃", edgeIndex);
            } else if (!graph.addEdge(edge.getFromId(), edge.getToId(), edge.getLabel())) {
                graph.markEdgeDropped();
                log.debug("【建图-边】第{}条边端点不是指标节点，丢弃: {}", edgeIndex, edge);
            } else {
                log.debug("【建图-边】有效连接: {}", edge);
            }
            edgeIndex++;
        }

        log.info("【建图】构建完成: 节点数={}, 有效边数={}, 丢弃边数={}, 跳过指标数={}",
                graph.getNodeCount(),
                graph.getEdgeCount(),
                graph.getDroppedEdgeCount(),
                graph.getSkippedNodeCount());

        return graph;
    }
}
