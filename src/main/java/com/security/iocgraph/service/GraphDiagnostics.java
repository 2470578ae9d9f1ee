package com.security.iocgraph.service;

import lombok.Getter;
import lombok.Setter;

/**
 * 链路图统计信息
 */
@Getter
@Setter
public class GraphDiagnostics {
    /** 画布原始节点总数 */
    private int totalNodes;
    
    /** 原始边总数 */
    private int totalEdges;
    
    /** 指标节点数 */
    private int indicatorCount;
    
    /** 有效连接数（含重复边） */
    private int validConnectionCount;
    
    /** 根节点数 */
    private int rootCount;
    
    /** 丢弃的边数 */
    private int droppedEdgeCount;
    
    /** 孤儿分量补偿起点数 */
    private int orphanSeedCount;
    
    /** 环中节点数 */
    private int cycleNodeCount;
    
    /** 最大深度，没有层时为 -1 */
    private int maxDepth = -1;
    
    @Override
    public String toString() {
        return "GraphDiagnostics{totalNodes=" + totalNodes
                + ", totalEdges=" + totalEdges
                + ", indicatorCount=" + indicatorCount
                + ", validConnectionCount=" + validConnectionCount
                + ", rootCount=" + rootCount
                + ", droppedEdgeCount=" + droppedEdgeCount
                + ", orphanSeedCount=" + orphanSeedCount
                + ", cycleNodeCount=" + cycleNodeCount
                + ", maxDepth=" + maxDepth + "}";
    }
}
