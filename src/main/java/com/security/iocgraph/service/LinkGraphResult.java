package com.security.iocgraph.service;

import com.security.iocgraph.model.GraphEdge;
import com.security.iocgraph.model.IndicatorRecord;
import lombok.Getter;
import lombok.Setter;

import java.util.*;

/**
 * 链路图分层结果
 */
@Getter
@Setter
public class LinkGraphResult {
    /** 是否找到指标节点 */
    private boolean graphFound;
    
    /** 分层：下标即深度，0..maxDepth，空层保留为空列表 */
    private List<List<LayeredNode>> layers = new ArrayList<>();
    
    /** 所有有效边（用于画箭头） */
    private List<GraphEdge> edges = new ArrayList<>();
    
    /** 孤立节点（没有任何连接） */
    private List<IndicatorRecord> isolatedNodes = new ArrayList<>();
    
    /** 攻击链 */
    private List<AttackChain> chains = new ArrayList<>();
    
    private GraphDiagnostics diagnostics = new GraphDiagnostics();
    
    // ========== 便捷方法 ==========
    
    /**
     * 所有分层节点的ID（按层、层内顺序）
     */
    public List<String> layeredNodeIds() {
        List<String> ids = new ArrayList<>();
        for (List<LayeredNode> layer : layers) {
            for (LayeredNode node : layer) {
                ids.add(node.getNodeId());
            }
        }
        return ids;
    }
    
    /**
     * 查找节点所在的层，不在任何层时返回 -1
     */
    public int findDepth(String nodeId) {
        for (int depth = 0; depth < layers.size(); depth++) {
            for (LayeredNode node : layers.get(depth)) {
                if (node.getNodeId().equals(nodeId)) {
                    return depth;
                }
            }
        }
        return -1;
    }
}
