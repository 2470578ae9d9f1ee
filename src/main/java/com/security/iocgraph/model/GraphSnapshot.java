package com.security.iocgraph.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 画布快照（一次分析调用的完整输入）
 * 
 * 每次调用只基于一个快照计算，不假设两次调用之间快照不变
 */
@Getter
@Setter
public class GraphSnapshot {
    /**
     * 画布原始节点总数（仅用于统计），小于0时按指标数计
     */
    private int totalNodes = -1;
    
    /**
     * 已解析的指标记录
     */
    private List<IndicatorRecord> indicators = new ArrayList<>();
    
    /**
     * 原始边描述（字段名随上游编码不同而不同）
     */
    private List<Map<String, Object>> rawEdges = new ArrayList<>();
    
    public GraphSnapshot() {
    }
    
    public GraphSnapshot(int totalNodes, List<IndicatorRecord> indicators, List<Map<String, Object>> rawEdges) {
        this.totalNodes = totalNodes;
        this.indicators = indicators;
        this.rawEdges = rawEdges;
    }
    
    /**
     * 实际参与统计的节点总数
     */
    public int effectiveTotalNodes() {
        if (totalNodes >= 0) {
            return totalNodes;
        }
        return indicators != null ? indicators.size() : 0;
    }
}
