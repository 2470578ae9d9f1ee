package com.security.iocgraph.service;

import com.security.iocgraph.constants.IocGraphConstants;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * 深度分配结果
 */
@Getter
public class DepthAssignment {
    /** nodeId -> 深度 */
    private final Map<String, Integer> depths;
    
    /** 主遍历中深度被抬高的次数 */
    private final int revisionCount;
    
    /** 孤儿分量补偿时实际使用的起点数 */
    private final int orphanSeedCount;
    
    public DepthAssignment(Map<String, Integer> depths, int revisionCount, int orphanSeedCount) {
        this.depths = Collections.unmodifiableMap(depths);
        this.revisionCount = revisionCount;
        this.orphanSeedCount = orphanSeedCount;
    }
    
    public Integer getDepth(String nodeId) {
        return depths.get(nodeId);
    }
    
    public boolean isAssigned(String nodeId) {
        return depths.containsKey(nodeId);
    }
    
    /**
     * 最大深度，没有任何分配时返回 -1
     */
    public int getMaxDepth() {
        int max = IocGraphConstants.Layering.NO_LAYER_DEPTH;
        for (Integer depth : depths.values()) {
            max = Math.max(max, depth);
        }
        return max;
    }
}
