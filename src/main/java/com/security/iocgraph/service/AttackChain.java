package com.security.iocgraph.service;

import com.security.iocgraph.model.IndicatorRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 攻击链：从源节点出发的一条线性路径
 */
public class AttackChain {
    
    private final List<ChainLink> links;
    
    public AttackChain(List<ChainLink> links) {
        this.links = Collections.unmodifiableList(new ArrayList<>(links));
    }
    
    public List<ChainLink> getLinks() {
        return links;
    }
    
    public int size() {
        return links.size();
    }
    
    /**
     * 链上节点ID（按顺序）
     */
    public List<String> nodeIds() {
        List<String> ids = new ArrayList<>();
        for (ChainLink link : links) {
            ids.add(link.getRecord().getId());
        }
        return ids;
    }
    
    /**
     * 链上一个节点，edgeLabel 为它指向下一节点的边标签，链尾为空串
     */
    @Getter
    @AllArgsConstructor
    public static class ChainLink {
        private final IndicatorRecord record;
        private final String edgeLabel;
    }
}
