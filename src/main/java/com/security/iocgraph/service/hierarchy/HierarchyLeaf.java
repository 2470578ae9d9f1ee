package com.security.iocgraph.service.hierarchy;

import com.security.iocgraph.model.IndicatorRecord;

/**
 * 叶子条目：没有出边的子指标
 */
public class HierarchyLeaf implements HierarchyNode {

    private final IndicatorRecord record;

    public HierarchyLeaf(IndicatorRecord record) {
        this.record = record;
    }

    public IndicatorRecord getRecord() {
        return record;
    }

    @Override
    public IndicatorRecord getAnchor() {
        return record;
    }

    @Override
    public boolean isGroup() {
        return false;
    }

    @Override
    public String toString() {
        return "Leaf{" + record.getId() + "}";
    }
}
