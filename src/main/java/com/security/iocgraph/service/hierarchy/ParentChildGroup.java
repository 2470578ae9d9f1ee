package com.security.iocgraph.service.hierarchy;

import com.security.iocgraph.model.IndicatorRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 父子分组：一个父指标及其按时间排序的子条目
 *
 * 子条目中不会出现父卡片 [P]，同一条路径上不会重复出现同一指标
 */
public class ParentChildGroup implements HierarchyNode {

    private final IndicatorRecord parent;
    private final List<HierarchyNode> children;

    public ParentChildGroup(IndicatorRecord parent, List<HierarchyNode> children) {
        this.parent = parent;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public IndicatorRecord getParent() {
        return parent;
    }

    public List<HierarchyNode> getChildren() {
        return children;
    }

    @Override
    public IndicatorRecord getAnchor() {
        return parent;
    }

    @Override
    public boolean isGroup() {
        return true;
    }

    @Override
    public String toString() {
        return "Group{" + parent.getId() + " -> " + children + "}";
    }
}
