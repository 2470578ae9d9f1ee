package com.security.iocgraph.service.hierarchy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.security.iocgraph.model.IndicatorRecord;

/**
 * 层级树中的一个条目：叶子指标或嵌套的父子分组
 */
public interface HierarchyNode {

    /**
     * 条目的锚点指标（叶子为自身，分组为分组的父指标），用于排序
     */
    @JsonIgnore
    IndicatorRecord getAnchor();

    /**
     * 是否为嵌套分组
     */
    boolean isGroup();
}
