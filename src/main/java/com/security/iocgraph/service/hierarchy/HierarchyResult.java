package com.security.iocgraph.service.hierarchy;

import com.security.iocgraph.model.IndicatorRecord;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 父子层级构建结果
 */
@Getter
@Setter
public class HierarchyResult {

    /** 顶层分组（每个根父指标一个，按时间升序） */
    private List<ParentChildGroup> groups = new ArrayList<>();

    /** 方向错误：有子卡片 [C] 指向它的父卡片 [P]（按时间升序） */
    private List<IndicatorRecord> directionalErrors = new ArrayList<>();

    /** 端点不在指标集合中而被忽略的边数 */
    private int ignoredEdgeCount;
}
