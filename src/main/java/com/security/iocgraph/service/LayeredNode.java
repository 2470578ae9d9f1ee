package com.security.iocgraph.service;

import com.security.iocgraph.model.IndicatorRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 分层节点：某一层中的一个指标
 */
@Getter
@AllArgsConstructor
public class LayeredNode {
    private final IndicatorRecord data;
    private final String nodeId;
    private final int depth;
}
