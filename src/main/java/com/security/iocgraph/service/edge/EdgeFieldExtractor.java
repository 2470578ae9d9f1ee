package com.security.iocgraph.service.edge;

import java.util.Map;

/**
 * 边字段提取器接口
 * 从一条原始边中提取单个字段（端点ID或标签）
 */
@FunctionalInterface
public interface EdgeFieldExtractor {
    /**
     * 提取字段值
     * 
     * @param rawEdge 原始边描述
     * @return 提取到的非空值；该编码不适用时返回 null
     */
    String extract(Map<String, ?> rawEdge);
}
