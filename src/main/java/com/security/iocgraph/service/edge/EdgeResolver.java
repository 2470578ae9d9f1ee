package com.security.iocgraph.service.edge;

import com.security.iocgraph.config.IocGraphConfig;
import com.security.iocgraph.constants.IocGraphConstants;
import com.security.iocgraph.model.GraphEdge;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 原始边解析器
 * 
 * 起点、终点、标签各自对应一条提取器链，按顺序尝试，取第一个成功的结果。
 * 起点或终点任一缺失的边视为无法解析，返回 null（不抛异常）。
 */
@Slf4j
public class EdgeResolver {
    
    private final List<EdgeFieldExtractor> fromExtractors;
    private final List<EdgeFieldExtractor> toExtractors;
    private final List<EdgeFieldExtractor> labelExtractors;
    
    public EdgeResolver(List<EdgeFieldExtractor> fromExtractors,
                        List<EdgeFieldExtractor> toExtractors,
                        List<EdgeFieldExtractor> labelExtractors) {
        if (fromExtractors == null || toExtractors == null) {
            throw new IllegalArgumentException("endpoint extractors cannot be null");
        }
        this.fromExtractors = new ArrayList<>(fromExtractors);
        this.toExtractors = new ArrayList<>(toExtractors);
        this.labelExtractors = labelExtractors != null
                ? new ArrayList<>(labelExtractors) : Collections.emptyList();
    }
    
    /**
     * 默认字段优先级的解析器
     */
    public static EdgeResolver defaults() {
        return new EdgeResolver(
                EdgeFieldExtractors.fields(IocGraphConstants.EdgeField.FROM_FIELDS),
                EdgeFieldExtractors.fields(IocGraphConstants.EdgeField.TO_FIELDS),
                EdgeFieldExtractors.fields(IocGraphConstants.EdgeField.LABEL_FIELDS));
    }
    
    /**
     * 按配置的字段优先级创建解析器
     */
    public static EdgeResolver fromConfig(IocGraphConfig config) {
        if (config == null) {
            return defaults();
        }
        return new EdgeResolver(
                EdgeFieldExtractors.fields(config.getEdgeFromFields()),
                EdgeFieldExtractors.fields(config.getEdgeToFields()),
                EdgeFieldExtractors.fields(config.getEdgeLabelFields()));
    }
    
    /**
     * 解析一条原始边
     * 
     * @param rawEdge 原始边描述
     * @return 解析结果；端点缺失时返回 null
     */
    public GraphEdge resolve(Map<String, ?> rawEdge) {
        if (rawEdge == null) {
            return null;
        }
        
        String fromId = firstMatch(fromExtractors, rawEdge);
        String toId = firstMatch(toExtractors, rawEdge);
        if (fromId == null || toId == null) {
            log.debug("【边解析】端点缺失，跳过: from={}, to={}, keys={}", fromId, toId, rawEdge.keySet());
            return null;
        }
        
        String label = firstMatch(labelExtractors, rawEdge);
        return new GraphEdge(fromId, toId, label);
    }
    
    /**
     * 依次尝试提取器，返回第一个非空结果
     */
    private String firstMatch(List<EdgeFieldExtractor> extractors, Map<String, ?> rawEdge) {
        for (EdgeFieldExtractor extractor : extractors) {
            String value = extractor.extract(rawEdge);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
