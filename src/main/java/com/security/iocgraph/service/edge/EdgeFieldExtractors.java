package com.security.iocgraph.service.edge;

import com.security.iocgraph.constants.IocGraphConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 边字段提取器工厂
 * 
 * 支持的取值形态：
 * 1. 字符串/数字：edge.fromNode = "abc"
 * 2. 嵌套对象：edge.from = {id: "abc"}
 * 3. 画布内部结构：edge.from = {node: {id: "abc"}}
 */
public final class EdgeFieldExtractors {

    private EdgeFieldExtractors() {}

    /**
     * 按字段名提取
     */
    public static EdgeFieldExtractor field(String fieldName) {
        return rawEdge -> toText(rawEdge.get(fieldName));
    }

    /**
     * 按字段名列表（优先级顺序）生成提取器链
     */
    public static List<EdgeFieldExtractor> fields(List<String> fieldNames) {
        List<EdgeFieldExtractor> extractors = new ArrayList<>();
        if (fieldNames == null) {
            return extractors;
        }
        for (String fieldName : fieldNames) {
            if (fieldName != null && !fieldName.trim().isEmpty()) {
                extractors.add(field(fieldName.trim()));
            }
        }
        return extractors;
    }

    /**
     * 将字段值转换为非空文本
     */
    private static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map) {
            Map<?, ?> nested = (Map<?, ?>) value;
            Object node = nested.get(IocGraphConstants.EdgeField.NESTED_NODE);
            if (node instanceof Map) {
                return toText(((Map<?, ?>) node).get(IocGraphConstants.EdgeField.NESTED_ID));
            }
            return toText(nested.get(IocGraphConstants.EdgeField.NESTED_ID));
        }
        if (value instanceof CharSequence || value instanceof Number) {
            String text = value.toString();
            return text.trim().isEmpty() ? null : text;
        }
        return null;
    }
}
