package com.security.iocgraph.model;

import com.security.iocgraph.constants.IocGraphConstants;

import java.util.Objects;

/**
 * 链路边（解析后返回给展示层的边结构）
 * 方向：fromId = 父，toId = 子
 */
public class GraphEdge {
    /**
     * 起点节点ID
     */
    private String fromId;
    
    /**
     * 终点节点ID
     */
    private String toId;
    
    /**
     * 边标签（箭头上的文字），没有时为空串
     */
    private String label;
    
    /**
     * 无参构造函数，label 默认为空串
     */
    public GraphEdge() {
        this.label = IocGraphConstants.EdgeField.DEFAULT_LABEL;
    }
    
    public GraphEdge(String fromId, String toId, String label) {
        this.fromId = fromId;
        this.toId = toId;
        this.label = label != null ? label : IocGraphConstants.EdgeField.DEFAULT_LABEL;
    }
    
    // Getters and Setters
    
    public String getFromId() {
        return fromId;
    }
    
    public void setFromId(String fromId) {
        this.fromId = fromId;
    }
    
    public String getToId() {
        return toId;
    }
    
    public void setToId(String toId) {
        this.toId = toId;
    }
    
    public String getLabel() {
        return label;
    }
    
    public void setLabel(String label) {
        this.label = label != null ? label : IocGraphConstants.EdgeField.DEFAULT_LABEL;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GraphEdge)) {
            return false;
        }
        GraphEdge that = (GraphEdge) o;
        return Objects.equals(fromId, that.fromId)
                && Objects.equals(toId, that.toId)
                && Objects.equals(label, that.label);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(fromId, toId, label);
    }
    
    @Override
    public String toString() {
        return fromId + " → " + toId + (label.isEmpty() ? "" : " (" + label + ")");
    }
}
