package com.security.iocgraph.config;

import com.security.iocgraph.constants.IocGraphConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * IOC 链路图配置类
 */
@Configuration
@ConfigurationProperties(prefix = "ioc-graph")
public class IocGraphConfig {

    /**
     * 边起点字段（按优先级）
     */
    private List<String> edgeFromFields = new ArrayList<>(IocGraphConstants.EdgeField.FROM_FIELDS);

    /**
     * 边终点字段（按优先级）
     */
    private List<String> edgeToFields = new ArrayList<>(IocGraphConstants.EdgeField.TO_FIELDS);

    /**
     * 边标签字段（按优先级）
     */
    private List<String> edgeLabelFields = new ArrayList<>(IocGraphConstants.EdgeField.LABEL_FIELDS);

    /**
     * 是否在链路图结果中附带攻击链
     */
    private boolean attackChainsEnabled = true;

    // Getters and Setters
    public List<String> getEdgeFromFields() {
        return edgeFromFields;
    }

    public void setEdgeFromFields(List<String> edgeFromFields) {
        this.edgeFromFields = edgeFromFields;
    }

    public List<String> getEdgeToFields() {
        return edgeToFields;
    }

    public void setEdgeToFields(List<String> edgeToFields) {
        this.edgeToFields = edgeToFields;
    }

    public List<String> getEdgeLabelFields() {
        return edgeLabelFields;
    }

    public void setEdgeLabelFields(List<String> edgeLabelFields) {
        this.edgeLabelFields = edgeLabelFields;
    }

    public boolean isAttackChainsEnabled() {
        return attackChainsEnabled;
    }

    public void setAttackChainsEnabled(boolean attackChainsEnabled) {
        this.attackChainsEnabled = attackChainsEnabled;
    }
}
