package com.security.iocgraph.model;

import com.security.iocgraph.constants.IocGraphConstants;
import lombok.Getter;
import lombok.Setter;

/**
 * IOC 指标记录（由上游卡片解析得到）
 * 
 * 核心只读取 id、time 和 isChild，其余字段原样透传给展示层
 */
@Getter
@Setter
public class IndicatorRecord {
    /** 画布节点ID（同一次构建内唯一） */
    private String id;
    
    /** 卡片编号，如 "#20260214-1534" */
    private String cardId;
    
    /** IOC 类型，如 "IP Address"、"File Hash" */
    private String type;
    
    /** 主值（第一个代码块中的内容） */
    private String value;
    
    /** 事件时间 Time of Event */
    private String time;
    
    private String splunkQuery;
    
    /** MITRE ATT&CK 战术 */
    private String tactic;
    
    /** MITRE ATT&CK 技术 */
    private String technique;
    
    private String icon;
    private String color;
    
    /**
     * 卡片角色：true 表示子卡片 [C]，null/false 表示父卡片 [P]
     */
    private Boolean isChild;
    
    public IndicatorRecord() {
    }
    
    public IndicatorRecord(String id, String type, String value, String time) {
        this.id = id;
        this.type = type;
        this.value = value;
        this.time = time;
    }
    
    /**
     * 是否为子卡片 [C]
     */
    public boolean childRole() {
        return Boolean.TRUE.equals(isChild);
    }
    
    @Override
    public String toString() {
        return "IndicatorRecord{id=" + id + ", type=" + type + ", time=" + time
                + ", role=" + (childRole() ? IocGraphConstants.Role.CHILD : IocGraphConstants.Role.PARENT) + "}";
    }
}
