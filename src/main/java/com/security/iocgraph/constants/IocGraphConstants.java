package com.security.iocgraph.constants;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * IOC 链路图相关常量定义
 */
public final class IocGraphConstants {

    private IocGraphConstants() {
        // 工具类，防止实例化
    }

    /**
     * 时间相关常量
     */
    public static final class Time {
        private Time() {}
        
        /** 卡片中 Time of Event 的日期时间格式 */
        public static final String DATE_TIME_FORMAT = "yyyy-MM-dd HH:mm:ss";
    }

    /**
     * 卡片角色常量
     */
    public static final class Role {
        private Role() {}
        
        /** 父卡片 [P] */
        public static final String PARENT = "parent";
        
        /** 子卡片 [C] */
        public static final String CHILD = "child";
    }

    /**
     * 原始边字段常量
     * 
     * 画布边有多种上游编码（Obsidian 内部 API、.canvas 文件、第三方导出），
     * 按优先级依次尝试，取第一个有值的字段
     */
    public static final class EdgeField {
        private EdgeField() {}
        
        /** 起点字段（优先级从高到低） */
        public static final List<String> FROM_FIELDS = Collections.unmodifiableList(Arrays.asList(
            "fromNode", "from", "source", "sourceId", "fromId"
        ));
        
        /** 终点字段（优先级从高到低） */
        public static final List<String> TO_FIELDS = Collections.unmodifiableList(Arrays.asList(
            "toNode", "to", "target", "targetId", "toId"
        ));
        
        /** 标签字段（优先级从高到低） */
        public static final List<String> LABEL_FIELDS = Collections.unmodifiableList(Arrays.asList(
            "label", "text"
        ));
        
        /** 嵌套端点对象中的节点字段：edge.from.node.id */
        public static final String NESTED_NODE = "node";
        
        /** 嵌套端点对象中的ID字段 */
        public static final String NESTED_ID = "id";
        
        /** 默认边标签 */
        public static final String DEFAULT_LABEL = "";
    }

    /**
     * 链路图计算相关常量
     */
    public static final class Layering {
        private Layering() {}
        
        /** 根节点的深度 */
        public static final int ROOT_DEPTH = 0;
        
        /** 没有任何层时的最大深度 */
        public static final int NO_LAYER_DEPTH = -1;
        
        /** 边值映射的键分隔符：key="from->to" */
        public static final String EDGE_KEY_SEPARATOR = "->";
    }
}
