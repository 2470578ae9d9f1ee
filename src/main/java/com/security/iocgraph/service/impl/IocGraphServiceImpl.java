package com.security.iocgraph.service.impl;

import com.security.iocgraph.config.IocGraphConfig;
import com.security.iocgraph.model.GraphEdge;
import com.security.iocgraph.model.GraphSnapshot;
import com.security.iocgraph.model.IndicatorRecord;
import com.security.iocgraph.service.AttackChainBuilder;
import com.security.iocgraph.service.ChronologicalTimelineBuilder;
import com.security.iocgraph.service.IndicatorGraphExtractor;
import com.security.iocgraph.service.LinkGraphResult;
import com.security.iocgraph.service.MaxDepthCalculator;
import com.security.iocgraph.service.TimelineResult;
import com.security.iocgraph.service.edge.EdgeResolver;
import com.security.iocgraph.service.hierarchy.HierarchyResult;
import com.security.iocgraph.service.hierarchy.ParentChildHierarchyBuilder;
import com.security.iocgraph.util.LinkEdgeValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * IOC 链路图服务
 *
 * 每次调用基于一个画布快照，按配置创建边解析器后交给各组件计算，不保留状态
 */
@Slf4j
@Service
public class IocGraphServiceImpl {

    @Autowired
    private IocGraphConfig config;

    /**
     * 提取分层链路图
     *
     * @param snapshot 画布快照
     * @return 分层结果
     */
    public LinkGraphResult extractLinkGraph(GraphSnapshot snapshot) {
        requireSnapshot(snapshot);

        EdgeResolver resolver = EdgeResolver.fromConfig(config);
        AttackChainBuilder chainBuilder = config != null && !config.isAttackChainsEnabled()
                ? null : new AttackChainBuilder();

        IndicatorGraphExtractor extractor = new IndicatorGraphExtractor(resolver, new MaxDepthCalculator(), chainBuilder);
        return extractor.extract(snapshot);
    }

    /**
     * 构建父子层级
     *
     * @param snapshot 画布快照
     * @return 层级结果
     */
    public HierarchyResult buildHierarchy(GraphSnapshot snapshot) {
        requireSnapshot(snapshot);
        if (snapshot.getRawEdges() == null) {
            throw new IllegalArgumentException("rawEdges cannot be null");
        }

        List<IndicatorRecord> records = snapshot.getIndicators();
        List<GraphEdge> edges = resolveEdges(EdgeResolver.fromConfig(config), snapshot.getRawEdges());
        List<GraphEdge> normalized = LinkEdgeValidator.normalize(records, edges);

        return new ParentChildHierarchyBuilder().build(records, normalized);
    }

    /**
     * 构建时间线，from/to 任一不为空时按闭区间过滤
     *
     * @param snapshot 画布快照
     * @param from 起始时间（毫秒），可为空
     * @param to 结束时间（毫秒），可为空
     * @return 时间线结果
     */
    public TimelineResult buildTimeline(GraphSnapshot snapshot, Long from, Long to) {
        requireSnapshot(snapshot);

        ChronologicalTimelineBuilder builder = new ChronologicalTimelineBuilder();
        TimelineResult timeline = builder.build(snapshot.getIndicators());
        if (from == null && to == null) {
            return timeline;
        }
        return builder.filterRange(timeline, from, to);
    }

    private List<GraphEdge> resolveEdges(EdgeResolver resolver, List<Map<String, Object>> rawEdges) {
        List<GraphEdge> edges = new ArrayList<>();
        int unresolved = 0;
        for (Map<String, Object> rawEdge : rawEdges) {
            GraphEdge edge = resolver.resolve(rawEdge);
            if (edge == null) {
                unresolved++;
            } else {
                edges.add(edge);
            }
        }
        if (unresolved > 0) {
            log.warn("【边解析】{} 条原始边端点无法解析，已丢弃", unresolved);
        }
        return edges;
    }

    private void requireSnapshot(GraphSnapshot snapshot) {
        if (snapshot == null) {
            log.error("【输入验证失败】-> 画布快照为空");
            throw new IllegalArgumentException("GraphSnapshot cannot be null");
        }
        if (snapshot.getIndicators() == null) {
            log.error("【输入验证失败】-> 指标列表为空");
            throw new IllegalArgumentException("indicators cannot be null");
        }
    }
}
