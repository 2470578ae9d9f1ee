package com.security.iocgraph.service;

import com.security.iocgraph.constants.IocGraphConstants;
import com.security.iocgraph.model.IndicatorRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 攻击链构建器
 *
 * 规则：
 * 1. 源节点 = 有出边 且 没有入边
 * 2. 源节点只有一条出边：从源节点开始，每一步沿第一条出边前进
 * 3. 源节点有多条出边：每个目标各成一条链，链首为源节点（带对应边标签）
 * 4. 遇到没有出边的节点或本条链已访问过的节点时停止
 * 5. 长度不超过1的链丢弃
 */
@Slf4j
public class AttackChainBuilder {

    /**
     * 构建所有攻击链
     *
     * @param graph 链路图
     * @return 攻击链列表（按源节点输入顺序）
     */
    public List<AttackChain> buildChains(IndicatorGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }

        List<AttackChain> chains = new ArrayList<>();
        List<String> sourceIds = graph.findRootNodes();

        for (String sourceId : sourceIds) {
            // 重复边只算一次
            List<String> targets = new ArrayList<>(new LinkedHashSet<>(graph.getChildren(sourceId)));

            if (targets.size() == 1) {
                List<AttackChain.ChainLink> links = walk(graph, sourceId, new HashSet<>());
                addIfChain(chains, links);
            } else {
                for (String targetId : targets) {
                    List<AttackChain.ChainLink> links = new ArrayList<>();
                    links.add(new AttackChain.ChainLink(graph.getNode(sourceId), labelOf(graph, sourceId, targetId)));
                    links.addAll(walk(graph, targetId, new HashSet<>()));
                    addIfChain(chains, links);
                }
            }
        }

        log.info("【攻击链】源节点数={}, 攻击链数={}", sourceIds.size(), chains.size());
        return chains;
    }

    /**
     * 从起点沿第一条出边前进
     */
    private List<AttackChain.ChainLink> walk(IndicatorGraph graph, String startId, Set<String> visited) {
        List<AttackChain.ChainLink> links = new ArrayList<>();
        String currentId = startId;

        while (currentId != null && visited.add(currentId)) {
            IndicatorRecord record = graph.getNode(currentId);
            List<String> outgoing = graph.getChildren(currentId);
            String nextId = outgoing.isEmpty() ? null : outgoing.get(0);

            String edgeLabel = nextId != null
                    ? labelOf(graph, currentId, nextId)
                    : IocGraphConstants.EdgeField.DEFAULT_LABEL;
            links.add(new AttackChain.ChainLink(record, edgeLabel));

            currentId = nextId;
        }
        return links;
    }

    private String labelOf(IndicatorGraph graph, String fromId, String toId) {
        String label = graph.getEdgeLabel(fromId, toId);
        return label != null ? label : IocGraphConstants.EdgeField.DEFAULT_LABEL;
    }

    private void addIfChain(List<AttackChain> chains, List<AttackChain.ChainLink> links) {
        if (links.size() > 1) {
            chains.add(new AttackChain(links));
        }
    }
}
