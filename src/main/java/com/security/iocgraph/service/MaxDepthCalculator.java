package com.security.iocgraph.service;

import com.security.iocgraph.constants.IocGraphConstants;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 最大深度计算器
 *
 * 与普通BFS不同，节点的深度取所有根到该节点路径中的最长长度：
 * 节点第一次出队后仍可能被更深的路径再次到达，此时抬高深度并重新展开子节点。
 *
 * 算法：
 * 1. 主遍历：所有根节点以深度0入队，FIFO处理，深度表只升不降
 * 2. 孤儿补偿：有边但仍未分配深度的节点（所在分量没有根，通常含环），
 *    以该节点为起点做一次普通BFS，只给尚未分配的节点赋值
 *
 * 终止性：根可达的 n 个节点之间的简单路径最多 n-1 条边，深度达到 n-1 后不再展开，
 * 因此根可达的环只会把环内节点的深度抬到上限，不会死循环。
 * n 只统计根可达的节点，孤立节点和无根分量不抬高上限。
 */
@Slf4j
public class MaxDepthCalculator {

    /**
     * 计算深度
     *
     * @param graph 链路图
     * @param rootIds 根节点ID列表
     * @return 深度分配结果
     */
    public DepthAssignment calculate(IndicatorGraph graph, List<String> rootIds) {
        if (graph == null || rootIds == null) {
            throw new IllegalArgumentException("graph and rootIds cannot be null");
        }

        Map<String, Integer> depths = new LinkedHashMap<>();
        int depthLimit = Math.max(0, countReachable(graph, rootIds) - 1);

        int revisionCount = expandFromRoots(graph, rootIds, depths, depthLimit);
        int orphanSeedCount = recoverOrphans(graph, depths);

        log.info("【分层-深度】深度计算完成: 根节点数={}, 已分配={}, 深度抬高次数={}, 孤儿起点数={}",
                rootIds.size(), depths.size(), revisionCount, orphanSeedCount);

        return new DepthAssignment(depths, revisionCount, orphanSeedCount);
    }

    /**
     * 主遍历：从根节点出发计算最大深度
     *
     * @return 深度被抬高的次数
     */
    private int expandFromRoots(IndicatorGraph graph,
                                List<String> rootIds,
                                Map<String, Integer> depths,
                                int depthLimit) {
        Queue<DepthEntry> queue = new LinkedList<>();
        for (String rootId : rootIds) {
            queue.offer(new DepthEntry(rootId, IocGraphConstants.Layering.ROOT_DEPTH));
        }

        int revisionCount = 0;
        while (!queue.isEmpty()) {
            DepthEntry current = queue.poll();
            Integer stored = depths.get(current.nodeId);

            // 已有深度不小于当前候选深度，不再展开
            if (stored != null && stored >= current.depth) {
                continue;
            }

            if (stored != null) {
                revisionCount++;
                log.debug("【分层-深度】深度抬高: {} {} -> {}", current.nodeId, stored, current.depth);
            }
            depths.put(current.nodeId, current.depth);

            if (current.depth >= depthLimit) {
                log.debug("【分层-深度】达到深度上限{}，停止展开: {}", depthLimit, current.nodeId);
                continue;
            }

            for (String child : graph.getChildren(current.nodeId)) {
                queue.offer(new DepthEntry(child, current.depth + 1));
            }
        }
        return revisionCount;
    }

    /**
     * 统计从根节点出发可达的节点数（含根节点）
     */
    private int countReachable(IndicatorGraph graph, List<String> rootIds) {
        Set<String> reachable = new HashSet<>(rootIds);
        Queue<String> queue = new LinkedList<>(rootIds);
        while (!queue.isEmpty()) {
            for (String child : graph.getChildren(queue.poll())) {
                if (reachable.add(child)) {
                    queue.offer(child);
                }
            }
        }
        return reachable.size();
    }

    /**
     * 孤儿补偿：处理没有根可达的有边节点
     *
     * @return 实际使用的起点数
     */
    private int recoverOrphans(IndicatorGraph graph, Map<String, Integer> depths) {
        int orphanSeedCount = 0;

        for (String nodeId : graph.getNodeIds()) {
            if (depths.containsKey(nodeId) || !graph.hasAnyEdge(nodeId)) {
                continue;
            }

            orphanSeedCount++;
            log.warn("【分层-孤儿】节点所在分量没有根节点（可能含环），以其为起点补偿: {}", nodeId);

            Set<String> visited = new HashSet<>();
            Queue<DepthEntry> queue = new LinkedList<>();
            queue.offer(new DepthEntry(nodeId, IocGraphConstants.Layering.ROOT_DEPTH));
            visited.add(nodeId);

            while (!queue.isEmpty()) {
                DepthEntry current = queue.poll();
                if (!depths.containsKey(current.nodeId)) {
                    depths.put(current.nodeId, current.depth);
                }

                for (String child : graph.getChildren(current.nodeId)) {
                    if (visited.add(child)) {
                        queue.offer(new DepthEntry(child, current.depth + 1));
                    }
                }
            }
        }
        return orphanSeedCount;
    }

    /**
     * 队列元素：节点 + 候选深度
     */
    private static final class DepthEntry {
        private final String nodeId;
        private final int depth;

        private DepthEntry(String nodeId, int depth) {
            this.nodeId = nodeId;
            this.depth = depth;
        }
    }
}
