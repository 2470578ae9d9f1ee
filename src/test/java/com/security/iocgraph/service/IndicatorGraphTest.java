package com.security.iocgraph.service;

import com.security.iocgraph.model.IndicatorRecord;
import com.security.iocgraph.service.edge.EdgeResolver;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IndicatorGraph / IndicatorGraphBuilder 单元测试
 */
public class IndicatorGraphTest {

    @Test
    void testAddEdge_RequiresIndexedEndpoints() {
        IndicatorGraph graph = new IndicatorGraph();
        graph.addNode(new IndicatorRecord("A", "IP Address", "1.1.1.1", null));

        assertFalse(graph.addEdge("A", "B", ""), "终点不是指标节点时不能加边");
        assertFalse(graph.addEdge(null, "A", ""));
        assertEquals(0, graph.getEdgeCount());
        assertFalse(graph.addNode(new IndicatorRecord(null, "IP Address", "2.2.2.2", null)), "无ID指标不能索引");
    }

    @Test
    void testRootsAndIsolated_InInputOrder() {
        IndicatorGraph graph = new IndicatorGraph();
        for (String id : Arrays.asList("I", "B", "A", "C")) {
            graph.addNode(new IndicatorRecord(id, "Domain", id, null));
        }
        graph.addEdge("B", "C", "");
        graph.addEdge("A", "C", "");

        assertEquals(Arrays.asList("B", "A"), graph.findRootNodes(), "根节点按输入顺序");
        assertEquals(Collections.singletonList("I"), graph.findIsolatedNodes());
        assertEquals(2, graph.getInDegree("C"));
    }

    @Test
    void testEdgeLabel_LastWriteWins() {
        IndicatorGraph graph = new IndicatorGraph();
        graph.addNode(new IndicatorRecord("A", "Domain", "a", null));
        graph.addNode(new IndicatorRecord("B", "Domain", "b", null));

        graph.addEdge("A", "B", "first");
        graph.addEdge("A", "B", "second");

        assertEquals("second", graph.getEdgeLabel("A", "B"));
        assertEquals(Arrays.asList("B", "B"), graph.getChildren("A"), "重复边保留");
        assertNull(graph.getEdgeLabel("B", "A"));
    }

    @Test
    void testDetectCycles_OnlyCycleMembers() {
        IndicatorGraph graph = new IndicatorGraph();
        for (String id : Arrays.asList("R", "A", "B", "C", "S")) {
            graph.addNode(new IndicatorRecord(id, "Domain", id, null));
        }
        graph.addEdge("R", "A", "");
        graph.addEdge("A", "B", "");
        graph.addEdge("B", "C", "");
        graph.addEdge("C", "A", "");
        graph.addEdge("S", "S", "");

        Set<String> cycleNodes = graph.detectCycles();

        assertEquals(new HashSet<>(Arrays.asList("A", "B", "C", "S")), cycleNodes, "R 不在环上");
    }

    @Test
    void testBuilder_CountsDroppedEdgesAndSkippedRecords() {
        List<IndicatorRecord> records = Arrays.asList(
                new IndicatorRecord("A", "Domain", "a", null),
                new IndicatorRecord(null, "Domain", "no-id", null),
                new IndicatorRecord("B", "Domain", "b", null));
        Map<String, Object> valid = new HashMap<>();
        valid.put("source", "A");
        valid.put("target", "B");
        Map<String, Object> unknown = new HashMap<>();
        unknown.put("source", "A");
        unknown.put("target", "Q");

        IndicatorGraph graph = new IndicatorGraphBuilder(EdgeResolver.defaults())
                .buildGraph(records, Arrays.asList(valid, unknown, null));

        assertEquals(2, graph.getNodeCount());
        assertEquals(1, graph.getSkippedNodeCount());
        assertEquals(1, graph.getEdgeCount());
        assertEquals(2, graph.getDroppedEdgeCount(), "未知端点和 null 边都应计为丢弃");
    }
}
