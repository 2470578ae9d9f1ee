package com.security.iocgraph.service.hierarchy;

import com.security.iocgraph.model.GraphEdge;
import com.security.iocgraph.model.IndicatorRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ParentChildHierarchyBuilder 单元测试
 *
 * 验证目标：
 * 1. 父卡片 [P] 永远不被嵌套
 * 2. 环和自环不会导致同一路径重复
 * 3. 子条目、分组、方向错误按时间升序，无法解析的时间排最后
 * 4. 方向错误只标记被子卡片 [C] 指向的父卡片 [P]
 */
public class ParentChildHierarchyBuilderTest {

    private static final Logger log = LoggerFactory.getLogger(ParentChildHierarchyBuilderTest.class);

    private ParentChildHierarchyBuilder builder;
    private Map<String, IndicatorRecord> records;

    @BeforeEach
    void setUp() {
        builder = new ParentChildHierarchyBuilder();
        records = new LinkedHashMap<>();
    }

    /**
     * 场景A：A→B→C，B、C 为子卡片
     */
    @Test
    void testLinearChain_NestedGroup() {
        parent("A", "2026-02-14 10:00:00");
        child("B", "2026-02-14 10:05:00");
        child("C", "2026-02-14 10:10:00");

        HierarchyResult result = build(edge("A", "B"), edge("B", "C"));

        assertEquals(1, result.getGroups().size(), "只有一个根分组");
        ParentChildGroup root = result.getGroups().get(0);
        assertEquals("A", root.getParent().getId());
        assertEquals(1, root.getChildren().size());

        HierarchyNode nested = root.getChildren().get(0);
        assertTrue(nested.isGroup(), "B 有出边，应为嵌套分组");
        ParentChildGroup groupB = (ParentChildGroup) nested;
        assertEquals("B", groupB.getParent().getId());
        assertEquals(Collections.singletonList("C"), anchorIds(groupB.getChildren()));
        assertFalse(groupB.getChildren().get(0).isGroup(), "C 没有出边，应为叶子");
        assertTrue(result.getDirectionalErrors().isEmpty());
        log.info("✅ 层级: {}", result.getGroups());
    }

    /**
     * 场景D：子卡片 Q 指向父卡片 P
     */
    @Test
    void testChildPointingToParent_DirectionalError() {
        parent("P", "2026-02-14 10:00:00");
        child("Q", "2026-02-14 09:00:00");

        HierarchyResult result = build(edge("Q", "P"));

        assertEquals(Collections.singletonList("P"), recordIds(result.getDirectionalErrors()));
        assertEquals(1, result.getGroups().size(), "Q 有出边无入边，作为孤立分支的根");
        ParentChildGroup groupQ = result.getGroups().get(0);
        assertEquals("Q", groupQ.getParent().getId());
        assertTrue(groupQ.getChildren().isEmpty(), "父卡片 P 不能嵌套在 Q 下");
    }

    @Test
    void testParentRoleTarget_NeverNested() {
        parent("P1", "2026-02-14 10:00:00");
        parent("P2", "2026-02-14 11:00:00");
        child("C1", "2026-02-14 12:00:00");

        HierarchyResult result = build(edge("P1", "P2"), edge("P2", "C1"));

        assertEquals(Arrays.asList("P1", "P2"), groupParentIds(result), "有出边的父卡片总是根");
        assertTrue(result.getGroups().get(0).getChildren().isEmpty(), "P2 不能嵌套在 P1 下");
        assertEquals(Collections.singletonList("C1"), anchorIds(result.getGroups().get(1).getChildren()));
        assertTrue(result.getDirectionalErrors().isEmpty(), "父→父不算方向错误");
        assertNoParentNested(result);
    }

    @Test
    void testSelfLoop_NotNestedUnderItself() {
        parent("P", "2026-02-14 10:00:00");
        child("C", "2026-02-14 10:01:00");

        HierarchyResult result = build(edge("P", "P"), edge("P", "C"));

        assertEquals(1, result.getGroups().size());
        assertEquals(Collections.singletonList("C"), anchorIds(result.getGroups().get(0).getChildren()));
        assertTrue(result.getDirectionalErrors().isEmpty(), "自环不单独报错");
    }

    @Test
    void testChildCycle_CutOnCurrentPath() {
        parent("P", "2026-02-14 10:00:00");
        child("C1", "2026-02-14 10:01:00");
        child("C2", "2026-02-14 10:02:00");

        HierarchyResult result = build(edge("P", "C1"), edge("C1", "C2"), edge("C2", "C1"));

        assertEquals(1, result.getGroups().size(), "C1、C2 都有入边，不是根");
        ParentChildGroup groupC1 = (ParentChildGroup) result.getGroups().get(0).getChildren().get(0);
        ParentChildGroup groupC2 = (ParentChildGroup) groupC1.getChildren().get(0);
        assertEquals("C2", groupC2.getParent().getId());
        assertTrue(groupC2.getChildren().isEmpty(), "C1 已在路径上，不能再次出现");
    }

    @Test
    void testSharedChild_AppearsInIndependentBranches() {
        parent("P", "2026-02-14 10:00:00");
        child("C1", "2026-02-14 10:01:00");
        child("C2", "2026-02-14 10:02:00");
        child("L", "2026-02-14 10:03:00");

        HierarchyResult result = build(edge("P", "C1"), edge("P", "C2"), edge("C1", "L"), edge("C2", "L"));

        List<HierarchyNode> branches = result.getGroups().get(0).getChildren();
        assertEquals(Arrays.asList("C1", "C2"), anchorIds(branches));
        for (HierarchyNode branch : branches) {
            assertEquals(Collections.singletonList("L"), anchorIds(((ParentChildGroup) branch).getChildren()),
                    "同一节点可以出现在不同分支中");
        }
    }

    @Test
    void testChildrenSortedByTime_UnparsableLast() {
        parent("P", "2026-02-14 07:00:00");
        child("C1", "2026-02-14 10:00:00");
        child("C3", "unknown");
        child("C2", "2026-02-14T09:00:00");
        child("C4", null);
        child("C5", "2026-02-14 08:00:00");

        HierarchyResult result = build(
                edge("P", "C1"), edge("P", "C3"), edge("P", "C2"), edge("P", "C4"), edge("P", "C5"));

        assertEquals(Arrays.asList("C5", "C2", "C1", "C3", "C4"),
                anchorIds(result.getGroups().get(0).getChildren()),
                "按时间升序，无法解析的时间排在最后并保持输入顺序");
    }

    @Test
    void testGroupsSortedByRootTime() {
        parent("LATE", "2026-02-15 10:00:00");
        parent("EARLY", "2026-02-14 10:00:00");
        child("C1", "2026-02-14 11:00:00");
        child("C2", "2026-02-15 11:00:00");

        HierarchyResult result = build(edge("LATE", "C2"), edge("EARLY", "C1"));

        assertEquals(Arrays.asList("EARLY", "LATE"), groupParentIds(result));
    }

    @Test
    void testChildRoleWithoutIncoming_BecomesRoot() {
        child("C0", "2026-02-14 10:00:00");
        child("C1", "2026-02-14 10:01:00");
        child("C2", "2026-02-14 10:02:00");

        HierarchyResult result = build(edge("C0", "C1"), edge("C1", "C2"));

        assertEquals(Collections.singletonList("C0"), groupParentIds(result), "只有 C0 没有入边");
        assertTrue(result.getDirectionalErrors().isEmpty(), "子→子不在本次检查范围内");
    }

    @Test
    void testDuplicateEdges_Collapsed() {
        parent("P", "2026-02-14 10:00:00");
        child("C", "2026-02-14 10:01:00");

        HierarchyResult result = build(edge("P", "C"), edge("P", "C"), new GraphEdge("P", "C", "again"));

        assertEquals(1, result.getGroups().get(0).getChildren().size(), "重复边应合并");
    }

    @Test
    void testUnknownEndpoints_IgnoredAndCounted() {
        parent("P", "2026-02-14 10:00:00");
        child("C", "2026-02-14 10:01:00");

        HierarchyResult result = build(edge("P", "C"), edge("P", "GHOST"), edge("GHOST", "C"));

        assertEquals(2, result.getIgnoredEdgeCount());
        assertEquals(Collections.singletonList("C"), anchorIds(result.getGroups().get(0).getChildren()));
        assertTrue(result.getDirectionalErrors().isEmpty());
    }

    /**
     * 方向错误当且仅当父卡片有来自子卡片的入边
     */
    @Test
    void testDirectionalErrors_ExactlyParentsWithChildSources() {
        parent("P1", "2026-02-14 12:00:00");
        parent("P2", "2026-02-14 11:00:00");
        parent("P3", "2026-02-14 10:00:00");
        parent("P4", "2026-02-14 09:00:00");
        child("C1", "2026-02-14 08:00:00");
        child("C2", "2026-02-14 08:30:00");

        HierarchyResult result = build(
                edge("C1", "P1"),
                edge("P4", "P2"), edge("C2", "P2"),
                edge("P4", "P3"),
                edge("P4", "C1"), edge("C1", "C2"));

        assertEquals(Arrays.asList("P2", "P1"), recordIds(result.getDirectionalErrors()),
                "P1、P2 有来自子卡片的入边，按时间升序");
        assertNoParentNested(result);
    }

    @Test
    void testIsolatedRecord_NotInAnyGroup() {
        parent("P", "2026-02-14 10:00:00");
        child("C", "2026-02-14 10:01:00");
        child("ALONE", "2026-02-14 10:02:00");

        HierarchyResult result = build(edge("P", "C"));

        Set<String> seen = new HashSet<>(groupParentIds(result));
        for (ParentChildGroup group : result.getGroups()) {
            collectIds(group.getChildren(), seen);
        }
        assertFalse(seen.contains("ALONE"), "没有边的指标不出现在任何分组中");
    }

    @Test
    void testSameInput_IdenticalResults() {
        parent("P", "2026-02-14 10:00:00");
        child("C1", "unknown");
        child("C2", "2026-02-14 10:02:00");
        child("C3", "2026-02-14 10:01:00");
        List<GraphEdge> edges = Arrays.asList(edge("P", "C1"), edge("P", "C2"), edge("C2", "C3"), edge("C3", "P"));

        HierarchyResult first = builder.build(new ArrayList<>(records.values()), edges);
        HierarchyResult second = builder.build(new ArrayList<>(records.values()), edges);

        assertEquals(first.getGroups().toString(), second.getGroups().toString());
        assertEquals(recordIds(first.getDirectionalErrors()), recordIds(second.getDirectionalErrors()));
    }

    @Test
    void testNullInput_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> builder.build(null, new ArrayList<>()));
        assertThrows(IllegalArgumentException.class, () -> builder.build(new ArrayList<>(), null));
    }

    // ========== 辅助方法 ==========

    private HierarchyResult build(GraphEdge... edges) {
        return builder.build(new ArrayList<>(records.values()), Arrays.asList(edges));
    }

    private void parent(String id, String time) {
        IndicatorRecord record = new IndicatorRecord(id, "IP Address", "10.0.0.1", time);
        record.setIsChild(false);
        records.put(id, record);
    }

    private void child(String id, String time) {
        IndicatorRecord record = new IndicatorRecord(id, "File Hash", "hash-" + id, time);
        record.setIsChild(true);
        records.put(id, record);
    }

    private static GraphEdge edge(String from, String to) {
        return new GraphEdge(from, to, "");
    }

    private static void assertNoParentNested(HierarchyResult result) {
        for (ParentChildGroup group : result.getGroups()) {
            assertNoParentIn(group.getChildren());
        }
    }

    private static void assertNoParentIn(List<HierarchyNode> children) {
        for (HierarchyNode child : children) {
            assertTrue(child.getAnchor().childRole(), "父卡片不能出现在子条目中: " + child.getAnchor().getId());
            if (child.isGroup()) {
                assertNoParentIn(((ParentChildGroup) child).getChildren());
            }
        }
    }

    private static void collectIds(List<HierarchyNode> children, Set<String> seen) {
        for (HierarchyNode child : children) {
            seen.add(child.getAnchor().getId());
            if (child.isGroup()) {
                collectIds(((ParentChildGroup) child).getChildren(), seen);
            }
        }
    }

    private static List<String> anchorIds(List<HierarchyNode> nodes) {
        List<String> ids = new ArrayList<>();
        for (HierarchyNode node : nodes) {
            ids.add(node.getAnchor().getId());
        }
        return ids;
    }

    private static List<String> groupParentIds(HierarchyResult result) {
        List<String> ids = new ArrayList<>();
        for (ParentChildGroup group : result.getGroups()) {
            ids.add(group.getParent().getId());
        }
        return ids;
    }

    private static List<String> recordIds(List<IndicatorRecord> list) {
        List<String> ids = new ArrayList<>();
        for (IndicatorRecord record : list) {
            ids.add(record.getId());
        }
        return ids;
    }
}
