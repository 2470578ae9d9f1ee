package com.security.iocgraph;

import com.security.iocgraph.config.IocGraphConfig;
import com.security.iocgraph.controller.IocGraphController;
import com.security.iocgraph.service.impl.IocGraphServiceImpl;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 启动上下文测试：配置绑定和 Bean 装配
 */
@SpringBootTest
public class IocGraphApplicationTest {

    @Autowired
    private IocGraphConfig config;

    @Autowired
    private IocGraphServiceImpl iocGraphService;

    @Autowired
    private IocGraphController controller;

    @Test
    void testContextLoads_ConfigBound() {
        assertNotNull(iocGraphService);
        assertNotNull(controller);
        assertEquals(Arrays.asList("fromNode", "from", "source", "sourceId", "fromId"), config.getEdgeFromFields());
        assertEquals(Arrays.asList("label", "text"), config.getEdgeLabelFields());
        assertTrue(config.isAttackChainsEnabled());
    }
}
