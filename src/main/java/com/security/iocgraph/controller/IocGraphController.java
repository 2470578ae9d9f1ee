package com.security.iocgraph.controller;

import com.security.iocgraph.model.GraphSnapshot;
import com.security.iocgraph.service.LinkGraphResult;
import com.security.iocgraph.service.TimelineResult;
import com.security.iocgraph.service.hierarchy.HierarchyResult;
import com.security.iocgraph.service.impl.IocGraphServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.Map;

/**
 * IOC 链路图 REST API 控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/ioc-graph")
public class IocGraphController {

    @Autowired
    private IocGraphServiceImpl iocGraphService;

    /**
     * 提取分层链路图
     *
     * @param snapshot 画布快照
     * @return 分层结果
     */
    @PostMapping("/link-graph")
    public LinkGraphResult extractLinkGraph(@RequestBody(required = false) GraphSnapshot snapshot) {
        log.info("收到链路图提取请求");
        return iocGraphService.extractLinkGraph(snapshot);
    }

    /**
     * 构建父子层级
     */
    @PostMapping("/hierarchy")
    public HierarchyResult buildHierarchy(@RequestBody(required = false) GraphSnapshot snapshot) {
        log.info("收到父子层级构建请求");
        return iocGraphService.buildHierarchy(snapshot);
    }

    /**
     * 构建时间线
     *
     * @param from 起始时间（毫秒），可选
     * @param to 结束时间（毫秒），可选
     */
    @PostMapping("/timeline")
    public TimelineResult buildTimeline(@RequestBody(required = false) GraphSnapshot snapshot,
                                        @RequestParam(required = false) Long from,
                                        @RequestParam(required = false) Long to) {
        log.info("收到时间线请求: from={}, to={}", from, to);
        return iocGraphService.buildTimeline(snapshot, from, to);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        log.error("【输入验证失败】-> {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Collections.singletonMap("error", e.getMessage()));
    }
}
