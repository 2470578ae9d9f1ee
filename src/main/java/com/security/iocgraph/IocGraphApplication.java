package com.security.iocgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * IOC 链路图分析服务 - SpringBoot启动类
 * 
 * @author Security Team
 * @version 1.0.0
 */
@SpringBootApplication
public class IocGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(IocGraphApplication.class, args);
        System.out.println("========================================");
        System.out.println("IOC 链路图分析服务启动成功！");
        System.out.println("========================================");
    }
}
