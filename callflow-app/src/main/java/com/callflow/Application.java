package com.callflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 通话记录决策支持服务启动类。
 * <p>
 * Application 位于顶层包路径，确保能够扫描到 trigger / domain / infrastructure 各模块中的组件。
 * </p>
 *
 * @author callflow
 * @since 2026-10-01
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
