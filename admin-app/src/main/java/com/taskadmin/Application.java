package com.taskadmin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 任务管理后台启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到 trigger / infrastructure 模块中的组件与 MyBatis Mapper。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
