package com.sqllint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * SQL 布局检查服务
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SqlLintApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlLintApplication.class, args);
    }
}
