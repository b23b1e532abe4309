package com.work.oracle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：定时轮询 campaign 并结算，同时暴露运维 REST 接口。
 */
@SpringBootApplication
@EnableScheduling
public class CampaignOracleApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampaignOracleApplication.class, args);
    }
}
