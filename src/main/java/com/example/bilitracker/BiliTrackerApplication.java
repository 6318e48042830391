package com.example.bilitracker;

import com.example.bilitracker.common.config.AppRemoteProperties;
import com.example.bilitracker.common.config.AppTrackerProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.example.bilitracker.infrastructure.persistence.mapper")
@EnableConfigurationProperties({
        AppTrackerProperties.class,
        AppRemoteProperties.class
})
public class BiliTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BiliTrackerApplication.class, args);
    }
}
