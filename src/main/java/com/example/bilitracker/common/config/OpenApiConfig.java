package com.example.bilitracker.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI biliTrackerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Bili Tracker API")
                        .description("B站合集/系列更新监控服务接口文档")
                        .version("v1")
                        .contact(new Contact().name("bili-tracker")));
    }
}
