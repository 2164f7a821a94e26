package com.genbridge.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Generation gateway: exposes DashScope image, video and speech generation as
 * named components over HTTP.
 *
 * To run:
 *   DASHSCOPE_API_KEY=sk-... mvn -pl gateway spring-boot:run
 */
@SpringBootApplication
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
