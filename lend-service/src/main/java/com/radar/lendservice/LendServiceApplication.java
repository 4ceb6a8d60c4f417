package com.radar.lendservice;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.radar"})
@MapperScan("com.radar.lendservice.mapper")
@EnableScheduling
public class LendServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendServiceApplication.class, args);
    }
}
