package com.netmeasure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetMeasureApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetMeasureApplication.class, args);
    }
}
