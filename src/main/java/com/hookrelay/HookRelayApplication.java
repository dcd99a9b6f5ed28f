package com.hookrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HookRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(HookRelayApplication.class, args);
    }
}
