package com.motionbake.codegen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnimationCodegenApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnimationCodegenApplication.class, args);
    }
}
