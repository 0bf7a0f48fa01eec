package com.syntharb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SyntharbApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyntharbApplication.class, args);
    }
}
