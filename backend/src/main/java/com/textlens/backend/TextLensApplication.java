package com.textlens.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.TimeZone;

@SpringBootApplication
public class TextLensApplication {

    public static void main(String[] args) {
        // stored result timestamps are server time, keep them zone-independent
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(TextLensApplication.class, args);
    }

}
