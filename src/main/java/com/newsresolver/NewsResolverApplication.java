package com.newsresolver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NewsResolverApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewsResolverApplication.class, args);
    }
}
