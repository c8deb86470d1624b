package com.openforge.memgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemgraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemgraphApplication.class, args);
    }
}
