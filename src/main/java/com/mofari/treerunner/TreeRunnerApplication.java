package com.mofari.treerunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TreeRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TreeRunnerApplication.class, args);
    }
}
