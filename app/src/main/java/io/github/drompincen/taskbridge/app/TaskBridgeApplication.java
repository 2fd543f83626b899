package io.github.drompincen.taskbridge.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.taskbridge")
public class TaskBridgeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TaskBridgeApplication.class, args)));
    }
}
