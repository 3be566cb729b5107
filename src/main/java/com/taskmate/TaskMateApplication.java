package com.taskmate;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class TaskMateApplication {

    public static void main(String[] args) {
        log.info("Starting TaskMate server");
        SpringApplication.run(TaskMateApplication.class, args);
        log.info("TaskMate server started");
    }

}
