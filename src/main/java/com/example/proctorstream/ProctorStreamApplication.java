package com.example.proctorstream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProctorStreamApplication {

    private static final Logger logger = LoggerFactory.getLogger(ProctorStreamApplication.class);

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ProctorStreamApplication.class, args);
        Thread.setDefaultUncaughtExceptionHandler((thread, error) -> {
            logger.error("Uncaught exception on thread {}, shutting down", thread.getName(), error);
            try {
                context.close();
            } finally {
                System.exit(1);
            }
        });
    }
}
