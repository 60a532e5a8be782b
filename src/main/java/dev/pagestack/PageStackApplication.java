package dev.pagestack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PageStackApplication {

    public static void main(String[] args) {
        SpringApplication.run(PageStackApplication.class, args);
    }
}
