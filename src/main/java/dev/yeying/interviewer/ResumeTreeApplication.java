package dev.yeying.interviewer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResumeTreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResumeTreeApplication.class, args);
    }
}
