package uk.gegc.mockexam;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MockExamApplication {

    public static void main(String[] args) {
        SpringApplication.run(MockExamApplication.class, args);
    }
}
