package uk.gegc.skillgrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkillGraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillGraderApplication.class, args);
    }
}
