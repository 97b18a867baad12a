package uk.gegc.livequiz;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LiveQuizApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveQuizApplication.class, args);
    }

}
