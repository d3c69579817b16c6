package io.github.drompincen.boardsync.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.boardsync")
@EnableScheduling
public class BoardSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoardSyncApplication.class, args);
    }
}
