package ch.so.arp.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CommunityAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommunityAssistantApplication.class, args);
    }
}
