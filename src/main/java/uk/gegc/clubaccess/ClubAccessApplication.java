package uk.gegc.clubaccess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClubAccessApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClubAccessApplication.class, args);
    }

}
