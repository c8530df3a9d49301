package com.ridwan.tweetharvest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TweetHarvestApplication {

    public static void main(String[] args) {
        SpringApplication.run(TweetHarvestApplication.class, args);
    }

}
