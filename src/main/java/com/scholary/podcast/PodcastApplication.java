package com.scholary.podcast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PodcastApplication {

  public static void main(String[] args) {
    SpringApplication.run(PodcastApplication.class, args);
  }
}
