package com.scholary.diarizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiarizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DiarizerApplication.class, args);
  }
}
