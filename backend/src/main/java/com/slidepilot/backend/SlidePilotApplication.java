package com.slidepilot.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlidePilotApplication {

  public static void main(String[] args) {
    SpringApplication.run(SlidePilotApplication.class, args);
  }
}
