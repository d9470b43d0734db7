package com.timemultiplier.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimeMultiplierApplication {

  public static void main(String[] args) {
    SpringApplication.run(TimeMultiplierApplication.class, args);
  }
}
