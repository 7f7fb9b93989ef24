package com.scholary.refinery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RefineryApplication {

  public static void main(String[] args) {
    SpringApplication.run(RefineryApplication.class, args);
  }
}
