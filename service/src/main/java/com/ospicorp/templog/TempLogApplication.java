package com.ospicorp.templog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TempLogApplication {

  public static void main(String[] args) {
    SpringApplication.run(TempLogApplication.class, args);
  }
}
