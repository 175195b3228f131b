package com.mk.fx.qa.load.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoadEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(LoadEngineApplication.class, args);
  }
}
