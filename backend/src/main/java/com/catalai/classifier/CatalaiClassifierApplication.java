package com.catalai.classifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalaiClassifierApplication {

  public static void main(String[] args) {
    SpringApplication.run(CatalaiClassifierApplication.class, args);
  }
}
