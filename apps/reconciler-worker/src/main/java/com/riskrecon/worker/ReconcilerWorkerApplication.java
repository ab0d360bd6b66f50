package com.riskrecon.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ReconcilerWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(ReconcilerWorkerApplication.class, args);
  }
}
