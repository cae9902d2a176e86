package com.ospicorp.surfacearea;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurfaceAreaApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(SurfaceAreaApiApplication.class, args);
  }
}
