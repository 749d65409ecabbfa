package com.gentorox.navigation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NavigationApplication {
  public static void main(String[] args) {
    SpringApplication.run(NavigationApplication.class, args);
  }
}
