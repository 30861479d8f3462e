package com.example.platformauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class PlatformAuthApplication {

  public static void main(String[] args) {
    SpringApplication.run(PlatformAuthApplication.class, args);
  }
}
