package com.ospicorp.userloads;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// Stores are opened per cache bean, not through a shared DataSource
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class UserLoadsApplication {

  public static void main(String[] args) {
    SpringApplication.run(UserLoadsApplication.class, args);
  }
}
