package io.b2mash.orgaccess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrgAccessApplication {

  public static void main(String[] args) {
    SpringApplication.run(OrgAccessApplication.class, args);
  }
}
