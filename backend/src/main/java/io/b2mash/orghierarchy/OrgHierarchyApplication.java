package io.b2mash.orghierarchy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrgHierarchyApplication {

  public static void main(String[] args) {
    SpringApplication.run(OrgHierarchyApplication.class, args);
  }
}
