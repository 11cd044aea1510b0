package uk.ac.ebi.biostudies.content_index;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentIndexServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContentIndexServiceApplication.class, args);
  }
}
