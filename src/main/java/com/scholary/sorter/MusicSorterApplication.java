package com.scholary.sorter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MusicSorterApplication {

  public static void main(String[] args) {
    SpringApplication.run(MusicSorterApplication.class, args);
  }
}
