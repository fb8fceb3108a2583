package com.example.file_server;

import lombok.Generated;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Generated
@SpringBootApplication
@ConfigurationPropertiesScan
public class FileServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(FileServerApplication.class, args);
  }
}
