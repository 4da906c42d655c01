package com.interngenie.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InternGenieGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(InternGenieGatewayApplication.class, args);
  }
}
