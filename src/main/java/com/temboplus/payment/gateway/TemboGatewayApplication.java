package com.temboplus.payment.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TemboGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(TemboGatewayApplication.class, args);
  }
}
