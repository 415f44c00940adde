package io.b2mash.b2b.dynamicfields;

import io.b2mash.b2b.dynamicfields.config.DynamicFieldProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DynamicFieldProperties.class)
public class DynamicFieldsApplication {

  public static void main(String[] args) {
    SpringApplication.run(DynamicFieldsApplication.class, args);
  }
}
