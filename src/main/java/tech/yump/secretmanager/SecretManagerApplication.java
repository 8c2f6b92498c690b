package tech.yump.secretmanager;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.secretmanager.config.SecretManagerProperties;

@Slf4j
@SpringBootApplication(
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(SecretManagerProperties.class)
public class SecretManagerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SecretManagerApplication.class, args);
    log.info(">>> Secret Manager Application Started <<<");
  }
}
