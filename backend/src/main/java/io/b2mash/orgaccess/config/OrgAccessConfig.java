package io.b2mash.orgaccess.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(OrgAccessProperties.class)
public class OrgAccessConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
