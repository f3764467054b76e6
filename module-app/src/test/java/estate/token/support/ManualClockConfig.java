package estate.token.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class ManualClockConfig {

  @Bean
  @Primary
  public ManualChainClock manualChainClock() {
    return new ManualChainClock();
  }
}
