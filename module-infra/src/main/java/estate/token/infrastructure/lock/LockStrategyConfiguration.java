package estate.token.infrastructure.lock;

import estate.token.infrastructure.config.LockProperties;
import java.util.concurrent.TimeUnit;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Redis 락 모드에서만 RedissonClient를 만든다 (로컬 모드는 Redis 연결 없이 기동) */
@Configuration
@ConditionalOnProperty(prefix = "estate.lock", name = "type", havingValue = "redis")
public class LockStrategyConfiguration {

  @Bean(destroyMethod = "shutdown")
  public RedissonClient redissonClient(LockProperties properties) {
    Config config = new Config();
    config.useSingleServer().setAddress(properties.redisAddress());
    // Watchdog 갱신 기준 시간. 보유 중에는 이 시간의 1/3마다 연장된다
    config.setLockWatchdogTimeout(TimeUnit.SECONDS.toMillis(properties.leaseSeconds()));
    return Redisson.create(config);
  }
}
