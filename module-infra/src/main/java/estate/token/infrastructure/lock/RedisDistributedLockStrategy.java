package estate.token.infrastructure.lock;

import estate.token.infrastructure.config.LockProperties;
import estate.token.infrastructure.executor.LogicExecutor;
import java.util.concurrent.TimeUnit;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 다중 인스턴스 배포용 분산 락 (Redisson)
 *
 * <p>{@code estate.lock.type=redis}일 때만 활성화됩니다.
 */
@Component
@ConditionalOnProperty(prefix = "estate.lock", name = "type", havingValue = "redis")
public class RedisDistributedLockStrategy extends AbstractLockStrategy {

  private final RedissonClient redissonClient;

  public RedisDistributedLockStrategy(
      LogicExecutor executor, LockProperties properties, RedissonClient redissonClient) {
    super(executor, properties);
    this.redissonClient = redissonClient;
  }

  /**
   * Redisson Watchdog 모드로 락 획득
   *
   * <p>leaseTime을 넘기면 작업이 길어질 때 트랜잭션이 열린 채로 락이 만료되어 다른 인스턴스가 같은 매물 구간에 들어올 수 있습니다. 그래서
   * leaseTime은 무시하고, Watchdog이 락을 주기적으로 갱신하게 둡니다. 갱신 주기는 {@code estate.lock.lease-seconds}로
   * 설정합니다.
   *
   * @param leaseTime 무시됨 (Watchdog 모드)
   */
  @Override
  protected boolean tryLock(String lockKey, long waitTime, long leaseTime)
      throws InterruptedException {
    RLock lock = redissonClient.getLock(lockKey);
    return lock.tryLock(waitTime, TimeUnit.SECONDS);
  }

  @Override
  protected void unlockInternal(String lockKey) {
    redissonClient.getLock(lockKey).unlock();
  }

  @Override
  protected boolean shouldUnlock(String lockKey) {
    return redissonClient.getLock(lockKey).isHeldByCurrentThread();
  }
}
