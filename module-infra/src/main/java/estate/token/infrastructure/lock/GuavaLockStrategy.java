package estate.token.infrastructure.lock;

import com.google.common.util.concurrent.Striped;
import estate.token.infrastructure.config.LockProperties;
import estate.token.infrastructure.executor.LogicExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 단일 인스턴스용 로컬 락 (Guava Striped)
 *
 * <p>스트라이프는 재진입 가능한 {@link ReentrantLock}이라, 같은 스레드에서 중첩 호출이 들어와도 교착되지 않습니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(
    prefix = "estate.lock",
    name = "type",
    havingValue = "local",
    matchIfMissing = true)
public class GuavaLockStrategy extends AbstractLockStrategy {

  private final Striped<Lock> locks;

  public GuavaLockStrategy(LogicExecutor executor, LockProperties properties) {
    super(executor, properties);
    this.locks = Striped.lock(properties.stripes());
  }

  @Override
  protected boolean tryLock(String lockKey, long waitTime, long leaseTime)
      throws InterruptedException {
    return locks.get(lockKey).tryLock(waitTime, TimeUnit.SECONDS);
  }

  @Override
  protected void unlockInternal(String lockKey) {
    locks.get(lockKey).unlock();
  }

  @Override
  protected boolean shouldUnlock(String lockKey) {
    Lock lock = locks.get(lockKey);
    return !(lock instanceof ReentrantLock reentrant) || reentrant.isHeldByCurrentThread();
  }
}
