package estate.token.infrastructure.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import estate.token.error.exception.DistributedLockException;
import estate.token.infrastructure.config.LockProperties;
import estate.token.infrastructure.executor.DefaultLogicExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

class RedisDistributedLockStrategyTest {

  private RedissonClient redissonClient;
  private RLock lock;
  private RedisDistributedLockStrategy lockStrategy;

  @BeforeEach
  void setUp() {
    redissonClient = mock(RedissonClient.class);
    lock = mock(RLock.class);
    given(redissonClient.getLock("lock:property:7")).willReturn(lock);
    LockProperties properties = new LockProperties("redis", 3, 30, 64, "redis://localhost:6379");
    lockStrategy =
        new RedisDistributedLockStrategy(
            new DefaultLogicExecutor(new SimpleMeterRegistry()), properties, redissonClient);
  }

  @Test
  @DisplayName("고정 임대 시간 없이 Watchdog 모드로 획득하고 작업 후 해제한다")
  void acquiresInWatchdogModeAndReleases() throws Exception {
    given(lock.tryLock(3, TimeUnit.SECONDS)).willReturn(true);
    given(lock.isHeldByCurrentThread()).willReturn(true);

    String result = lockStrategy.executeWithLock("property:7", () -> "done");

    assertThat(result).isEqualTo("done");
    verify(lock).tryLock(3, TimeUnit.SECONDS);
    verify(lock, never()).tryLock(anyLong(), anyLong(), any(TimeUnit.class));
    verify(lock).unlock();
  }

  @Test
  @DisplayName("호출 측이 임대 시간을 넘겨도 Watchdog 모드를 유지한다")
  void explicitLeaseIsIgnored() throws Throwable {
    given(lock.tryLock(1, TimeUnit.SECONDS)).willReturn(true);
    given(lock.isHeldByCurrentThread()).willReturn(true);

    lockStrategy.executeWithLock("property:7", 1, 5, () -> "done");

    verify(lock).tryLock(1, TimeUnit.SECONDS);
    verify(lock, never()).tryLock(anyLong(), anyLong(), any(TimeUnit.class));
  }

  @Test
  @DisplayName("획득에 실패하면 작업을 실행하지 않고 S002로 실패한다")
  void failsWithoutRunningTask() throws Exception {
    given(lock.tryLock(3, TimeUnit.SECONDS)).willReturn(false);

    assertThatThrownBy(
            () ->
                lockStrategy.executeWithLock(
                    "property:7",
                    () -> {
                      throw new AssertionError("must not run");
                    }))
        .isInstanceOf(DistributedLockException.class);
    verify(lock, never()).unlock();
  }

  @Test
  @DisplayName("lease가 먼저 만료되어 소유하지 않으면 해제를 건너뛴다")
  void skipsUnlockWhenNoLongerHeld() throws Exception {
    given(lock.tryLock(3, TimeUnit.SECONDS)).willReturn(true);
    given(lock.isHeldByCurrentThread()).willReturn(false);

    lockStrategy.executeWithLock("property:7", () -> 1);

    verify(lock, never()).unlock();
  }
}
