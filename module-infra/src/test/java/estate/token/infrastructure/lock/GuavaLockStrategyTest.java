package estate.token.infrastructure.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import estate.token.error.exception.OfferNotFoundException;
import estate.token.infrastructure.config.LockProperties;
import estate.token.infrastructure.executor.DefaultLogicExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GuavaLockStrategyTest {

  private GuavaLockStrategy lockStrategy;
  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    LockProperties properties = new LockProperties("local", 5, 10, 64, "redis://localhost:6379");
    lockStrategy =
        new GuavaLockStrategy(new DefaultLogicExecutor(new SimpleMeterRegistry()), properties);
    pool = Executors.newFixedThreadPool(8);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  @DisplayName("같은 키의 작업은 겹치지 않고 직렬로 실행된다")
  void sameKeyIsSerialized() throws Exception {
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Integer>> futures = new ArrayList<>();

    for (int i = 0; i < 16; i++) {
      futures.add(
          pool.submit(
              () -> {
                start.await();
                return lockStrategy.executeWithLock(
                    "property:1",
                    () -> {
                      int now = inside.incrementAndGet();
                      maxInside.accumulateAndGet(now, Math::max);
                      Thread.sleep(2);
                      inside.decrementAndGet();
                      return now;
                    });
              }));
    }
    start.countDown();
    for (Future<Integer> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }

    assertThat(maxInside.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("락 안의 비즈니스 예외는 그대로 전파되고 락은 해제된다")
  void businessExceptionReleasesLock() throws Throwable {
    assertThatThrownBy(
            () ->
                lockStrategy.executeWithLock(
                    "property:2",
                    () -> {
                      throw new OfferNotFoundException(2L, "0xbob");
                    }))
        .isInstanceOf(OfferNotFoundException.class);

    // 다른 스레드에서 즉시 재획득 가능해야 한다
    Future<String> next =
        pool.submit(() -> lockStrategy.executeWithLock("property:2", 0, 10, () -> "acquired"));
    assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("acquired");
  }

  @Test
  @DisplayName("같은 스레드의 중첩 호출은 재진입한다")
  void nestedCallOnSameThreadReenters() throws Throwable {
    String result =
        lockStrategy.executeWithLock(
            "property:3", () -> lockStrategy.executeWithLock("property:3", () -> "nested"));

    assertThat(result).isEqualTo("nested");
  }
}
