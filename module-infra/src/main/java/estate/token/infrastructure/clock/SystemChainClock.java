package estate.token.infrastructure.clock;

import estate.token.core.port.out.ChainClock;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * 시스템 시계 기반 단조 시계
 *
 * <p>벽시계가 뒤로 가더라도(NTP 보정 등) 이전에 반환한 값보다 작은 값은 반환하지 않습니다.
 */
@Component
public class SystemChainClock implements ChainClock {

  private final Clock clock;
  private final AtomicLong lastReading = new AtomicLong(Long.MIN_VALUE);

  public SystemChainClock() {
    this(Clock.systemUTC());
  }

  SystemChainClock(Clock clock) {
    this.clock = clock;
  }

  @Override
  public long now() {
    return lastReading.accumulateAndGet(clock.instant().getEpochSecond(), Math::max);
  }
}
