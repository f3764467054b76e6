package estate.token.infrastructure.lock;

import estate.token.common.function.ThrowingSupplier;

/**
 * 매물 단위 배타 구간 전략
 *
 * <p>같은 키(예: {@code property:7})에 대한 작업은 직렬로 실행되고, 서로 다른 키는 조율 없이 병렬로 실행됩니다.
 */
public interface LockStrategy {

  // 1. 락을 획득하고 작업을 실행 (WaitTime 대기 포함)
  <T> T executeWithLock(String key, long waitTime, long leaseTime, ThrowingSupplier<T> task)
      throws Throwable;

  // 2. 기본 설정값으로 락 실행
  <T> T executeWithLock(String key, ThrowingSupplier<T> task) throws Throwable;
}
