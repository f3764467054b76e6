package estate.token.infrastructure.lock;

import estate.token.common.function.ThrowingSupplier;
import estate.token.error.exception.DistributedLockException;
import estate.token.infrastructure.config.LockProperties;
import estate.token.infrastructure.executor.LogicExecutor;
import estate.token.infrastructure.executor.TaskContext;
import estate.token.infrastructure.executor.strategy.ExceptionTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 락 전략 추상 클래스
 *
 * <p>Template Method Pattern:
 *
 * <ul>
 *   <li>{@link #executeWithLock}: 템플릿 메서드 (락 획득 → 작업 실행 → 락 해제)
 *   <li>{@link #tryLock}, {@link #unlockInternal}, {@link #shouldUnlock}: 구현체별 차이
 *   <li>{@link #onLockAcquired}, {@link #onLockFailed}, {@link #onLockReleased}: Hook
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractLockStrategy implements LockStrategy {

  protected final LogicExecutor executor;
  protected final LockProperties properties;

  @Override
  public <T> T executeWithLock(
      String key, long waitTime, long leaseTime, ThrowingSupplier<T> task) {
    String lockKey = buildLockKey(key);

    return executor.executeWithTranslation(
        () -> performLockAndExecute(lockKey, waitTime, leaseTime, task),
        ExceptionTranslator.forLock(),
        TaskContext.of("Lock", "Execute", key));
  }

  @Override
  public <T> T executeWithLock(String key, ThrowingSupplier<T> task) {
    return executeWithLock(key, properties.waitSeconds(), properties.leaseSeconds(), task);
  }

  private <T> T performLockAndExecute(
      String lockKey, long waitTime, long leaseTime, ThrowingSupplier<T> task) throws Throwable {
    // 1. 락 획득 시도
    if (!tryLock(lockKey, waitTime, leaseTime)) {
      onLockFailed(lockKey);
      throw new DistributedLockException(lockKey);
    }

    // 2. 락 획득 성공 Hook
    onLockAcquired(lockKey);

    // 3. 작업 실행 + finally 블록에서 락 해제
    return executor.executeWithFinally(
        task, () -> performUnlock(lockKey), TaskContext.of("Lock", "Task", lockKey));
  }

  private void performUnlock(String lockKey) {
    try {
      if (shouldUnlock(lockKey)) {
        unlockInternal(lockKey);
        onLockReleased(lockKey);
      }
    } catch (RuntimeException e) {
      // 해제 실패가 이미 커밋된 작업 결과를 뒤집지 않도록 기록만 남긴다 (lease 만료로 회수됨)
      log.error("[Lock] '{}' 해제 중 예외 발생", lockKey, e);
    }
  }

  // ===== 추상 메서드 =====

  /**
   * @param waitTime 대기 시간 (초)
   * @param leaseTime 임대 시간 (초), 로컬 락은 무시
   */
  protected abstract boolean tryLock(String lockKey, long waitTime, long leaseTime)
      throws Throwable;

  protected abstract void unlockInternal(String lockKey);

  /** 현재 스레드가 소유하고 있는지 */
  protected abstract boolean shouldUnlock(String lockKey);

  // ===== Hook 메서드 =====

  protected String buildLockKey(String key) {
    return "lock:" + key;
  }

  protected void onLockAcquired(String lockKey) {
    log.debug("[Lock] '{}' 획득 성공", lockKey);
  }

  protected void onLockFailed(String lockKey) {
    log.warn("[Lock] '{}' 획득 실패", lockKey);
  }

  protected void onLockReleased(String lockKey) {
    log.debug("[Lock] '{}' 해제 완료", lockKey);
  }
}
