package estate.token.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import estate.token.error.exception.DistributedLockException;
import estate.token.error.exception.InternalSystemException;
import estate.token.error.exception.base.BaseException;

/**
 * 특정 예외를 도메인 예외로 변환하는 전략
 *
 * <p>다중 catch 블록을 if-else 체인으로 대체합니다. {@link Error}는 변환하지 않고, {@link BaseException}은 그대로 통과시키며,
 * 원본 예외는 cause로 보존합니다.
 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e);

  /** 알림 payload 직렬화용 변환기 */
  static ExceptionTranslator forJson() {
    return e -> {
      if (e instanceof Error error) {
        throw error;
      }
      if (e instanceof JsonProcessingException) {
        return new InternalSystemException("notification-serialize", e);
      }
      if (e instanceof BaseException base) {
        return base;
      }
      return new InternalSystemException("json-processing", e);
    };
  }

  /**
   * 락 구간 변환기
   *
   * <p>락 안에서 실행된 비즈니스 예외와 런타임 예외(트랜잭션 롤백 등)는 그대로 전파하고, 인터럽트만 락 예외로 바꿉니다.
   */
  static ExceptionTranslator forLock() {
    return e -> {
      if (e instanceof Error error) {
        throw error;
      }
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt(); // 인터럽트 플래그 복원
        return new DistributedLockException("락 획득 중 인터럽트", e);
      }
      if (e instanceof BaseException base) {
        return base;
      }
      if (e instanceof RuntimeException runtime) {
        return runtime;
      }
      return new InternalSystemException("lock-operation", e);
    };
  }
}
