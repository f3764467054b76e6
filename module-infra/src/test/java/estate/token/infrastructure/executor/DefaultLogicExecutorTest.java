package estate.token.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import estate.token.error.exception.DistributedLockException;
import estate.token.error.exception.InternalSystemException;
import estate.token.error.exception.NotForSaleException;
import estate.token.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DefaultLogicExecutorTest {

  private SimpleMeterRegistry meterRegistry;
  private DefaultLogicExecutor executor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = new DefaultLogicExecutor(meterRegistry);
  }

  @Test
  @DisplayName("성공 시 결과를 반환하고 success 타이머를 기록한다")
  void recordsSuccess() {
    String result =
        executor.executeWithTranslation(
            () -> "ok", ExceptionTranslator.forJson(), TaskContext.of("Test", "Run"));

    assertThat(result).isEqualTo("ok");
    assertThat(
            meterRegistry
                .get("logic.executor")
                .tag("component", "Test")
                .tag("result", "success")
                .timer()
                .count())
        .isEqualTo(1L);
  }

  @Test
  @DisplayName("비즈니스 예외는 변환 없이 그대로 전파된다")
  void businessExceptionPassesThrough() {
    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw new NotForSaleException(1L);
                    },
                    ExceptionTranslator.forLock(),
                    TaskContext.of("Test", "Run")))
        .isInstanceOf(NotForSaleException.class);
  }

  @Test
  @DisplayName("직렬화 실패는 InternalSystemException으로 규격화된다 (cause 보존)")
  void jsonFailureIsWrapped() {
    JsonProcessingException cause = new JsonMappingException(null, "broken payload");

    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw cause;
                    },
                    ExceptionTranslator.forJson(),
                    TaskContext.of("Test", "Json")))
        .isInstanceOf(InternalSystemException.class)
        .hasCause(cause);
  }

  @Test
  @DisplayName("락 대기 중 인터럽트는 락 예외로 바뀌고 인터럽트 플래그가 복원된다")
  void interruptBecomesLockFailure() {
    try {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new InterruptedException("stop");
                      },
                      ExceptionTranslator.forLock(),
                      TaskContext.of("Test", "Lock")))
          .isInstanceOf(DistributedLockException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  @DisplayName("작업이 실패해도 finallyBlock은 실행된다")
  void finallyBlockAlwaysRuns() {
    AtomicBoolean released = new AtomicBoolean(false);

    assertThatThrownBy(
            () ->
                executor.executeWithFinally(
                    () -> {
                      throw new IllegalStateException("boom");
                    },
                    () -> released.set(true),
                    TaskContext.of("Test", "Finally")))
        .isInstanceOf(IllegalStateException.class);
    assertThat(released).isTrue();
  }
}
