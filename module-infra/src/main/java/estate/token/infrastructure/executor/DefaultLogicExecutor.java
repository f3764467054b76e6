package estate.token.infrastructure.executor;

import estate.token.common.function.ThrowingSupplier;
import estate.token.error.exception.InternalSystemException;
import estate.token.error.exception.base.BaseException;
import estate.token.error.exception.base.ClientBaseException;
import estate.token.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    try {
      return executeWithMetrics(task, context, null);
    } finally {
      finallyBlock.run();
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    return executeWithMetrics(task, context, translator);
  }

  private <T> T executeWithMetrics(
      ThrowingSupplier<T> task, TaskContext context, ExceptionTranslator translator) {
    Timer.Sample sample = Timer.start(meterRegistry);

    try {
      T result = task.get();
      record(sample, context, "success", null);
      return result;
    } catch (Throwable t) {
      // Error는 절대 캐치하지 않고 상위로 즉시 전파
      if (t instanceof Error error) {
        throw error;
      }
      record(sample, context, "failure", t);
      logFailure(context, t);
      throw translate(t, context, translator);
    }
  }

  private void record(Timer.Sample sample, TaskContext context, String result, Throwable t) {
    Timer.Builder builder =
        Timer.builder("logic.executor")
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", result);
    if (t != null) {
      builder.tag("exception", t.getClass().getSimpleName());
    }
    sample.stop(builder.register(meterRegistry));
  }

  // 비즈니스 거절은 정상 흐름이므로 debug, 그 외는 스택과 함께 error
  private void logFailure(TaskContext context, Throwable t) {
    if (t instanceof ClientBaseException) {
      log.debug("[{}] 비즈니스 예외: {}", context.toTaskName(), t.getMessage());
      return;
    }
    log.error("[{}] 실행 중 예외 발생", context.toTaskName(), t);
  }

  private RuntimeException translate(
      Throwable t, TaskContext context, ExceptionTranslator translator) {
    if (translator != null) {
      return translator.translate(t);
    }
    if (t instanceof BaseException base) {
      return base;
    }
    if (t instanceof RuntimeException runtime) {
      return runtime;
    }
    return new InternalSystemException(context.toTaskName(), t);
  }
}
