package estate.token.infrastructure.executor;

import estate.token.common.function.ThrowingSupplier;
import estate.token.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * try-catch 보일러플레이트를 대체하는 실행 템플릿
 *
 * <h3>공통 정책</h3>
 *
 * <ul>
 *   <li>{@link Error}는 절대 변환하지 않고 그대로 전파
 *   <li>프로젝트 예외 계층(BaseException)은 그대로 전파
 *   <li>그 외 예외는 규격화된 서버 예외로 변환 (cause 보존)
 *   <li>모든 실행은 {@code logic.executor} 타이머로 기록
 * </ul>
 */
public interface LogicExecutor {

  /** 작업 성공/실패와 무관하게 finallyBlock을 실행 (락 해제 등) */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  /** 지정한 변환기로 예외를 도메인 예외로 변환 */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
