package estate.token.aop.aspect;

import estate.token.aop.annotation.Locked;
import estate.token.error.exception.InternalSystemException;
import estate.token.infrastructure.lock.LockStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.annotation.Order;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;

/**
 * {@link Locked} 처리 Aspect
 *
 * <p>@Order(0)으로 트랜잭션 어드바이스보다 바깥에서 실행됩니다. 락 획득에 실패하면 락 없이 진행하지 않고 {@code S002}로 실패합니다.
 */
@Slf4j
@Aspect
@Order(0)
@Component
@RequiredArgsConstructor
public class LockAspect {

  private final LockStrategy lockStrategy;
  private final ExpressionParser parser = new SpelExpressionParser();

  @Around("@annotation(locked)")
  public Object applyLock(ProceedingJoinPoint joinPoint, Locked locked) throws Throwable {
    String key = getDynamicKey(joinPoint, locked.key());

    return lockStrategy.executeWithLock(key, joinPoint::proceed);
  }

  private String getDynamicKey(ProceedingJoinPoint joinPoint, String keyExpression) {
    MethodSignature signature = (MethodSignature) joinPoint.getSignature();
    StandardEvaluationContext context = new StandardEvaluationContext();

    String[] parameterNames = signature.getParameterNames();
    Object[] args = joinPoint.getArgs();

    for (int i = 0; i < parameterNames.length; i++) {
      context.setVariable(parameterNames[i], args[i]);
    }

    String key = parser.parseExpression(keyExpression).getValue(context, String.class);
    if (key == null || key.isBlank()) {
      throw new InternalSystemException("lock key resolved to blank: " + keyExpression);
    }
    return key;
  }
}
