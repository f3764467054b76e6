package estate.token.aop.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 매물 단위 배타 구간
 *
 * <p>{@code @Transactional}과 함께 쓰면 락이 트랜잭션을 감쌉니다 (락 획득 → 트랜잭션 시작 → 커밋 → 락 해제).
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Locked {

  /** 락 식별자 (SpEL 지원: 예: {@code 'property:' + #propertyId}) */
  String key();
}
