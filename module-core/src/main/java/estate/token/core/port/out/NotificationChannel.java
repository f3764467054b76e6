package estate.token.core.port.out;

import estate.token.domain.model.notification.PropertyNotification;

/**
 * 상태 전이 알림 채널 (append-only)
 *
 * <p>엔진은 연산마다 정확히 하나의 레코드를 같은 트랜잭션 안에서 동기적으로 기록합니다.
 */
public interface NotificationChannel {

  /**
   * @return 부여된 시퀀스 번호
   */
  long append(PropertyNotification notification);
}
