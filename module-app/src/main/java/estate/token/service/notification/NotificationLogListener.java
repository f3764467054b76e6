package estate.token.service.notification;

import estate.token.infrastructure.notification.NotificationRecordedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** 커밋된 상태 전이만 기록 (롤백된 연산의 알림은 이벤트도 전달되지 않음) */
@Slf4j
@Component
public class NotificationLogListener {

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onRecorded(NotificationRecordedEvent event) {
    log.info(
        "[Notification] #{} {} committed: propertyId={}",
        event.sequence(),
        event.notification().type(),
        event.notification().propertyId());
  }
}
