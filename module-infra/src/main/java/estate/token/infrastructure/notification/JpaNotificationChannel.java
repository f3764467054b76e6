package estate.token.infrastructure.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import estate.token.core.port.out.ChainClock;
import estate.token.core.port.out.NotificationChannel;
import estate.token.domain.model.notification.PropertyNotification;
import estate.token.error.exception.InternalSystemException;
import estate.token.infrastructure.executor.LogicExecutor;
import estate.token.infrastructure.executor.TaskContext;
import estate.token.infrastructure.executor.strategy.ExceptionTranslator;
import estate.token.infrastructure.persistence.entity.NotificationEntity;
import estate.token.infrastructure.persistence.entity.SequenceEntity;
import estate.token.infrastructure.persistence.repository.NotificationRepository;
import estate.token.infrastructure.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * append-only 알림 저장소
 *
 * <p>엔진 트랜잭션 안에서 동기적으로 기록되므로 롤백된 연산의 알림은 남지 않습니다. 기록 후 {@link NotificationRecordedEvent}를
 * 발행해 커밋 이후 리스너가 소비할 수 있게 합니다.
 *
 * <p>시퀀스는 커밋 순서대로 발급되므로 인덱서가 마지막으로 읽은 시퀀스 이후만 조회해도 누락이 없습니다.
 */
@Component
@RequiredArgsConstructor
public class JpaNotificationChannel implements NotificationChannel {

  private final NotificationRepository notificationRepository;
  private final SequenceAllocator sequenceAllocator;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final ChainClock chainClock;
  private final ApplicationEventPublisher eventPublisher;

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public long append(PropertyNotification notification) {
    String payload =
        executor.executeWithTranslation(
            () -> objectMapper.writeValueAsString(notification),
            ExceptionTranslator.forJson(),
            TaskContext.of("Notification", "Serialize", notification.type().name()));

    if (payload.length() > NotificationEntity.PAYLOAD_LENGTH) {
      throw new InternalSystemException(
          "notification payload too long (" + payload.length() + "): " + notification.type());
    }

    // 연산의 마지막 단계에서 발급해 시퀀스 행 락을 커밋 직전까지만 잡는다
    long sequence = sequenceAllocator.next(SequenceEntity.NOTIFICATION);
    NotificationEntity saved =
        notificationRepository.save(
            NotificationEntity.record(
                sequence,
                notification.type(),
                notification.propertyId(),
                payload,
                chainClock.now()));

    eventPublisher.publishEvent(new NotificationRecordedEvent(saved.getSequence(), notification));
    return saved.getSequence();
  }
}
