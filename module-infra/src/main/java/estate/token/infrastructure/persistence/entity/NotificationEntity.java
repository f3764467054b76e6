package estate.token.infrastructure.persistence.entity;

import estate.token.domain.model.notification.NotificationType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** 상태 전이 알림 로그 (append-only, 수정/삭제 메서드 없음) */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(
    name = "property_notification",
    indexes = @Index(name = "idx_notification_property", columnList = "property_id"))
public class NotificationEntity {

  /** 최대 길이 입력이 모두 제어 문자라 6자씩 이스케이프되는 최악의 JSON도 담는 길이 */
  public static final int PAYLOAD_LENGTH = 4000;

  /** {@code SequenceAllocator}가 커밋 순서대로 발급 (IDENTITY는 INSERT 시점 순서라 커밋 순서와 어긋날 수 있음) */
  @Id private Long sequence;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private NotificationType type;

  @Column(name = "property_id", nullable = false)
  private Long propertyId;

  @Column(nullable = false, length = PAYLOAD_LENGTH)
  private String payload;

  @Column(nullable = false)
  private long recordedAt;

  private NotificationEntity(
      Long sequence, NotificationType type, Long propertyId, String payload, long recordedAt) {
    this.sequence = sequence;
    this.type = type;
    this.propertyId = propertyId;
    this.payload = payload;
    this.recordedAt = recordedAt;
  }

  public static NotificationEntity record(
      Long sequence, NotificationType type, Long propertyId, String payload, long recordedAt) {
    return new NotificationEntity(sequence, type, propertyId, payload, recordedAt);
  }
}
