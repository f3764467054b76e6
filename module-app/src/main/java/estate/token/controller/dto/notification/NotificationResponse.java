package estate.token.controller.dto.notification;

import com.fasterxml.jackson.annotation.JsonRawValue;
import estate.token.domain.model.notification.NotificationType;
import estate.token.infrastructure.persistence.entity.NotificationEntity;

/**
 * 알림 로그 항목
 *
 * @param payload 전이별 필드 (저장된 JSON을 그대로 포함)
 */
public record NotificationResponse(
    long sequence,
    NotificationType type,
    Long propertyId,
    @JsonRawValue String payload,
    long recordedAt) {

  public static NotificationResponse from(NotificationEntity entity) {
    return new NotificationResponse(
        entity.getSequence(),
        entity.getType(),
        entity.getPropertyId(),
        entity.getPayload(),
        entity.getRecordedAt());
  }
}
