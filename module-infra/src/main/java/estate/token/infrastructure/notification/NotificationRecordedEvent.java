package estate.token.infrastructure.notification;

import estate.token.domain.model.notification.PropertyNotification;

/** 알림 기록 직후 발행되는 Spring 애플리케이션 이벤트 */
public record NotificationRecordedEvent(long sequence, PropertyNotification notification) {}
