package estate.token.service.notification;

import estate.token.infrastructure.config.NotificationProperties;
import estate.token.infrastructure.persistence.entity.NotificationEntity;
import estate.token.infrastructure.persistence.repository.NotificationRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** 외부 인덱서용 알림 로그 조회 (시퀀스 오름차순) */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NotificationQueryService {

  private final NotificationRepository notificationRepository;
  private final NotificationProperties notificationProperties;

  /**
   * @param afterSequence 이 시퀀스 다음부터 (처음부터는 0)
   * @param limit 최대 건수, 설정된 페이지 크기를 넘으면 잘라냄
   */
  public List<NotificationEntity> notifications(long afterSequence, int limit) {
    int size = Math.max(1, Math.min(limit, notificationProperties.maxPageSize()));
    return notificationRepository.findBySequenceGreaterThanOrderBySequenceAsc(
        afterSequence, PageRequest.of(0, size));
  }

  public List<NotificationEntity> notificationsOf(Long propertyId) {
    return notificationRepository.findByPropertyIdOrderBySequenceAsc(propertyId);
  }
}
