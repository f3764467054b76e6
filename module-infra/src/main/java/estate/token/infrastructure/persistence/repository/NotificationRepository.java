package estate.token.infrastructure.persistence.repository;

import estate.token.infrastructure.persistence.entity.NotificationEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationRepository extends JpaRepository<NotificationEntity, Long> {

  List<NotificationEntity> findBySequenceGreaterThanOrderBySequenceAsc(
      Long afterSequence, Pageable pageable);

  List<NotificationEntity> findByPropertyIdOrderBySequenceAsc(Long propertyId);
}
