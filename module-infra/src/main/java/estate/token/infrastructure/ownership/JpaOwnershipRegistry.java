package estate.token.infrastructure.ownership;

import estate.token.core.port.out.OwnershipRegistry;
import estate.token.error.exception.InternalSystemException;
import estate.token.error.exception.PropertyNotFoundException;
import estate.token.infrastructure.persistence.entity.TitleDeedEntity;
import estate.token.infrastructure.persistence.repository.TitleDeedRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 소유권 원장 어댑터 (title_deed 테이블)
 *
 * <p>권한 검증은 호출 측 엔진의 책임입니다. 이 어댑터는 원장 자체의 일관성(from이 실제 소유자인지)만 확인합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaOwnershipRegistry implements OwnershipRegistry {

  private final TitleDeedRepository titleDeedRepository;

  @Override
  public String ownerOf(Long propertyId) {
    return load(propertyId).getOwner();
  }

  @Override
  public void mint(String to, Long propertyId) {
    if (titleDeedRepository.existsById(propertyId)) {
      throw new InternalSystemException("title already issued: " + propertyId);
    }
    titleDeedRepository.save(TitleDeedEntity.issue(propertyId, to));
  }

  @Override
  public void transfer(String from, String to, Long propertyId) {
    TitleDeedEntity deed = load(propertyId);
    if (!deed.isOwnedBy(from)) {
      throw new InternalSystemException("title holder mismatch: " + propertyId);
    }
    deed.transferTo(to);
    log.debug("[Title] Transferred: propertyId={}, from={}, to={}", propertyId, from, to);
  }

  private TitleDeedEntity load(Long propertyId) {
    return titleDeedRepository
        .findById(propertyId)
        .orElseThrow(() -> new PropertyNotFoundException(propertyId));
  }
}
