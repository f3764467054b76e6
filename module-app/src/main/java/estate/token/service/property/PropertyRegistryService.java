package estate.token.service.property;

import estate.token.aop.annotation.Locked;
import estate.token.core.port.out.AccessControl;
import estate.token.core.port.out.ChainClock;
import estate.token.core.port.out.NotificationChannel;
import estate.token.core.port.out.OwnershipRegistry;
import estate.token.domain.model.InputLimits;
import estate.token.domain.model.notification.PropertyNotification;
import estate.token.domain.model.property.PropertyDetails;
import estate.token.error.exception.InvalidArgumentException;
import estate.token.error.exception.NotPrivilegedException;
import estate.token.error.exception.PropertyNotFoundException;
import estate.token.infrastructure.persistence.entity.PropertyEntity;
import estate.token.infrastructure.persistence.entity.SequenceEntity;
import estate.token.infrastructure.persistence.repository.PropertyRepository;
import estate.token.infrastructure.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 매물 레지스트리
 *
 * <p>자산 ID 시퀀스와 매물 레코드를 소유합니다. 엔진들은 이 서비스로 매물을 로드하고, 서로를 직접 호출하지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PropertyRegistryService {

  private final PropertyRepository propertyRepository;
  private final SequenceAllocator sequenceAllocator;
  private final OwnershipRegistry ownershipRegistry;
  private final AccessControl accessControl;
  private final ChainClock chainClock;
  private final NotificationChannel notificationChannel;

  /**
   * 신규 매물 발행
   *
   * @return 부여된 자산 ID (1부터 순차)
   */
  @Transactional
  @Locked(key = "'property:sequence'")
  public Long mint(String caller, String to, String location, long area, String category) {
    if (!accessControl.isPrivileged(caller)) {
      throw new NotPrivilegedException(caller);
    }
    if (to == null || to.isBlank()) {
      throw new InvalidArgumentException("recipient is required");
    }
    if (area < 0) {
      throw new InvalidArgumentException("area must not be negative: " + area);
    }
    if (location == null || category == null) {
      throw new InvalidArgumentException("location and category are required");
    }
    InputLimits.requireAccountId("recipient", to);
    InputLimits.requireWithin("location", location, InputLimits.LOCATION_MAX);
    InputLimits.requireWithin("category", category, InputLimits.CATEGORY_MAX);

    Long propertyId = sequenceAllocator.next(SequenceEntity.PROPERTY);
    propertyRepository.save(PropertyEntity.mint(propertyId, location, area, category));
    ownershipRegistry.mint(to, propertyId);
    notificationChannel.append(new PropertyNotification.Minted(propertyId, to, location));

    log.info("[Registry] Minted: propertyId={}, owner={}", propertyId, to);
    return propertyId;
  }

  @Transactional(readOnly = true)
  public boolean isRented(Long propertyId) {
    return load(propertyId).isRentedAt(chainClock.now());
  }

  @Transactional(readOnly = true)
  public PropertyDetails getDetails(Long propertyId) {
    PropertyEntity property = load(propertyId);
    return new PropertyDetails(
        property.getId(),
        property.getLocation(),
        property.getArea(),
        property.getCategory(),
        property.getSalePrice(),
        property.isForSale(),
        property.getRenter(),
        property.getRentalEnd(),
        property.getMonthlyRent(),
        ownershipRegistry.ownerOf(propertyId),
        property.getManager(),
        property.isRentedAt(chainClock.now()));
  }

  @Transactional(readOnly = true)
  public String ownerOf(Long propertyId) {
    return ownershipRegistry.ownerOf(propertyId);
  }

  /**
   * 호출 측 트랜잭션의 영속성 컨텍스트에 매물을 로드
   *
   * @throws PropertyNotFoundException 발행되지 않은 자산
   */
  public PropertyEntity load(Long propertyId) {
    return propertyRepository
        .findById(propertyId)
        .orElseThrow(() -> new PropertyNotFoundException(propertyId));
  }
}
