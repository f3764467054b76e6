package estate.token.service.auth;

import estate.token.core.port.out.OwnershipRegistry;
import estate.token.error.exception.NotAuthorizedException;
import estate.token.error.exception.NotTitleHolderException;
import estate.token.infrastructure.persistence.entity.PropertyEntity;
import estate.token.service.property.PropertyRegistryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 게이트 연산 권한 검사
 *
 * <p>판매 등록, 임대 등록, 경매 시작, 오퍼 수락은 {@link #requireAuthorized}(소유자 또는 관리자)를, 관리자 지정과 직접 이전은
 * {@link #requireTitleHolder}(소유자 본인)를 사용합니다.
 */
@Component
@RequiredArgsConstructor
public class AuthorizationCheck {

  private final OwnershipRegistry ownershipRegistry;
  private final PropertyRegistryService propertyRegistry;

  /** caller가 현재 소유자이거나 위임 관리자인지 */
  public boolean isAuthorized(Long propertyId, String caller) {
    if (caller == null) {
      return false;
    }
    if (caller.equals(ownershipRegistry.ownerOf(propertyId))) {
      return true;
    }
    PropertyEntity property = propertyRegistry.load(propertyId);
    return property.findManager().map(caller::equals).orElse(false);
  }

  public void requireAuthorized(Long propertyId, String caller) {
    if (!isAuthorized(propertyId, caller)) {
      throw new NotAuthorizedException(propertyId, caller);
    }
  }

  /**
   * @return 현재 소유자 (= caller)
   */
  public String requireTitleHolder(Long propertyId, String caller) {
    String holder = ownershipRegistry.ownerOf(propertyId);
    if (!holder.equals(caller)) {
      throw new NotTitleHolderException(propertyId, caller);
    }
    return holder;
  }
}
