package estate.token.core.port.out;

/**
 * 매물 소유권 원장 Port
 *
 * <p>자산 ID → 소유자(Title Holder) 매핑과 발행/이전 기본 연산을 제공합니다. 권한 검증은 호출 측 엔진이 끝낸 뒤 요청하므로, 이전 요청은 항상
 * 성공하는 것으로 간주합니다.
 */
public interface OwnershipRegistry {

  /**
   * 현재 소유자 조회
   *
   * @param propertyId 자산 ID
   * @return 소유자 계정
   * @throws estate.token.error.exception.PropertyNotFoundException 발행되지 않은 자산
   */
  String ownerOf(Long propertyId);

  void mint(String to, Long propertyId);

  void transfer(String from, String to, Long propertyId);
}
