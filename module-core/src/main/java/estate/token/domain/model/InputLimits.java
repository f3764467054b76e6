package estate.token.domain.model;

import estate.token.error.exception.InvalidArgumentException;

/**
 * 저장되는 문자열 입력의 최대 길이
 *
 * <p>엔티티 컬럼 길이, 요청 DTO의 {@code @Size}, 서비스 검증이 모두 이 값을 공유합니다. 알림 payload 최대 길이도 이 값들로 계산된
 * 최악의 경우를 수용합니다.
 */
public final class InputLimits {

  /** 계정 식별자 (소유자, 임차인, 관리자, 입찰자, 오퍼 구매자) */
  public static final int ACCOUNT_ID_MAX = 128;

  /** 매물 소재지 */
  public static final int LOCATION_MAX = 500;

  /** 매물 분류 */
  public static final int CATEGORY_MAX = 100;

  private InputLimits() {}

  /**
   * null은 통과시킵니다. 필수 여부는 호출 측이 따로 검사합니다.
   *
   * @throws InvalidArgumentException 최대 길이 초과
   */
  public static String requireWithin(String field, String value, int max) {
    if (value != null && value.length() > max) {
      throw new InvalidArgumentException(
          field + " must be at most " + max + " characters (length: " + value.length() + ")");
    }
    return value;
  }

  public static String requireAccountId(String field, String value) {
    return requireWithin(field, value, ACCOUNT_ID_MAX);
  }
}
