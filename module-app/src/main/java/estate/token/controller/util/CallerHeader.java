package estate.token.controller.util;

import estate.token.domain.model.InputLimits;

/** 호출 계정 식별 헤더 */
public final class CallerHeader {

  public static final String NAME = "X-Account-Id";

  /** 계정 컬럼 길이와 같음. 초과하면 V001 */
  public static final int MAX_LENGTH = InputLimits.ACCOUNT_ID_MAX;

  private CallerHeader() {}
}
