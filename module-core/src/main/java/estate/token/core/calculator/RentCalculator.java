package estate.token.core.calculator;

import estate.token.error.exception.InvalidArgumentException;

/**
 * 임대료/임대 기간 계산기
 *
 * <p>1개월은 달력상의 월이 아니라 고정 30일(2,592,000초)입니다. 곱셈 오버플로는 잘못된 입력으로 취급합니다.
 */
public final class RentCalculator {

  public static final long SECONDS_PER_DAY = 24L * 60 * 60;
  public static final long DAYS_PER_MONTH = 30L;
  public static final long SECONDS_PER_MONTH = DAYS_PER_MONTH * SECONDS_PER_DAY;

  private RentCalculator() {}

  /** monthlyRent × months */
  public static long requiredRent(long monthlyRent, long months) {
    try {
      return Math.multiplyExact(monthlyRent, months);
    } catch (ArithmeticException e) {
      throw new InvalidArgumentException("rent total overflow (" + monthlyRent + " x " + months + ")");
    }
  }

  /** months × 30일 (초 단위) */
  public static long leaseSeconds(long months) {
    try {
      return Math.multiplyExact(months, SECONDS_PER_MONTH);
    } catch (ArithmeticException e) {
      throw new InvalidArgumentException("lease period overflow (months: " + months + ")");
    }
  }

  /** 기준 시각에 기간을 더한 종료 시각 */
  public static long leaseEnd(long from, long months) {
    try {
      return Math.addExact(from, leaseSeconds(months));
    } catch (ArithmeticException e) {
      throw new InvalidArgumentException("lease end overflow (months: " + months + ")");
    }
  }
}
