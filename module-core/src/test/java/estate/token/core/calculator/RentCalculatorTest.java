package estate.token.core.calculator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import estate.token.error.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RentCalculatorTest {

  @Nested
  @DisplayName("임대 기간 (leaseSeconds / leaseEnd)")
  class LeasePeriodTest {

    @Test
    @DisplayName("1개월은 달력과 무관하게 고정 30일이다")
    void oneMonthIsThirtyDays() {
      assertThat(RentCalculator.leaseSeconds(1)).isEqualTo(30L * 24 * 60 * 60);
      assertThat(RentCalculator.leaseSeconds(2)).isEqualTo(5_184_000L);
    }

    @Test
    @DisplayName("종료 시각 = 기준 시각 + months × 30일")
    void leaseEndAddsFixedMonths() {
      long now = 1_700_000_000L;

      assertThat(RentCalculator.leaseEnd(now, 2)).isEqualTo(now + 60 * RentCalculator.SECONDS_PER_DAY);
    }

    @Test
    @DisplayName("기간 오버플로는 InvalidArgumentException")
    void overflowIsInvalidArgument() {
      assertThatThrownBy(() -> RentCalculator.leaseSeconds(Long.MAX_VALUE / 2))
          .isInstanceOf(InvalidArgumentException.class);
    }
  }

  @Nested
  @DisplayName("필요 임대료 (requiredRent)")
  class RequiredRentTest {

    @Test
    @DisplayName("월세 × 개월 수")
    void multipliesMonthlyRent() {
      assertThat(RentCalculator.requiredRent(100L, 3)).isEqualTo(300L);
    }

    @Test
    @DisplayName("금액 오버플로는 InvalidArgumentException")
    void overflowIsInvalidArgument() {
      assertThatThrownBy(() -> RentCalculator.requiredRent(Long.MAX_VALUE, 2))
          .isInstanceOf(InvalidArgumentException.class)
          .hasMessageContaining("overflow");
    }
  }
}
