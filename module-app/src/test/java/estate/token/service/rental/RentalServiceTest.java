package estate.token.service.rental;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import estate.token.core.calculator.RentCalculator;
import estate.token.core.port.out.NotificationChannel;
import estate.token.core.port.out.OwnershipRegistry;
import estate.token.core.port.out.ValueTransferPort;
import estate.token.domain.model.notification.PropertyNotification;
import estate.token.error.exception.InsufficientPaymentException;
import estate.token.error.exception.InvalidArgumentException;
import estate.token.error.exception.NotRenterException;
import estate.token.error.exception.PropertyListedException;
import estate.token.error.exception.PropertyRentedException;
import estate.token.error.exception.RentalNotListedException;
import estate.token.infrastructure.persistence.entity.PropertyEntity;
import estate.token.service.auth.AuthorizationCheck;
import estate.token.service.property.PropertyRegistryService;
import estate.token.support.ManualChainClock;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

@Tag("unit")
class RentalServiceTest {

  private static final Long PROPERTY_ID = 2L;
  private static final String LANDLORD = "0xalice";
  private static final String RENTER = "0xbob";
  private static final long RENT = 100L;

  private PropertyRegistryService propertyRegistry;
  private OwnershipRegistry ownershipRegistry;
  private ValueTransferPort valueTransfer;
  private NotificationChannel notificationChannel;
  private ManualChainClock clock;
  private RentalService rentalService;

  private PropertyEntity property;

  @BeforeEach
  void setUp() {
    propertyRegistry = mock(PropertyRegistryService.class);
    ownershipRegistry = mock(OwnershipRegistry.class);
    valueTransfer = mock(ValueTransferPort.class);
    notificationChannel = mock(NotificationChannel.class);
    clock = new ManualChainClock();

    rentalService =
        new RentalService(
            propertyRegistry,
            mock(AuthorizationCheck.class),
            ownershipRegistry,
            valueTransfer,
            clock,
            notificationChannel);

    property = PropertyEntity.mint(PROPERTY_ID, "Busan", 59L, "officetel");
    given(propertyRegistry.load(PROPERTY_ID)).willReturn(property);
    given(ownershipRegistry.ownerOf(PROPERTY_ID)).willReturn(LANDLORD);
  }

  @Nested
  @DisplayName("임대 등록")
  class ListForRent {

    @Test
    @DisplayName("판매 중인 매물은 StateConflict")
    void forSaleIsRejected() {
      property.listForSale(1_000L);

      assertThatThrownBy(() -> rentalService.listForRent(LANDLORD, PROPERTY_ID, RENT))
          .isInstanceOf(PropertyListedException.class);
    }

    @Test
    @DisplayName("임대 중인 매물은 StateConflict")
    void rentedIsRejected() {
      property.listForRent(RENT);
      property.lease(RENTER, clock.now(), 1L);

      assertThatThrownBy(() -> rentalService.listForRent(LANDLORD, PROPERTY_ID, 200L))
          .isInstanceOf(PropertyRentedException.class);
    }

    @Test
    @DisplayName("성공 시 RentalListed 알림을 남긴다")
    void listsAndNotifies() {
      rentalService.listForRent(LANDLORD, PROPERTY_ID, RENT);

      assertThat(property.getMonthlyRent()).isEqualTo(RENT);
      verify(notificationChannel).append(new PropertyNotification.RentalListed(PROPERTY_ID, RENT));
    }
  }

  @Nested
  @DisplayName("임대 계약")
  class RentProperty {

    @Test
    @DisplayName("임대 등록이 없으면 NotFound")
    void notListed() {
      assertThatThrownBy(() -> rentalService.rentProperty(RENTER, PROPERTY_ID, 1L, RENT))
          .isInstanceOf(RentalNotListedException.class);
    }

    @Test
    @DisplayName("0개월은 InvalidArgument")
    void zeroMonths() {
      property.listForRent(RENT);

      assertThatThrownBy(() -> rentalService.rentProperty(RENTER, PROPERTY_ID, 0L, RENT))
          .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("요구 금액보다 적게 첨부하면 InsufficientPayment, 수납하지 않는다")
    void underpayment() {
      property.listForRent(RENT);

      assertThatThrownBy(() -> rentalService.rentProperty(RENTER, PROPERTY_ID, 2L, 2 * RENT - 1))
          .isInstanceOf(InsufficientPaymentException.class);
      verify(valueTransfer, never()).collect(anyString(), anyLong());
    }

    @Test
    @DisplayName("초과 지불액은 수납만 되고 임대인에게는 요구 금액만 지급된다")
    void overpaymentIsRetained() {
      // given
      property.listForRent(RENT);
      AtomicLong rentalEndAtPush = new AtomicLong();
      willAnswer(
              invocation -> {
                rentalEndAtPush.set(property.getRentalEnd());
                return null;
              })
          .given(valueTransfer)
          .push(LANDLORD, 2 * RENT);

      // when
      rentalService.rentProperty(RENTER, PROPERTY_ID, 2L, 2 * RENT + 50);

      // then
      long expectedEnd = clock.now() + 60 * RentCalculator.SECONDS_PER_DAY;
      assertThat(property.getRenter()).isEqualTo(RENTER);
      assertThat(property.getRentalEnd()).isEqualTo(expectedEnd);
      assertThat(rentalEndAtPush.get()).isEqualTo(expectedEnd);

      InOrder order = inOrder(valueTransfer, notificationChannel);
      order.verify(valueTransfer).collect(RENTER, 2 * RENT + 50);
      order.verify(valueTransfer).push(LANDLORD, 2 * RENT);
      order
          .verify(notificationChannel)
          .append(new PropertyNotification.Rented(PROPERTY_ID, RENTER, 2L, 2 * RENT));
    }

    @Test
    @DisplayName("판매 중이어도 임대할 수 있다")
    void forSaleDoesNotBlockRenting() {
      property.listForRent(RENT);
      property.listForSale(5_000L);

      rentalService.rentProperty(RENTER, PROPERTY_ID, 1L, RENT);

      assertThat(property.isForSale()).isTrue();
      assertThat(property.isRentedAt(clock.now())).isTrue();
    }

    @Test
    @DisplayName("만료 후에는 다른 계정이 다시 임대할 수 있다")
    void canRentAgainAfterExpiry() {
      property.listForRent(RENT);
      rentalService.rentProperty(RENTER, PROPERTY_ID, 1L, RENT);

      assertThatThrownBy(() -> rentalService.rentProperty("0xcarol", PROPERTY_ID, 1L, RENT))
          .isInstanceOf(PropertyRentedException.class);

      clock.advanceDays(31);
      rentalService.rentProperty("0xcarol", PROPERTY_ID, 1L, RENT);

      assertThat(property.getRenter()).isEqualTo("0xcarol");
    }
  }

  @Nested
  @DisplayName("임대 연장")
  class ExtendRental {

    @BeforeEach
    void rent() {
      property.listForRent(RENT);
      property.lease(RENTER, clock.now(), 1L);
    }

    @Test
    @DisplayName("renter가 아니면 AuthorizationError")
    void onlyRenter() {
      assertThatThrownBy(() -> rentalService.extendRental(LANDLORD, PROPERTY_ID, 1L, RENT))
          .isInstanceOf(NotRenterException.class);
    }

    @Test
    @DisplayName("rentalEnd를 정확히 추가 개월 × 30일만큼 늘린다")
    void extendsByExactPeriod() {
      long before = property.getRentalEnd();

      rentalService.extendRental(RENTER, PROPERTY_ID, 3L, 3 * RENT);

      assertThat(property.getRentalEnd()).isEqualTo(before + 90 * RentCalculator.SECONDS_PER_DAY);
      verify(notificationChannel)
          .append(new PropertyNotification.Extended(PROPERTY_ID, 3L, 3 * RENT));
    }

    @Test
    @DisplayName("연장 대금은 연장 시점의 소유자에게 지급된다")
    void paysCurrentHolder() {
      given(ownershipRegistry.ownerOf(PROPERTY_ID)).willReturn("0xnewowner");

      rentalService.extendRental(RENTER, PROPERTY_ID, 1L, RENT);

      verify(valueTransfer).push("0xnewowner", RENT);
      verify(valueTransfer, never()).push(LANDLORD, RENT);
    }
  }
}
