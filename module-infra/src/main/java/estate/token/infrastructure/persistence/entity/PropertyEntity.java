package estate.token.infrastructure.persistence.entity;

import estate.token.core.calculator.RentCalculator;
import estate.token.domain.model.InputLimits;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 매물 레코드 (자산 ID당 1건, 발행 시 생성되고 삭제되지 않음)
 *
 * <p>renter/rentalEnd는 임대 만료 후에도 지우지 않습니다. 만료 여부는 {@link #isRentedAt(long)}로 조회 시점에 계산합니다.
 *
 * <p>판매 등록과 임대의 배타성은 등록 시점에만 검사되며 이후에는 재검증하지 않습니다.
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "property")
public class PropertyEntity {

  @Id private Long id;

  @Column(nullable = false, length = InputLimits.LOCATION_MAX)
  private String location;

  @Column(nullable = false)
  private long area;

  @Column(nullable = false, length = InputLimits.CATEGORY_MAX)
  private String category;

  @Column(nullable = false)
  private long salePrice;

  @Column(nullable = false)
  private boolean forSale;

  @Column(length = AccountEntity.ACCOUNT_ID_LENGTH)
  private String renter;

  @Column(nullable = false)
  private long rentalEnd;

  @Column(nullable = false)
  private long monthlyRent;

  // 위임 관리자 (없으면 null)
  @Column(length = AccountEntity.ACCOUNT_ID_LENGTH)
  private String manager;

  @Version private Long version;

  private PropertyEntity(Long id, String location, long area, String category) {
    this.id = id;
    this.location = location;
    this.area = area;
    this.category = category;
  }

  public static PropertyEntity mint(Long id, String location, long area, String category) {
    return new PropertyEntity(id, location, area, category);
  }

  // --- 조회 규칙 ---

  public boolean isRentedAt(long now) {
    return renter != null && now <= rentalEnd;
  }

  public boolean isRentedBy(String account) {
    return renter != null && renter.equals(account);
  }

  public boolean isRentalListed() {
    return monthlyRent > 0;
  }

  public Optional<String> findManager() {
    return Optional.ofNullable(manager);
  }

  // --- 상태 전이 ---

  public void listForSale(long price) {
    this.forSale = true;
    this.salePrice = price;
  }

  public void closeSale() {
    this.forSale = false;
    this.salePrice = 0L;
  }

  public void listForRent(long monthlyRent) {
    this.monthlyRent = monthlyRent;
  }

  public void lease(String renter, long now, long months) {
    this.renter = renter;
    this.rentalEnd = RentCalculator.leaseEnd(now, months);
  }

  public void extendLease(long additionalMonths) {
    this.rentalEnd = RentCalculator.leaseEnd(rentalEnd, additionalMonths);
  }

  public void assignManager(String manager) {
    this.manager = manager;
  }
}
