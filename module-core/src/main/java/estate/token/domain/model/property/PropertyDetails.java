package estate.token.domain.model.property;

/**
 * 매물 상세 조회 모델 (읽기 전용 projection)
 *
 * <p>renter/rentalEnd는 만료 후에도 지워지지 않습니다. 현재 임대 여부는 {@code rented}를 보십시오.
 */
public record PropertyDetails(
    Long propertyId,
    String location,
    long area,
    String category,
    long salePrice,
    boolean forSale,
    String renter,
    long rentalEnd,
    long monthlyRent,
    String owner,
    String manager,
    boolean rented) {}
