package estate.token.controller;

import estate.token.controller.dto.rental.ExtendRentalRequest;
import estate.token.controller.dto.rental.ListForRentRequest;
import estate.token.controller.dto.rental.RentRequest;
import estate.token.controller.util.CallerHeader;
import estate.token.response.ApiResponse;
import estate.token.service.rental.RentalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 고정 기간 임대 API */
@RestController
@RequestMapping("/api/v1/properties/{propertyId}/rental")
@RequiredArgsConstructor
@Tag(name = "Rental", description = "임대 등록/계약/연장 API")
public class RentalController {

  private final RentalService rentalService;

  @PostMapping
  @Operation(summary = "임대 등록")
  public ResponseEntity<ApiResponse<Void>> listForRent(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody ListForRentRequest request) {
    rentalService.listForRent(caller, propertyId, request.monthlyRent());
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @PostMapping("/lease")
  @Operation(summary = "임대 계약", description = "초과 지불액은 환불되지 않습니다.")
  public ResponseEntity<ApiResponse<Void>> rentProperty(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody RentRequest request) {
    rentalService.rentProperty(caller, propertyId, request.months(), request.value());
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @PostMapping("/extension")
  @Operation(summary = "임대 연장", description = "연장 대금은 현재 소유자에게 지급됩니다.")
  public ResponseEntity<ApiResponse<Void>> extendRental(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody ExtendRentalRequest request) {
    rentalService.extendRental(caller, propertyId, request.additionalMonths(), request.value());
    return ResponseEntity.ok(ApiResponse.success(null));
  }
}
