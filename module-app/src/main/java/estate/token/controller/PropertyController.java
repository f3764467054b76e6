package estate.token.controller;

import estate.token.controller.dto.property.AssignManagerRequest;
import estate.token.controller.dto.property.MintRequest;
import estate.token.controller.dto.property.MintResponse;
import estate.token.controller.dto.property.RentedResponse;
import estate.token.controller.dto.property.TransferTitleRequest;
import estate.token.controller.util.CallerHeader;
import estate.token.domain.model.property.PropertyDetails;
import estate.token.response.ApiResponse;
import estate.token.service.delegation.DelegationService;
import estate.token.service.property.PropertyRegistryService;
import estate.token.service.title.TitleTransferService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 매물 레지스트리 API
 *
 * <ul>
 *   <li>POST /api/v1/properties - 발행 (특권 계정)
 *   <li>GET /api/v1/properties/{id} - 상세 조회
 *   <li>GET /api/v1/properties/{id}/rented - 임대 중 여부
 *   <li>PUT /api/v1/properties/{id}/manager - 관리자 지정/해제 (소유자)
 *   <li>POST /api/v1/properties/{id}/transfer - 소유권 직접 이전 (소유자)
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/properties")
@RequiredArgsConstructor
@Tag(name = "Property", description = "매물 발행/조회/위임 API")
public class PropertyController {

  private final PropertyRegistryService propertyRegistry;
  private final DelegationService delegationService;
  private final TitleTransferService titleTransferService;

  @PostMapping
  @Operation(summary = "매물 발행", description = "특권 계정만 호출할 수 있습니다.")
  public ResponseEntity<ApiResponse<MintResponse>> mint(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @Valid @RequestBody MintRequest request) {
    Long propertyId =
        propertyRegistry.mint(
            caller, request.to(), request.location(), request.area(), request.category());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ApiResponse.success(new MintResponse(propertyId)));
  }

  @GetMapping("/{propertyId}")
  @Operation(summary = "매물 상세 조회")
  public ResponseEntity<ApiResponse<PropertyDetails>> getDetails(@PathVariable Long propertyId) {
    return ResponseEntity.ok(ApiResponse.success(propertyRegistry.getDetails(propertyId)));
  }

  @GetMapping("/{propertyId}/rented")
  @Operation(summary = "임대 중 여부", description = "renter가 있고 현재 시각이 rentalEnd 이하이면 true")
  public ResponseEntity<ApiResponse<RentedResponse>> isRented(@PathVariable Long propertyId) {
    return ResponseEntity.ok(
        ApiResponse.success(
            new RentedResponse(propertyId, propertyRegistry.isRented(propertyId))));
  }

  @PutMapping("/{propertyId}/manager")
  @Operation(summary = "관리자 지정", description = "manager를 비우면 위임을 해제합니다.")
  public ResponseEntity<ApiResponse<Void>> setManager(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody AssignManagerRequest request) {
    delegationService.setManager(caller, propertyId, request.manager());
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @PostMapping("/{propertyId}/transfer")
  @Operation(summary = "소유권 직접 이전")
  public ResponseEntity<ApiResponse<Void>> transferTitle(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody TransferTitleRequest request) {
    titleTransferService.transferTitle(caller, propertyId, request.to());
    return ResponseEntity.ok(ApiResponse.success(null));
  }
}
