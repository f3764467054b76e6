package estate.token.controller;

import estate.token.controller.dto.market.AcceptOfferRequest;
import estate.token.controller.dto.market.EscrowResponse;
import estate.token.controller.dto.market.ListForSaleRequest;
import estate.token.controller.dto.market.MakeOfferRequest;
import estate.token.controller.util.CallerHeader;
import estate.token.response.ApiResponse;
import estate.token.service.market.MarketplaceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 직접 판매(에스크로 오퍼) API */
@RestController
@RequestMapping("/api/v1/properties/{propertyId}")
@RequiredArgsConstructor
@Tag(name = "Marketplace", description = "판매 등록과 오퍼 API")
public class MarketplaceController {

  private final MarketplaceService marketplaceService;

  @PostMapping("/sale")
  @Operation(summary = "판매 등록", description = "취소(delist) 연산은 없습니다.")
  public ResponseEntity<ApiResponse<Void>> listForSale(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody ListForSaleRequest request) {
    marketplaceService.listForSale(caller, propertyId, request.price());
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @PostMapping("/offers")
  @Operation(summary = "오퍼 제출", description = "같은 입찰자의 이전 오퍼는 덮어쓰며 환불되지 않습니다.")
  public ResponseEntity<ApiResponse<Void>> makeOffer(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody MakeOfferRequest request) {
    marketplaceService.makeOffer(caller, propertyId, request.value());
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @PostMapping("/offers/accept")
  @Operation(summary = "오퍼 수락")
  public ResponseEntity<ApiResponse<Void>> acceptOffer(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody AcceptOfferRequest request) {
    marketplaceService.acceptOffer(caller, propertyId, request.buyer());
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @DeleteMapping("/offers")
  @Operation(summary = "오퍼 철회", description = "호출자의 에스크로 전액을 돌려받습니다.")
  public ResponseEntity<ApiResponse<Void>> withdrawOffer(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId) {
    marketplaceService.withdrawOffer(caller, propertyId);
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @GetMapping("/offers/{account}")
  @Operation(summary = "에스크로 조회")
  public ResponseEntity<ApiResponse<EscrowResponse>> escrowOf(
      @PathVariable Long propertyId, @PathVariable String account) {
    long amount = marketplaceService.escrowOf(propertyId, account);
    return ResponseEntity.ok(ApiResponse.success(new EscrowResponse(propertyId, account, amount)));
  }
}
