package estate.token.controller;

import estate.token.controller.dto.auction.BidRequest;
import estate.token.controller.dto.auction.StartAuctionRequest;
import estate.token.controller.util.CallerHeader;
import estate.token.domain.model.auction.AuctionDetails;
import estate.token.response.ApiResponse;
import estate.token.service.auction.AuctionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 영국식 경매 API */
@RestController
@RequestMapping("/api/v1/properties/{propertyId}/auction")
@RequiredArgsConstructor
@Tag(name = "Auction", description = "경매 시작/입찰/종료 API")
public class AuctionController {

  private final AuctionService auctionService;

  @PostMapping
  @Operation(summary = "경매 시작", description = "매물당 경매는 한 번만 열 수 있습니다.")
  public ResponseEntity<ApiResponse<Void>> startAuction(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody StartAuctionRequest request) {
    auctionService.startAuction(
        caller, propertyId, request.startPrice(), request.durationSeconds());
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @PostMapping("/bids")
  @Operation(summary = "입찰", description = "밀려난 최고 입찰자는 전액 환불받습니다.")
  public ResponseEntity<ApiResponse<Void>> bid(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId,
      @Valid @RequestBody BidRequest request) {
    auctionService.bid(caller, propertyId, request.value());
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @PostMapping("/end")
  @Operation(summary = "경매 종료", description = "종료 시각 이후 누구나 한 번 호출할 수 있습니다.")
  public ResponseEntity<ApiResponse<Void>> endAuction(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable Long propertyId) {
    auctionService.endAuction(caller, propertyId);
    return ResponseEntity.ok(ApiResponse.success(null));
  }

  @GetMapping
  @Operation(summary = "경매 상태 조회")
  public ResponseEntity<ApiResponse<AuctionDetails>> auctionOf(@PathVariable Long propertyId) {
    return ResponseEntity.ok(ApiResponse.success(auctionService.auctionOf(propertyId)));
  }
}
