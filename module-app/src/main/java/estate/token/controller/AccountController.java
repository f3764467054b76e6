package estate.token.controller;

import estate.token.controller.dto.account.BalanceResponse;
import estate.token.controller.dto.account.DepositRequest;
import estate.token.controller.util.CallerHeader;
import estate.token.response.ApiResponse;
import estate.token.service.account.AccountService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 계정 잔액 API */
@Slf4j
@RestController
@RequestMapping("/api/v1/accounts/{account}")
@RequiredArgsConstructor
@Tag(name = "Account", description = "입금/잔액 조회 API")
public class AccountController {

  private final AccountService accountService;

  @PostMapping("/deposit")
  @Operation(summary = "입금", description = "특권 계정만 호출할 수 있습니다.")
  public ResponseEntity<ApiResponse<BalanceResponse>> deposit(
      @RequestHeader(CallerHeader.NAME) @Size(max = CallerHeader.MAX_LENGTH) String caller,
      @PathVariable @Size(max = CallerHeader.MAX_LENGTH) String account,
      @Valid @RequestBody DepositRequest request) {
    long balance = accountService.deposit(caller, account, request.amount());
    log.info(
        "[Account] Deposit: account={}, amount={}, caller={}", account, request.amount(), caller);
    return ResponseEntity.ok(ApiResponse.success(new BalanceResponse(account, balance)));
  }

  @GetMapping
  @Operation(summary = "잔액 조회", description = "없는 계정은 0을 반환합니다.")
  public ResponseEntity<ApiResponse<BalanceResponse>> balanceOf(
      @PathVariable @Size(max = CallerHeader.MAX_LENGTH) String account) {
    return ResponseEntity.ok(
        ApiResponse.success(new BalanceResponse(account, accountService.balanceOf(account))));
  }
}
