package estate.token.controller.dto.account;

public record BalanceResponse(String account, long balance) {}
