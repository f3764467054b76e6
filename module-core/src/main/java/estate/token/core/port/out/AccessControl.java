package estate.token.core.port.out;

/** 발행(mint) 등 특권 연산 게이트 */
public interface AccessControl {

  boolean isPrivileged(String caller);
}
