package com.obsidiandynamics.tornstate;

public final class InvalidAccountIdException extends IllegalArgumentException {
  private final int accountId;

  public InvalidAccountIdException(int accountId) {
    super(String.format("Invalid account ID %d - expecting %d or %d", accountId, AccountPair.ACCOUNT_A, AccountPair.ACCOUNT_B));
    this.accountId = accountId;
  }

  public int getAccountId() {
    return accountId;
  }
}
