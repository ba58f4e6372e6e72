package com.obsidiandynamics.tornstate;

/**
 * Raised when a transfer finds that the balances no longer sum to the total recorded at
 * construction. The pair is tainted from this point on: nothing restores the lost amount.
 */
public final class InvariantViolationException extends IllegalStateException {
  private final long balanceA;

  private final long balanceB;

  private final long expectedTotal;

  public InvariantViolationException(long balanceA, long balanceB, long expectedTotal) {
    super(String.format("Found wrong initial total balance %d - expecting %d", balanceA + balanceB, expectedTotal));
    this.balanceA = balanceA;
    this.balanceB = balanceB;
    this.expectedTotal = expectedTotal;
  }

  public long getBalanceA() {
    return balanceA;
  }

  public long getBalanceB() {
    return balanceB;
  }

  public long getExpectedTotal() {
    return expectedTotal;
  }

  public long getObservedTotal() {
    return balanceA + balanceB;
  }

  public Balances getBalances() {
    return new Balances(balanceA, balanceB);
  }
}
