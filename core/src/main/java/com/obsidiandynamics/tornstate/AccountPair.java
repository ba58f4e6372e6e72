package com.obsidiandynamics.tornstate;

/**
 * Two linked balances whose sum must equal the total recorded at construction. Not
 * thread-safe; all access goes through a {@link TransferCoordinator}, which holds the pair's
 * mutex for the duration of every call.
 */
final class AccountPair {
  static final int ACCOUNT_A = 1;

  static final int ACCOUNT_B = 2;

  private final long invariantTotal;

  private final Delay delay;

  private long balanceA;

  private long balanceB;

  AccountPair(long invariantTotal, long balanceA, long balanceB, Delay delay) {
    this.invariantTotal = invariantTotal;
    this.balanceA = balanceA;
    this.balanceB = balanceB;
    this.delay = delay;
  }

  long getInvariantTotal() {
    return invariantTotal;
  }

  long getBalance(int accountId) {
    switch (accountId) {
      case ACCOUNT_A:
        return balanceA;
      case ACCOUNT_B:
        return balanceB;
      default:
        throw new InvalidAccountIdException(accountId);
    }
  }

  long totalBalance() {
    return balanceA + balanceB;
  }

  /**
   * Moves {@code amount} out of {@code fromAccountId} and into the other account, pausing for
   * {@code delayMillis} in between. If the pause is interrupted, the source remains debited
   * and the destination is never credited.
   */
  Balances transfer(int fromAccountId, long amount, long delayMillis) throws InterruptedException {
    final var total = totalBalance();
    if (total != invariantTotal) {
      throw new InvariantViolationException(balanceA, balanceB, invariantTotal);
    }

    switch (fromAccountId) {
      case ACCOUNT_A:
        balanceA -= amount;
        pause(delayMillis);
        balanceB += amount;
        break;
      case ACCOUNT_B:
        balanceB -= amount;
        pause(delayMillis);
        balanceA += amount;
        break;
      default:
        throw new InvalidAccountIdException(fromAccountId);
    }
    return new Balances(balanceA, balanceB);
  }

  private void pause(long delayMillis) throws InterruptedException {
    if (delayMillis > 0) {
      delay.pause(delayMillis);
    }
  }

  @Override
  public String toString() {
    return AccountPair.class.getSimpleName() + "[invariantTotal=" + invariantTotal +
        ", balanceA=" + balanceA +
        ", balanceB=" + balanceB + ']';
  }
}
