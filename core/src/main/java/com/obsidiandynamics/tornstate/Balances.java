package com.obsidiandynamics.tornstate;

public final class Balances {
  private final long balanceA;

  private final long balanceB;

  public Balances(long balanceA, long balanceB) {
    this.balanceA = balanceA;
    this.balanceB = balanceB;
  }

  public long getBalanceA() {
    return balanceA;
  }

  public long getBalanceB() {
    return balanceB;
  }

  public long total() {
    return balanceA + balanceB;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    } else if (o instanceof Balances) {
      final var that = (Balances) o;
      return balanceA == that.balanceA && balanceB == that.balanceB;
    } else {
      return false;
    }
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(balanceA) + Long.hashCode(balanceB);
  }

  @Override
  public String toString() {
    return Balances.class.getSimpleName() + "[balanceA=" + balanceA + ", balanceB=" + balanceB + ']';
  }
}
