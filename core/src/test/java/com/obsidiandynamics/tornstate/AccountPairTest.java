package com.obsidiandynamics.tornstate;

import org.junit.jupiter.api.*;
import org.mockito.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

final class AccountPairTest {
  private static AccountPair balanced(long balanceA, long balanceB) {
    return new AccountPair(balanceA + balanceB, balanceA, balanceB, Delay.sleep());
  }

  @Test
  void testGetBalance() {
    final var pair = balanced(4_000, 6_000);
    assertThat(pair.getBalance(1)).isEqualTo(4_000);
    assertThat(pair.getBalance(2)).isEqualTo(6_000);
    assertThat(pair.totalBalance()).isEqualTo(10_000);
    assertThat(pair.getInvariantTotal()).isEqualTo(10_000);
  }

  @Test
  void testGetBalance_invalidAccountId() {
    final var pair = balanced(4_000, 6_000);
    assertThat(catchThrowableOfType(() -> pair.getBalance(3), InvalidAccountIdException.class))
        .isNotNull()
        .satisfies(e -> assertThat(e.getAccountId()).isEqualTo(3));
    assertThat(catchThrowable(() -> pair.getBalance(0))).isInstanceOf(InvalidAccountIdException.class);
  }

  @Test
  void testTransferFromA() throws InterruptedException {
    final var pair = balanced(4_000, 6_000);
    assertThat(pair.transfer(1, 100, 0)).isEqualTo(new Balances(3_900, 6_100));
    assertThat(pair.getBalance(1)).isEqualTo(3_900);
    assertThat(pair.getBalance(2)).isEqualTo(6_100);
    assertThat(pair.totalBalance()).isEqualTo(10_000);
  }

  @Test
  void testTransferFromB() throws InterruptedException {
    final var pair = balanced(4_000, 6_000);
    assertThat(pair.transfer(2, 250, 0)).isEqualTo(new Balances(4_250, 5_750));
  }

  @Test
  void testComplementaryTransfersRestoreBalances() throws InterruptedException {
    final var pair = balanced(4_000, 6_000);
    pair.transfer(1, 700, 0);
    assertThat(pair.transfer(2, 700, 0)).isEqualTo(new Balances(4_000, 6_000));
  }

  @Test
  void testTransfer_invalidSourceLeavesBalancesUntouched() {
    final var pair = balanced(4_000, 6_000);
    assertThat(catchThrowableOfType(() -> pair.transfer(0, 10, 0), InvalidAccountIdException.class))
        .isNotNull()
        .satisfies(e -> assertThat(e.getAccountId()).isZero());
    assertThat(pair.getBalance(1)).isEqualTo(4_000);
    assertThat(pair.getBalance(2)).isEqualTo(6_000);
  }

  @Test
  void testTransfer_mismatchedRecordedTotal() {
    final var pair = new AccountPair(9_000, 4_000, 6_000, Delay.sleep());
    final var e = catchThrowableOfType(() -> pair.transfer(1, 100, 1_000), InvariantViolationException.class);
    assertThat(e).isNotNull();
    assertThat(e.getBalanceA()).isEqualTo(4_000);
    assertThat(e.getBalanceB()).isEqualTo(6_000);
    assertThat(e.getExpectedTotal()).isEqualTo(9_000);
    assertThat(e).hasMessage("Found wrong initial total balance 10000 - expecting 9000");

    // detection precedes any mutation
    assertThat(pair.getBalance(1)).isEqualTo(4_000);
  }

  @Test
  void testDelayOnlyInvokedWhenPositive() throws InterruptedException {
    final var delay = Mockito.mock(Delay.class);
    final var pair = new AccountPair(10_000, 4_000, 6_000, delay);
    pair.transfer(1, 100, 0);
    pair.transfer(1, 100, -5);
    verify(delay, never()).pause(anyLong());

    pair.transfer(1, 100, 50);
    verify(delay, times(1)).pause(eq(50L));
  }

  @Test
  void testInterruptedDelayTearsPair() throws InterruptedException {
    final var delay = Mockito.mock(Delay.class);
    doThrow(new InterruptedException("stop")).when(delay).pause(anyLong());
    final var pair = new AccountPair(10_000, 4_000, 6_000, delay);

    assertThat(catchThrowable(() -> pair.transfer(1, 100, 10_000))).isInstanceOf(InterruptedException.class);
    assertThat(pair.getBalance(1)).isEqualTo(3_900);
    assertThat(pair.getBalance(2)).isEqualTo(6_000);
    assertThat(pair.totalBalance()).isEqualTo(9_900);

    final var e = catchThrowableOfType(() -> pair.transfer(1, 100, 0), InvariantViolationException.class);
    assertThat(e).isNotNull();
    assertThat(e.getBalances()).isEqualTo(new Balances(3_900, 6_000));
    assertThat(e.getExpectedTotal()).isEqualTo(10_000);
  }

  @Test
  void testToString() {
    final var toString = balanced(4_000, 6_000).toString();
    assertThat(toString).contains(AccountPair.class.getSimpleName());
    assertThat(toString).contains("invariantTotal=10000");
  }
}
