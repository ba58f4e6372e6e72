package example;

import com.obsidiandynamics.tornstate.*;
import com.obsidiandynamics.tornstate.log.*;

import java.util.concurrent.*;

public class Example {
  public static void main(String[] args) throws InterruptedException {
    final var options = new TransferCoordinator.Options() {{
      log = Log.of(System.out);
    }};

    // Single-threaded sanity check: transfers preserve the total.
    final var pair1 = TransferCoordinator.balanced(4_000, 6_000, options);
    System.out.format("balances: %d, %d, total: %d%n", pair1.getBalance(1), pair1.getBalance(2), pair1.totalBalance());
    final var afterTransfer = pair1.transfer(1, 100, 1_000);
    System.out.format("after transfer: %s, total: %d%n", afterTransfer, pair1.totalBalance());

    // A pair whose recorded total disagrees with its balances fails on its first transfer.
    final var pair2 = TransferCoordinator.of(9_000, 4_000, 6_000, options);
    try {
      pair2.transfer(1, 100, 1_000);
    } catch (InvariantViolationException e) {
      System.out.format("%s: %s%n", e.getMessage(), e.getBalances());
    }

    // Forcefully cancel a transfer while it sleeps between the debit and the credit.
    final var entered = new CountDownLatch(1);
    final var pair3 = TransferCoordinator.of(9_000, 3_000, 6_000, new TransferCoordinator.Options() {{
      log = options.log;
      delay = millis -> {
        entered.countDown();
        Thread.sleep(millis);
      };
    }});
    System.out.format("completed: %s%n", pair3.transfer(1, 100, 0));

    final var worker = new Thread(() -> {
      try {
        pair3.transfer(1, 100, 10_000);
      } catch (InterruptedException e) {
        System.out.format("transfer interrupted mid-flight%n");
      }
    }, "transfer-worker");
    worker.start();
    entered.await();
    worker.interrupt();
    worker.join();

    System.out.format("total after cancellation: %d (expected %d)%n", pair3.totalBalance(), pair3.getInvariantTotal());
    try {
      pair3.transfer(1, 100, 0);
    } catch (InvariantViolationException e) {
      System.out.format("%s: %s%n", e.getMessage(), e.getBalances());
    }
  }
}
