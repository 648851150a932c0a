package taskescrow.registry.funds;

import taskescrow.registry.model.Payment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountLedgerTest {

    @Test
    void creditsEveryRecipient() throws Exception {
        AccountLedger ledger = new AccountLedger();

        ledger.transfer(List.of(new Payment("bob", 95), new Payment("owner", 5)));
        ledger.transfer(List.of(new Payment("bob", 10)));

        assertEquals(105, ledger.balanceOf("bob"));
        assertEquals(5, ledger.balanceOf("owner"));
        assertEquals(0, ledger.balanceOf("nobody"));
        assertEquals(2, ledger.snapshot().size());
    }

    @Test
    void batchIsAllOrNothing() {
        AccountLedger ledger = new AccountLedger();
        ledger.rejectPaymentsTo("owner");

        TransferFailedException e = assertThrows(TransferFailedException.class,
                () -> ledger.transfer(List.of(new Payment("bob", 95), new Payment("owner", 5))));

        assertEquals("owner", e.recipient());
        assertEquals(0, ledger.balanceOf("bob"));
        assertEquals(0, ledger.balanceOf("owner"));
    }

    @Test
    void recipientCanAcceptAgain() throws Exception {
        AccountLedger ledger = new AccountLedger();
        ledger.rejectPaymentsTo("bob");
        ledger.acceptPaymentsTo("bob");

        ledger.transfer(List.of(new Payment("bob", 1)));

        assertEquals(1, ledger.balanceOf("bob"));
    }

    @Test
    void paymentRejectsNonPositiveAmount() {
        assertThrows(IllegalArgumentException.class, () -> new Payment("bob", 0));
        assertThrows(NullPointerException.class, () -> new Payment(null, 1));
    }
}
