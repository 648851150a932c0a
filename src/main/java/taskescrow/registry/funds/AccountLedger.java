package taskescrow.registry.funds;

import taskescrow.registry.model.Payment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process ledger of balances paid out by the registry.
 * Recipients can be marked as non-receiving to model accounts that refuse funds.
 */
public class AccountLedger implements FundsTransfer {

    private static final Logger log = LoggerFactory.getLogger(AccountLedger.class);

    private final ConcurrentHashMap<String, Long> balances = new ConcurrentHashMap<>();
    private final Set<String> rejecting = ConcurrentHashMap.newKeySet();

    @Override
    public synchronized void transfer(List<Payment> payments) throws TransferFailedException {
        // Validate the whole batch before crediting anything
        for (Payment p : payments) {
            if (rejecting.contains(p.recipient())) {
                throw new TransferFailedException(p.recipient(),
                        "recipient " + p.recipient() + " does not accept funds");
            }
        }
        for (Payment p : payments) {
            balances.merge(p.recipient(), p.amount(), Math::addExact);
            log.debug("Credited {} to {}", p.amount(), p.recipient());
        }
    }

    /** Total received by an identity so far */
    public long balanceOf(String identity) {
        return balances.getOrDefault(identity, 0L);
    }

    public void rejectPaymentsTo(String identity) {
        rejecting.add(identity);
    }

    public void acceptPaymentsTo(String identity) {
        rejecting.remove(identity);
    }

    /** Snapshot of all balances */
    public Map<String, Long> snapshot() {
        return Map.copyOf(balances);
    }
}
