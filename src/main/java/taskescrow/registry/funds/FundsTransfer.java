package taskescrow.registry.funds;

import taskescrow.registry.model.Payment;

import java.util.List;

/**
 * Value-transfer primitive supplied by the hosting environment.
 * Implementations can settle against an in-process ledger, a payment provider, or a chain.
 */
public interface FundsTransfer {

    /**
     * Deliver a batch of payments out of the registry's custody.
     * The batch is all-or-nothing: either every payment is delivered or none is.
     *
     * @param payments payments to deliver, in order
     * @throws TransferFailedException if any recipient cannot accept funds
     */
    void transfer(List<Payment> payments) throws TransferFailedException;
}
