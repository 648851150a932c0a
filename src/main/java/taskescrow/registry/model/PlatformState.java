package taskescrow.registry.model;

/**
 * Registry-wide state: owner, fee policy, task counter and the value in custody.
 */
public record PlatformState(
        String owner,
        int platformFeePercentage,
        long taskCounter,
        long heldBalance) {

    public static final int MAX_FEE_PERCENTAGE = 10;

    public boolean isOwner(String identity) {
        return owner.equals(identity);
    }

    /**
     * Platform fee for a reward at the current percentage, rounded down.
     * Equivalent to {@code reward * pct / 100} without overflowing for large rewards.
     */
    public long feeFor(long reward) {
        return (reward / 100) * platformFeePercentage + (reward % 100) * platformFeePercentage / 100;
    }

    public PlatformState withFeePercentage(int pct) {
        return new PlatformState(owner, pct, taskCounter, heldBalance);
    }

    public PlatformState withTaskCounter(long counter) {
        return new PlatformState(owner, platformFeePercentage, counter, heldBalance);
    }

    public PlatformState withHeldBalance(long balance) {
        return new PlatformState(owner, platformFeePercentage, taskCounter, balance);
    }
}
