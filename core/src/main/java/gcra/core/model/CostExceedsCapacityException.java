package gcra.core.model;

/**
 * Thrown when a request asks for more units than the quota's burst. Such a request could
 * never be admitted, even against a fresh state, so it is reported instead of rejected.
 */
public class CostExceedsCapacityException extends IllegalArgumentException {

    private final int cost;
    private final int maxBurst;

    public CostExceedsCapacityException(int cost, int maxBurst) {
        super("cost " + cost + " exceeds quota capacity " + maxBurst + " and will never succeed");
        this.cost = cost;
        this.maxBurst = maxBurst;
    }

    public int cost() {
        return cost;
    }

    public int maxBurst() {
        return maxBurst;
    }
}
