package rg.core.store;

/**
 * Rate state for one key: the window counter and the violation record,
 * co-located so a single lock covers both and a reset clears both at once.
 */
public final class RateEntry extends GuardedEntry {

    private final WindowState window = new WindowState();
    private final ViolationState violations = new ViolationState();

    public RateEntry(String key) {
        super(key);
    }

    public WindowState window() {
        return window;
    }

    public ViolationState violations() {
        return violations;
    }
}
