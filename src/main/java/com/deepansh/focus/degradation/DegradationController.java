package com.deepansh.focus.degradation;

import com.deepansh.focus.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;

/**
 * Walks a ladder downwards during one turn.
 *
 * Created fresh for every user message, so each turn starts at the top tier.
 * It only moves between tiers; transport retries belong to the adapters.
 */
@Slf4j
public class DegradationController {

    private final DegradationLadder ladder;
    private int index;

    public DegradationController(DegradationLadder ladder) {
        this.ladder = ladder;
    }

    public CapabilityTier current() {
        return ladder.get(index);
    }

    /**
     * Moves to the next tier after a failure at the current one.
     *
     * @return false when the current tier was the last one
     */
    public boolean advance(ErrorKind failure) {
        if (index + 1 >= ladder.size()) {
            log.warn("Tier [{}] failed with {} and no tiers remain", current().getLabel(), failure);
            return false;
        }
        CapabilityTier failed = current();
        index++;
        log.warn("Tier [{}] failed with {}, degrading to [{}]", failed.getLabel(), failure, current().getLabel());
        return true;
    }

    public int position() {
        return index;
    }
}
