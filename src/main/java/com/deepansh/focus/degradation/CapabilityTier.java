package com.deepansh.focus.degradation;

import lombok.Value;

import java.util.Set;

/**
 * One rung of the degradation ladder: a backend plus the tools it may use there.
 * An empty tool set means the backend must answer in text.
 */
@Value
public class CapabilityTier {

    String label;
    String backendId;
    Set<String> toolNames;

    public boolean isTextOnly() {
        return toolNames.isEmpty();
    }
}
