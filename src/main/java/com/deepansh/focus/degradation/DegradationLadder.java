package com.deepansh.focus.degradation;

import com.deepansh.focus.config.FocusProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable list of capability tiers, best first.
 *
 * Built once at startup. Construction fails when the ladder is empty, a label repeats,
 * a tier names an unknown backend or tool, or the last tier still offers tools.
 */
@Slf4j
public final class DegradationLadder {

    public static final String ALL_TOOLS = "*";

    private final List<CapabilityTier> tiers;

    private DegradationLadder(List<CapabilityTier> tiers) {
        this.tiers = Collections.unmodifiableList(tiers);
    }

    public static DegradationLadder of(List<CapabilityTier> tiers,
                                       Collection<String> knownBackends,
                                       Collection<String> registeredTools) {
        if (tiers.isEmpty()) {
            throw new IllegalStateException("Degradation ladder must have at least one tier");
        }

        Set<String> labels = new HashSet<>();
        for (CapabilityTier tier : tiers) {
            if (tier.getLabel() == null || !labels.add(tier.getLabel())) {
                throw new IllegalStateException("Tier labels must be present and unique: " + tier.getLabel());
            }
            if (!knownBackends.contains(tier.getBackendId())) {
                throw new IllegalStateException(String.format(
                        "Tier '%s' uses unknown backend '%s'. Known: %s",
                        tier.getLabel(), tier.getBackendId(), knownBackends));
            }
            for (String tool : tier.getToolNames()) {
                if (!registeredTools.contains(tool)) {
                    throw new IllegalStateException(String.format(
                            "Tier '%s' lists unregistered tool '%s'", tier.getLabel(), tool));
                }
            }
        }

        CapabilityTier last = tiers.get(tiers.size() - 1);
        if (!last.isTextOnly()) {
            throw new IllegalStateException("Last tier '" + last.getLabel() + "' must be text-only");
        }

        tiers.forEach(tier -> log.info("Tier [{}] -> backend={}, tools={}",
                tier.getLabel(), tier.getBackendId(), tier.isTextOnly() ? "none" : tier.getToolNames().size()));
        return new DegradationLadder(new ArrayList<>(tiers));
    }

    /**
     * Builds the ladder from configuration, expanding "*" to every registered tool.
     */
    public static DegradationLadder fromProperties(List<FocusProperties.Tier> configured,
                                                   Collection<String> knownBackends,
                                                   Collection<String> registeredTools) {
        List<CapabilityTier> tiers = new ArrayList<>(configured.size());
        for (FocusProperties.Tier tier : configured) {
            Set<String> tools = new LinkedHashSet<>();
            for (String name : tier.getTools()) {
                if (ALL_TOOLS.equals(name)) {
                    tools.addAll(registeredTools);
                } else {
                    tools.add(name);
                }
            }
            tiers.add(new CapabilityTier(tier.getLabel(), tier.getBackend(), Collections.unmodifiableSet(tools)));
        }
        return of(tiers, knownBackends, registeredTools);
    }

    public int size() {
        return tiers.size();
    }

    public CapabilityTier get(int index) {
        return tiers.get(index);
    }

    public List<CapabilityTier> tiers() {
        return tiers;
    }
}
