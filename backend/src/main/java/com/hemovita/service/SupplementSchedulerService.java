package com.hemovita.service;

import com.hemovita.model.enums.LabLabel;
import com.hemovita.model.enums.Slot;
import com.hemovita.model.network.BoosterBundle;
import com.hemovita.model.network.InteractionRules;
import com.hemovita.model.plan.SupplementPlan;
import com.hemovita.model.reference.AliasTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Supplement Scheduler Service
 *
 * Places supplements for low markers into the morning/midday/evening slots.
 *
 * Pass 1 (primary placement):
 *   low markers → supplement keys (deduplicated, label order); each key goes
 *   to the first slot holding none of its antagonists. When every slot
 *   conflicts the key is forced into the last slot and the event is logged.
 *
 * Pass 2 (booster co-location):
 *   for each booster bundle whose target was placed, boosters are appended
 *   to the target's slot when not already there and not in conflict.
 *   Boosters are offered whether or not they were deficient.
 */
@Service
@Slf4j
public class SupplementSchedulerService {

    private final AliasTable aliasTable;
    private final InteractionRules defaultRules;

    public SupplementSchedulerService(AliasTable aliasTable, InteractionRules defaultRules) {
        this.aliasTable = aliasTable;
        this.defaultRules = defaultRules;
    }

    /**
     * Schedules with the rules derived from the loaded interaction network.
     */
    public SupplementPlan schedule(Map<String, LabLabel> labels) {
        return schedule(labels, defaultRules);
    }

    public SupplementPlan schedule(Map<String, LabLabel> labels, InteractionRules rules) {
        SupplementPlan plan = new SupplementPlan();
        List<String> deficient = deficientKeys(labels);

        // Pass 1: primary placement
        for (String key : deficient) {
            Optional<Slot> free = Arrays.stream(Slot.values())
                .filter(slot -> canPlace(plan, rules, key, slot))
                .findFirst();
            if (free.isPresent()) {
                plan.add(free.get(), key);
            } else {
                log.warn("No conflict-free slot for {}; forcing it into the {} slot", key, Slot.last());
                plan.addForced(key);
            }
        }

        // Pass 2: co-locate boosters with their targets
        for (BoosterBundle bundle : rules.bundles()) {
            if (!deficient.contains(bundle.target())) {
                continue;
            }
            Optional<Slot> targetSlot = plan.slotOf(bundle.target());
            if (targetSlot.isEmpty()) {
                continue;
            }
            for (String booster : bundle.boosters()) {
                String key = aliasTable.keyFor(booster);
                if (plan.contains(targetSlot.get(), key)) {
                    continue;
                }
                if (canPlace(plan, rules, key, targetSlot.get())) {
                    plan.add(targetSlot.get(), key);
                }
            }
        }

        return plan;
    }

    /**
     * Supplement keys for every marker labelled low, deduplicated in label order.
     */
    public List<String> deficientKeys(Map<String, LabLabel> labels) {
        LinkedHashSet<String> keys = new LinkedHashSet<>();
        if (labels != null) {
            labels.forEach((marker, label) -> {
                if (label == LabLabel.LOW) {
                    String key = aliasTable.keyFor(marker);
                    if (!key.isEmpty()) {
                        keys.add(key);
                    }
                }
            });
        }
        return new ArrayList<>(keys);
    }

    // The rules are symmetric already; conflicts() still checks both directions.
    private boolean canPlace(SupplementPlan plan, InteractionRules rules, String key, Slot slot) {
        for (String existing : plan.keysIn(slot)) {
            if (rules.conflicts(key, existing)) {
                return false;
            }
        }
        return true;
    }
}
