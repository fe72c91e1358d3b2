package com.ivamare.pipeline.scheduler.impl;

import com.ivamare.pipeline.scheduler.ScheduleRule;
import com.ivamare.pipeline.scheduler.ScheduleRuleStore;
import com.ivamare.pipeline.scheduler.StoredRule;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local rule store. Rules are lost on restart.
 */
public class InMemoryScheduleRuleStore implements ScheduleRuleStore {

    private final Map<String, StoredRule> rules = new ConcurrentHashMap<>();

    @Override
    public boolean insert(ScheduleRule rule, Instant nextFire) {
        return rules.putIfAbsent(rule.name(), new StoredRule(rule, nextFire)) == null;
    }

    @Override
    public void save(ScheduleRule rule, Instant nextFire) {
        rules.merge(rule.name(), new StoredRule(rule, nextFire), (stored, fresh) ->
            stored.rule().schedule().expression().equals(rule.schedule().expression())
                ? new StoredRule(rule, stored.nextFire())
                : fresh);
    }

    @Override
    public boolean delete(String name) {
        return rules.remove(name) != null;
    }

    @Override
    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    @Override
    public List<StoredRule> findAll() {
        return rules.values().stream()
            .sorted(Comparator.comparing(StoredRule::name))
            .toList();
    }

    @Override
    public List<StoredRule> findDue(Instant now) {
        return rules.values().stream()
            .filter(stored -> stored.isDue(now))
            .sorted(Comparator.comparing(StoredRule::nextFire).thenComparing(StoredRule::name))
            .toList();
    }

    @Override
    public boolean claim(String name, Instant now, Instant nextFire) {
        StoredRule stored = rules.get(name);
        if (stored == null || !stored.isDue(now)) {
            return false;
        }
        return rules.replace(name, stored, new StoredRule(stored.rule(), nextFire));
    }
}
