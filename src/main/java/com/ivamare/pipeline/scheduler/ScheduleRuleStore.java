package com.ivamare.pipeline.scheduler;

import java.time.Instant;
import java.util.List;

/**
 * Storage of schedule rules and their next fire times.
 *
 * <p>A store shared by several scheduler instances must make {@link #claim} atomic, so
 * each due fire is won by exactly one instance.
 */
public interface ScheduleRuleStore {

    /**
     * Store a new rule.
     *
     * @param rule the rule
     * @param nextFire its first fire time
     * @return false if a rule of that name already exists
     */
    boolean insert(ScheduleRule rule, Instant nextFire);

    /**
     * Store a rule, replacing any rule of the same name. The stored next fire time is
     * kept when the schedule expression is unchanged.
     *
     * @param rule the rule
     * @param nextFire fire time used when the rule is new or its schedule changed
     */
    void save(ScheduleRule rule, Instant nextFire);

    /**
     * @return true if a rule was deleted
     */
    boolean delete(String name);

    boolean contains(String name);

    /**
     * @return all rules, ordered by name
     */
    List<StoredRule> findAll();

    /**
     * @return rules whose next fire time is at or before {@code now}, earliest first
     */
    List<StoredRule> findDue(Instant now);

    /**
     * Move a due rule to its next fire time.
     *
     * @param name rule name
     * @param now the tick time
     * @param nextFire the new next fire time
     * @return true if this caller claimed the fire, false if the rule is gone or no longer due
     */
    boolean claim(String name, Instant now, Instant nextFire);
}
