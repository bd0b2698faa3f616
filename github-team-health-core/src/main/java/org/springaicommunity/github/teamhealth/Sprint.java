package org.springaicommunity.github.teamhealth;

/**
 * A sprint resolved against a point in time.
 *
 * @param number the sprint ordinal
 * @param period the sprint's dates
 * @param current whether the sprint contains the reference time it was resolved for
 */
public record Sprint(SprintNumber number, SprintPeriod period, boolean current) {
}
