package com.waterwatch.engine.alarm;

import com.waterwatch.engine.model.AlarmEvent;
import lombok.Value;

/**
 * What an evaluation did to the alarm state of its threshold.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Value
public class AlarmTransition {

    public enum Type {
        /** A new alarm was opened and should be notified */
        OPENED,
        /** The threshold already has an open alarm for this window */
        STILL_OPEN,
        /** The open alarm was closed */
        CLOSED,
        /** Violated, but the threshold closed too recently to re-open */
        SUPPRESSED_COOLDOWN,
        /** Nothing changed */
        NONE,
        /** The record store refused the change; nothing was confirmed */
        STORAGE_FAILED
    }

    Type type;

    /**
     * Alarm opened by this transition, or the alarm that stays open
     */
    AlarmEvent opened;

    /**
     * Alarm closed by this transition, set on CLOSED and when a new window replaces an open alarm
     */
    AlarmEvent closed;

    String detail;

    public static AlarmTransition none() {
        return new AlarmTransition(Type.NONE, null, null, null);
    }

    public boolean isOpened() {
        return type == Type.OPENED;
    }
}
