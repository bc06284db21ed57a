package com.waterwatch.engine.routing;

import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.Contact;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.shift.ClockWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Selects the contacts that should receive an alarm.
 *
 * A contact is eligible when it is enabled, belongs to the threshold's group,
 * is on call on the current weekday and the current local time falls inside
 * its daily window. The window may wrap midnight.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@Slf4j
public class ContactRouter {

    /**
     * @param zone facility time zone the contact windows are expressed in
     * @return eligible contacts, one per phone number, in roster order; empty when nobody is on call
     */
    public List<Contact> route(AlarmEvent alarm, ThresholdRule rule, List<Contact> contacts, Instant now, ZoneId zone) {
        ZonedDateTime local = now.atZone(zone);
        Set<String> seenNumbers = new HashSet<>();
        List<Contact> recipients = new ArrayList<>();

        for (Contact contact : contacts) {
            if (isEligible(contact, rule.getGroup(), local) && seenNumbers.add(contact.getMsisdn())) {
                recipients.add(contact);
            }
        }

        if (recipients.isEmpty()) {
            log.warn("No on-call contact in group '{}' for alarm {} (threshold {}) at {}",
                    rule.getGroup(), alarm.getId(), alarm.getThresholdRef(), local.toLocalDateTime());
        } else {
            log.debug("Alarm {} routed to {} contact(s)", alarm.getId(), recipients.size());
        }
        return recipients;
    }

    boolean isEligible(Contact contact, String group, ZonedDateTime local) {
        if (!contact.isEnabled()) {
            return false;
        }
        if (group == null || !group.equalsIgnoreCase(contact.getGroup())) {
            return false;
        }
        if (!contact.isEveryDay() && !contact.getDaysOfWeek().contains(local.getDayOfWeek())) {
            return false;
        }
        return ClockWindow.contains(contact.getWindowStart(), contact.getWindowEnd(), local.toLocalTime());
    }
}
