package com.waterwatch.engine.web;

import com.waterwatch.engine.model.TimeWindow;
import com.waterwatch.engine.shift.ShiftCalculator;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shift schedule for the dashboard header.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@RestController
@RequestMapping("/api/shifts")
public class ShiftController {

    private final ShiftCalculator shiftCalculator;
    private final Clock clock;

    public ShiftController(ShiftCalculator shiftCalculator, Clock clock) {
        this.shiftCalculator = shiftCalculator;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<?> getShifts(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Instant now = clock.instant();
        LocalDate day = date != null ? date : shiftCalculator.shiftWindow(now).getCalendarDay();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timezone", shiftCalculator.getZone().getId());
        response.put("current", describe(shiftCalculator.shiftWindow(now)));
        response.put("previous", describe(shiftCalculator.previousShiftWindow(now)));
        response.put("day", describe(shiftCalculator.dayWindow(now)));
        response.put("date", day.toString());
        response.put("shifts", shiftCalculator.shiftsOfDay(day).stream().map(this::describe).toList());
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> describe(TimeWindow window) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", window.getName());
        view.put("start", window.getStart().toOffsetDateTime().toString());
        view.put("end", window.getEnd().toOffsetDateTime().toString());
        view.put("range", window.formatRange());
        return view;
    }
}
