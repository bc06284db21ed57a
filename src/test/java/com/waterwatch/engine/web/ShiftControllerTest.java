package com.waterwatch.engine.web;

import com.waterwatch.engine.shift.ShiftCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for {@link ShiftController}.
 */
class ShiftControllerTest {

    // 2024-03-12 09:00 in Auckland (NZDT, +13:00)
    private static final Instant NOW = Instant.parse("2024-03-11T20:00:00Z");

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ShiftCalculator calculator = ShiftCalculator.standard(ZoneId.of("Pacific/Auckland"));
        ShiftController controller = new ShiftController(calculator, Clock.fixed(NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    @DisplayName("Should describe the current, previous and day windows")
    void currentShifts() throws Exception {
        mockMvc.perform(get("/api/shifts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timezone").value("Pacific/Auckland"))
                .andExpect(jsonPath("$.current.name").value("Day Shift"))
                .andExpect(jsonPath("$.current.range").value("2024-03-12 07:00 - 15:00"))
                .andExpect(jsonPath("$.previous.name").value("Night Shift"))
                .andExpect(jsonPath("$.date").value("2024-03-12"))
                .andExpect(jsonPath("$.shifts.length()").value(3));
    }

    @Test
    @DisplayName("Should list the shifts of a requested date")
    void shiftsForDate() throws Exception {
        mockMvc.perform(get("/api/shifts").param("date", "2024-03-14"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2024-03-14"))
                .andExpect(jsonPath("$.shifts[2].range").value("2024-03-14 23:00 - 2024-03-15 07:00"));
    }
}
