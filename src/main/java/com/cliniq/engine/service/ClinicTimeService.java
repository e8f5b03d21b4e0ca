package com.cliniq.engine.service;

import com.cliniq.engine.config.ClinicProperties;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.exception.ConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Clinic-local calendar. Every "today" and "now" in the engine goes through here so
 * dates never drift to UTC.
 */
@Service
public class ClinicTimeService {

    private final Clock clock;
    private final ClinicProperties properties;

    public ClinicTimeService(Clock clock, ClinicProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    public ZoneId zoneFor(String clinicId) {
        String zone = properties.getTimezones().get(clinicId);
        if (StringUtils.isBlank(zone)) {
            zone = properties.getDefaultTimezone();
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid timezone '" + zone + "' for clinic " + clinicId);
        }
    }

    public LocalDate today(Doctor doctor) {
        return LocalDate.now(clock.withZone(zoneFor(doctor.getClinicId())));
    }

    public LocalTime timeOfDay(Doctor doctor) {
        return LocalTime.now(clock.withZone(zoneFor(doctor.getClinicId())));
    }

    public Instant now() {
        return clock.instant();
    }
}
