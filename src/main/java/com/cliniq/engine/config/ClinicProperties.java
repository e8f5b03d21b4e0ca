package com.cliniq.engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Clinic timezones keyed by clinic id. Tenant management lives elsewhere; this is
 * the slice of it the engine needs.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "engine.clinic")
public class ClinicProperties {

    private String defaultTimezone = "UTC";

    private Map<String, String> timezones = new HashMap<>();
}
