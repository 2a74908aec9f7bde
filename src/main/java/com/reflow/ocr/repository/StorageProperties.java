package com.reflow.ocr.repository;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.storage")
public record StorageProperties(
    @NotNull Path dataDir,
    @NotNull @DefaultValue("30s") Duration autosaveInterval
) {

    public static final Duration MIN_AUTOSAVE_INTERVAL = Duration.ofSeconds(5);

    public Path sessionsDir() {
        return dataDir.resolve("sessions");
    }

    /**
     * Configured interval, raised to {@link #MIN_AUTOSAVE_INTERVAL} when set lower.
     */
    public Duration effectiveAutosaveInterval() {
        return autosaveInterval.compareTo(MIN_AUTOSAVE_INTERVAL) < 0 ? MIN_AUTOSAVE_INTERVAL : autosaveInterval;
    }
}
