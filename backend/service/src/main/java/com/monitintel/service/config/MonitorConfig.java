package com.monitintel.service.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.monitintel.collectors.monit.MonitSourceConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bound from {@code config/monitor.json}. Absent fields take their defaults; credentials and
 * endpoints can be overridden from the environment.
 */
public record MonitorConfig(
        String monitUrl,
        String monitUser,
        String monitPassword,
        Duration pollInterval,
        Duration requestTimeout,
        Integer retentionDays,
        Duration journalTimeout,
        Duration fetchTimeout,
        String databaseUrl,
        List<String> logRoots,
        Boolean journalFallback,
        String analysisUrl,
        Integer apiPort,
        String truststorePath,
        String truststorePassword
) {
    public static final String DEFAULT_MONIT_URL = "http://localhost:2812/_status?format=xml";

    public MonitorConfig {
        monitUrl = blankToNull(monitUrl) == null ? DEFAULT_MONIT_URL : monitUrl;
        pollInterval = pollInterval == null ? Duration.ofMinutes(5) : pollInterval;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
        retentionDays = retentionDays == null ? 30 : retentionDays;
        journalTimeout = journalTimeout == null ? Duration.ofSeconds(10) : journalTimeout;
        fetchTimeout = fetchTimeout == null ? Duration.ofSeconds(15) : fetchTimeout;
        databaseUrl = blankToNull(databaseUrl) == null ? "jdbc:h2:./state/monit-history" : databaseUrl;
        logRoots = logRoots == null ? List.of() : List.copyOf(logRoots);
        journalFallback = journalFallback == null ? Boolean.TRUE : journalFallback;
        analysisUrl = blankToNull(analysisUrl);
        apiPort = apiPort == null ? 8080 : apiPort;
        truststorePath = blankToNull(truststorePath);

        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be positive: " + retentionDays);
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        if (apiPort < 0 || apiPort > 65_535) {
            throw new IllegalArgumentException("apiPort out of range: " + apiPort);
        }
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Applies {@code MONIT_URL}, {@code MONIT_USER}, {@code MONIT_PASS}, {@code ANALYSIS_URL},
     * {@code MONIT_TRUSTSTORE_PATH} and {@code MONIT_TRUSTSTORE_PASSWORD}.
     */
    public MonitorConfig withEnvironment(Map<String, String> environment) {
        return new MonitorConfig(
                override(environment, "MONIT_URL", monitUrl),
                override(environment, "MONIT_USER", monitUser),
                override(environment, "MONIT_PASS", monitPassword),
                pollInterval,
                requestTimeout,
                retentionDays,
                journalTimeout,
                fetchTimeout,
                databaseUrl,
                logRoots,
                journalFallback,
                override(environment, "ANALYSIS_URL", analysisUrl),
                apiPort,
                override(environment, "MONIT_TRUSTSTORE_PATH", truststorePath),
                override(environment, "MONIT_TRUSTSTORE_PASSWORD", truststorePassword)
        );
    }

    @JsonIgnore
    public MonitSourceConfig monitSource() {
        return new MonitSourceConfig(monitUrl, monitUser, monitPassword);
    }

    @JsonIgnore
    public List<Path> logRootPaths() {
        return logRoots.stream().map(Path::of).toList();
    }

    /**
     * Keystore holding the certificates outbound TLS should trust instead of the JDK defaults,
     * usually the self-signed certificate of the Monit web interface.
     */
    @JsonIgnore
    public Optional<Path> truststore() {
        return Optional.ofNullable(truststorePath).map(Path::of);
    }

    @JsonIgnore
    public boolean apiEnabled() {
        return apiPort != 0;
    }

    /**
     * Same settings with the password masked, for logging and the diagnostics view.
     */
    public Map<String, Object> redacted() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("monitUrl", monitUrl);
        view.put("monitUser", monitUser);
        view.put("monitPassword", monitPassword == null ? null : "****");
        view.put("pollInterval", pollInterval.toString());
        view.put("requestTimeout", requestTimeout.toString());
        view.put("retentionDays", retentionDays);
        view.put("journalTimeout", journalTimeout.toString());
        view.put("fetchTimeout", fetchTimeout.toString());
        view.put("databaseUrl", databaseUrl);
        view.put("logRoots", logRoots);
        view.put("journalFallback", journalFallback);
        view.put("analysisUrl", analysisUrl);
        view.put("apiPort", apiPort);
        view.put("truststorePath", truststorePath);
        view.put("truststorePassword", truststorePassword == null ? null : "****");
        return view;
    }

    @Override
    public String toString() {
        return "MonitorConfig" + redacted();
    }

    private static String override(Map<String, String> environment, String key, String current) {
        String value = blankToNull(environment.get(key));
        return value == null ? current : value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
