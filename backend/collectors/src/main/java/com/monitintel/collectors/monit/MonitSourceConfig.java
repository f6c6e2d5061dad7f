package com.monitintel.collectors.monit;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

public record MonitSourceConfig(String url, String username, String password) {
    public MonitSourceConfig {
        Objects.requireNonNull(url, "url is required");
    }

    public Optional<String> basicAuthorization() {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        String token = username + ":" + (password == null ? "" : password);
        return Optional.of("Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public String toString() {
        return "MonitSourceConfig[url=" + url + ", username=" + username + ", password=" + (password == null ? "null" : "****") + "]";
    }
}
