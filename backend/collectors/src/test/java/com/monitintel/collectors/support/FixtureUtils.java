package com.monitintel.collectors.support;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public final class FixtureUtils {
    private FixtureUtils() {
    }

    public static String fixtureText(String relativePath) {
        try (InputStream in = FixtureUtils.class.getClassLoader().getResourceAsStream(relativePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + relativePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable fixture: " + relativePath, e);
        }
    }
}
