package com.maxdemarzi.minilogic;

import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.Validate;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

public class Settings {
    public static final String RESOURCE = "/minilogic.properties";

    public static final String PRINT_SEPARATOR = "minilogic.print.separator";
    public static final String INLINE_FUNCTIONS = "minilogic.show.inline-functions";
    public static final String MAX_CALL_DEPTH = "minilogic.max-call-depth";

    private final String printSeparator;
    private final boolean inlineFunctions;
    private final int maxCallDepth;

    public Settings(String printSeparator, boolean inlineFunctions, int maxCallDepth) {
        Validate.notNull(printSeparator, "printSeparator");
        Validate.isTrue(maxCallDepth > 0, "%s must be positive, got %d", MAX_CALL_DEPTH, maxCallDepth);
        this.printSeparator = printSeparator;
        this.inlineFunctions = inlineFunctions;
        this.maxCallDepth = maxCallDepth;
    }

    public static Settings defaults() {
        Properties properties = new Properties();
        try (InputStream in = Settings.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        return from(properties);
    }

    // Keys missing from the given properties keep their built-in value
    public static Settings from(Properties properties) {
        String separator = properties.getProperty(PRINT_SEPARATOR, " ");
        boolean inline = BooleanUtils.toBoolean(properties.getProperty(INLINE_FUNCTIONS, "false"));
        String depth = properties.getProperty(MAX_CALL_DEPTH, "1000").trim();
        int maxCallDepth;
        try {
            maxCallDepth = Integer.parseInt(depth);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(MAX_CALL_DEPTH + " is not a number: " + depth, e);
        }
        return new Settings(separator, inline, maxCallDepth);
    }

    public Settings withInlineFunctions(boolean inline) {
        return new Settings(printSeparator, inline, maxCallDepth);
    }

    public String getPrintSeparator() {
        return printSeparator;
    }

    public boolean isInlineFunctions() {
        return inlineFunctions;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }
}
