package io.github.byzatic.jobscheduler.model;

import io.github.byzatic.jobscheduler.base_exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public enum FrequencyType {
    CRON("cron"),
    INTERVAL("interval"),
    DATE("date");

    private final String tag;

    FrequencyType(String tag) {
        this.tag = tag;
    }

    public @NotNull String tag() {
        return tag;
    }

    public static @NotNull FrequencyType fromTag(@Nullable String tag) throws ValidationException {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("frequency type is required");
        }
        for (FrequencyType type : values()) {
            if (type.tag.equalsIgnoreCase(tag.trim())) return type;
        }
        throw new ValidationException("Unsupported frequency type: " + tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
