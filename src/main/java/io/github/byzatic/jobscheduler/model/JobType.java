package io.github.byzatic.jobscheduler.model;

import io.github.byzatic.jobscheduler.base_exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Closed set of job types. The tag is the external name used by stores and callers.
 */
public enum JobType {
    EMAIL_NOTIFICATION("email_notification"),
    DATA_BACKUP("data_backup"),
    REPORT_GENERATION("report_generation"),
    API_CALL("api_call"),
    FILE_CLEANUP("file_cleanup"),
    CUSTOM("custom");

    private final String tag;

    JobType(String tag) {
        this.tag = tag;
    }

    public @NotNull String tag() {
        return tag;
    }

    public static @NotNull JobType fromTag(@Nullable String tag) throws ValidationException {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("job_type is required");
        }
        for (JobType type : values()) {
            if (type.tag.equalsIgnoreCase(tag.trim())) return type;
        }
        throw new ValidationException("Unknown job type: " + tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
