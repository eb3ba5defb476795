package io.lapse4j.core;

import io.lapse4j.schedule.Schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Something the scheduler triggers jobs for: a camera (capture) or an export definition.
 *
 * <p>{@code settings} is free-form; the job factory registered for {@code kind} converts it into its
 * own typed settings object.
 */
public record Subject(
        String id,
        String name,
        SubjectKind kind,
        boolean enabled,
        List<Schedule> schedules,
        Map<String, Object> settings
) {

    public Subject {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        name = (name == null || name.isBlank()) ? id : name;
        schedules = schedules == null ? List.of() : List.copyOf(schedules);
        settings = (settings == null || settings.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(settings));

        Set<String> scheduleIds = new HashSet<>();
        for (Schedule schedule : schedules) {
            if (!scheduleIds.add(schedule.id())) {
                throw new IllegalArgumentException("Duplicate schedule id " + schedule.id() + " for subject " + id);
            }
        }
    }

    public static Builder builder(String id, SubjectKind kind) {
        return new Builder(id, kind);
    }

    public static final class Builder {
        private final String id;
        private final SubjectKind kind;
        private String name;
        private boolean enabled = true;
        private final List<Schedule> schedules = new ArrayList<>();
        private final Map<String, Object> settings = new LinkedHashMap<>();

        private Builder(String id, SubjectKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder schedule(Schedule schedule) {
            this.schedules.add(Objects.requireNonNull(schedule, "schedule must not be null"));
            return this;
        }

        /**
         * Add a single setting (e.g. key="outputDir", value="/data/cam1").
         */
        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            if (key.isBlank()) {
                throw new IllegalArgumentException("key must not be blank");
            }
            if (value == null) {
                return this;
            }
            this.settings.put(key, value);
            return this;
        }

        public Subject build() {
            return new Subject(id, name, kind, enabled, schedules, settings);
        }
    }
}
