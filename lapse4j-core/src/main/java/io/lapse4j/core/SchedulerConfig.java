package io.lapse4j.core;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The complete set of subjects the scheduler evaluates. Immutable; reloading swaps the whole value.
 */
public record SchedulerConfig(List<Subject> subjects) {

    private static final SchedulerConfig EMPTY = new SchedulerConfig(List.of());

    public SchedulerConfig {
        Objects.requireNonNull(subjects, "subjects must not be null");
        subjects = List.copyOf(subjects);
        Set<String> ids = new HashSet<>();
        for (Subject subject : subjects) {
            if (!ids.add(subject.id())) {
                throw new IllegalArgumentException("Duplicate subject id: " + subject.id());
            }
        }
    }

    public static SchedulerConfig empty() {
        return EMPTY;
    }

    public Optional<Subject> find(String subjectId) {
        return subjects.stream()
                .filter(s -> s.id().equals(subjectId))
                .findFirst();
    }
}
