package io.lapse4j.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lapse4j.JobBody;
import io.lapse4j.JobFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

public class JobFactoryRegistry {

    /**
     * A job ready to submit for a subject.
     */
    public record PreparedJob(JobKind kind, String name, JobBody body) {
    }

    private final Map<SubjectKind, JobFactory<?>> factoriesByKind;
    private final ObjectMapper objectMapper;

    public JobFactoryRegistry(List<JobFactory<?>> factories, ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.factoriesByKind = factories.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobFactory::subjectKind,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobFactory for subject kind: " + a.subjectKind());
                        }
                ));
    }

    public JobFactory<?> getRequired(SubjectKind kind) {
        JobFactory<?> factory = factoriesByKind.get(kind);
        if (factory == null) {
            throw new IllegalStateException("No JobFactory registered for subject kind: " + kind);
        }
        return factory;
    }

    public boolean supports(SubjectKind kind) {
        return factoriesByKind.containsKey(kind);
    }

    /**
     * Convert the subject's settings and create its job body.
     *
     * @throws IllegalArgumentException if the settings do not fit the factory's settings class
     */
    public PreparedJob prepare(Subject subject) {
        JobFactory<?> factory = getRequired(subject.kind());
        return new PreparedJob(factory.jobKind(), jobName(factory.jobKind(), subject), create(factory, subject));
    }

    /**
     * Check that a subject's settings convert, without creating a job.
     */
    public void validate(Subject subject) {
        JobFactory<?> factory = getRequired(subject.kind());
        convert(factory, subject);
    }

    private <T> JobBody create(JobFactory<T> factory, Subject subject) {
        return factory.create(subject.id(), convert(factory, subject));
    }

    private <T> T convert(JobFactory<T> factory, Subject subject) {
        try {
            return objectMapper.convertValue(subject.settings(), factory.settingsClass());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid settings for subject " + subject.id() + ": " + ex.getMessage(), ex);
        }
    }

    private static String jobName(JobKind kind, Subject subject) {
        return switch (kind) {
            case CAPTURE -> "Capture " + subject.name();
            case EXPORT -> "Export " + subject.name();
            case RENDER -> "Render " + subject.name();
        };
    }
}
