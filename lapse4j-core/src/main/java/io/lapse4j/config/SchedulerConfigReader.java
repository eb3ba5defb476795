package io.lapse4j.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lapse4j.core.SchedulerConfig;
import io.lapse4j.core.Subject;
import io.lapse4j.core.SubjectKind;
import io.lapse4j.schedule.CronSchedule;
import io.lapse4j.schedule.IntervalSchedule;
import io.lapse4j.schedule.IntervalUnit;
import io.lapse4j.schedule.InvalidExpressionException;
import io.lapse4j.schedule.Schedule;
import io.lapse4j.schedule.ScheduleExpression;
import io.lapse4j.utils.ScheduleParser;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Binds an already loaded JSON document into a {@link SchedulerConfig}.
 *
 * <pre>{@code
 * {
 *   "subjects": [
 *     {
 *       "id": "front", "name": "Front door", "kind": "camera", "enabled": true,
 *       "schedules": [
 *         {"id": "night", "type": "cron", "hour": "22-23,0-2", "minute": "*&#47;15", "second": "0"},
 *         {"id": "day", "type": "interval", "intervalAmount": 5, "intervalUnit": "minutes",
 *          "startDate": "2026-01-01T06:00:00"}
 *       ],
 *       "settings": {"source": "http://cam/snapshot.jpg", "outputDir": "/data/front"}
 *     }
 *   ]
 * }
 * }</pre>
 *
 * A schedule may also be given as {@code "expression"} in the persisted text form. Subjects without a
 * {@code schedules} list may carry flat {@code hour}/{@code minute}/{@code second} fields, read as a
 * single cron schedule. Any invalid entry rejects the whole document.
 */
public class SchedulerConfigReader {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubjectEntry(
            String id,
            String name,
            String kind,
            Boolean enabled,
            List<ScheduleEntry> schedules,
            String hour,
            String minute,
            String second,
            Map<String, Object> settings
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScheduleEntry(
            String id,
            String type,
            Boolean enabled,
            String expression,
            String hour,
            String minute,
            String second,
            @JsonAlias("interval_amount") Long intervalAmount,
            @JsonAlias("interval_unit") String intervalUnit,
            @JsonAlias("start_date") String startDate
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(List<SubjectEntry> subjects) {
    }

    private final ObjectMapper objectMapper;
    private final ZoneId zone;
    private final Clock clock;

    public SchedulerConfigReader(ObjectMapper objectMapper, ZoneId zone, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public SchedulerConfig read(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return read(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed scheduler config: " + e.getOriginalMessage(), e);
        }
    }

    public SchedulerConfig read(JsonNode root) {
        Objects.requireNonNull(root, "root must not be null");
        Document document;
        try {
            document = objectMapper.treeToValue(root, Document.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed scheduler config: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.subjects() == null) {
            return SchedulerConfig.empty();
        }

        List<Subject> subjects = new ArrayList<>();
        for (SubjectEntry entry : document.subjects()) {
            subjects.add(toSubject(entry));
        }
        return new SchedulerConfig(subjects);
    }

    private Subject toSubject(SubjectEntry entry) {
        if (entry == null || entry.id() == null || entry.id().isBlank()) {
            throw new IllegalArgumentException("Subject id must not be empty");
        }
        Subject.Builder builder = Subject.builder(entry.id(), parseKind(entry))
                .name(entry.name())
                .enabled(entry.enabled() == null || entry.enabled());

        List<ScheduleEntry> schedules = entry.schedules();
        if (schedules == null || schedules.isEmpty()) {
            if (entry.hour() != null || entry.minute() != null) {
                builder.schedule(Schedule.enabled("schedule_0",
                        cron(entry.id(), "schedule_0", entry.hour(), entry.minute(), entry.second())));
            }
        } else {
            for (int i = 0; i < schedules.size(); i++) {
                builder.schedule(toSchedule(entry.id(), schedules.get(i), i));
            }
        }

        if (entry.settings() != null) {
            entry.settings().forEach(builder::put);
        }
        return builder.build();
    }

    private Schedule toSchedule(String subjectId, ScheduleEntry entry, int index) {
        if (entry == null) {
            throw new IllegalArgumentException("Empty schedule at index " + index + " for subject " + subjectId);
        }
        String id = (entry.id() == null || entry.id().isBlank()) ? "schedule_" + index : entry.id();
        boolean enabled = entry.enabled() == null || entry.enabled();
        return new Schedule(id, expression(subjectId, id, entry), enabled);
    }

    private ScheduleExpression expression(String subjectId, String scheduleId, ScheduleEntry entry) {
        if (entry.expression() != null) {
            return rethrowing(subjectId, scheduleId, () -> ScheduleParser.parse(entry.expression(), zone));
        }
        String type = entry.type() == null ? "cron" : entry.type().trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "cron" -> cron(subjectId, scheduleId, entry.hour(), entry.minute(), entry.second());
            case "interval" -> rethrowing(subjectId, scheduleId, () -> new IntervalSchedule(
                    entry.intervalAmount() == null ? 1 : entry.intervalAmount(),
                    entry.intervalUnit() == null ? IntervalUnit.MINUTES : IntervalUnit.parse(entry.intervalUnit()),
                    anchor(entry.startDate())
            ));
            default -> throw new InvalidExpressionException("schedule type", entry.type(),
                    "expected cron or interval (subject " + subjectId + ", schedule " + scheduleId + ")");
        };
    }

    private ScheduleExpression cron(String subjectId, String scheduleId, String hour, String minute, String second) {
        return rethrowing(subjectId, scheduleId, () -> CronSchedule.of(
                second == null ? "0" : second,
                minute == null ? "*" : minute,
                hour == null ? "*" : hour
        ));
    }

    private Instant anchor(String startDate) {
        if (startDate == null || startDate.isBlank()) {
            return Instant.now(clock);
        }
        return ScheduleParser.parseAnchor(startDate, zone);
    }

    private static SubjectKind parseKind(SubjectEntry entry) {
        if (entry.kind() == null) {
            throw new IllegalArgumentException("Subject kind must not be empty: " + entry.id());
        }
        return switch (entry.kind().trim().toLowerCase(Locale.ROOT)) {
            case "camera" -> SubjectKind.CAMERA;
            case "export" -> SubjectKind.EXPORT;
            default -> throw new IllegalArgumentException(
                    "Unknown subject kind '" + entry.kind() + "' for subject " + entry.id());
        };
    }

    private interface ExpressionSupplier {
        ScheduleExpression get();
    }

    private static ScheduleExpression rethrowing(String subjectId, String scheduleId, ExpressionSupplier supplier) {
        try {
            return supplier.get();
        } catch (InvalidExpressionException e) {
            InvalidExpressionException wrapped = new InvalidExpressionException(e.field(), e.expression(),
                    e.reason() + " (subject " + subjectId + ", schedule " + scheduleId + ")");
            wrapped.initCause(e);
            throw wrapped;
        }
    }
}
