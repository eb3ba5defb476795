package io.lapse4j.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Selects a subset of a timestamped image sequence.
 *
 * <ol>
 *   <li>Drop items whose date is outside the filter's {@link DateSpan}.</li>
 *   <li>Generate slots: every hour x minute of the masks, on every remaining date.</li>
 *   <li>Match items to slots, exactly or by nearest timestamp (see {@link FilterMode}).</li>
 * </ol>
 * The result is always in timestamp order; items with equal timestamps keep their input order.
 */
public final class TimeFilter {
    private static final Logger log = LoggerFactory.getLogger(TimeFilter.class);

    private TimeFilter() {
    }

    public static <T> List<T> select(List<TimedItem<T>> items, TimeFilterSpec spec) {
        return selectItems(items, spec).stream()
                .map(TimedItem::payload)
                .collect(Collectors.toList());
    }

    /**
     * Same as {@link #select(List, TimeFilterSpec)} but keeps the timestamps.
     */
    public static <T> List<TimedItem<T>> selectItems(List<TimedItem<T>> items, TimeFilterSpec spec) {
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        if (items.isEmpty()) {
            return List.of();
        }

        List<TimedItem<T>> candidates = items.stream()
                .filter(item -> spec.span().contains(item.timestamp().toLocalDate()))
                .sorted(Comparator.comparing(TimedItem::timestamp))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            log.debug("time filter span={} matched no dates among {} items", spec.span(), items.size());
            return List.of();
        }

        Set<LocalDate> dates = candidates.stream()
                .map(item -> item.timestamp().toLocalDate())
                .collect(Collectors.toSet());
        List<LocalDateTime> slots = slots(dates, spec);

        List<TimedItem<T>> selected = switch (spec.mode()) {
            case EXACT -> matchExact(candidates, slots);
            case NEAREST -> matchNearest(candidates, slots, spec.searchWindow());
        };

        log.debug("time filter mode={} span={} hours={} minutes={} items={} slots={} selected={}",
                spec.mode(), spec.span(), spec.hours(), spec.minutes(), candidates.size(), slots.size(), selected.size());
        return selected;
    }

    /**
     * Target instants for the given dates, in ascending order.
     */
    public static List<LocalDateTime> slots(Collection<LocalDate> dates, TimeFilterSpec spec) {
        List<Integer> hours = spec.hours().values();
        List<Integer> minutes = spec.minutes().values();
        List<LocalDateTime> slots = new ArrayList<>();
        for (LocalDate date : new TreeSet<>(dates)) {
            for (int h : hours) {
                for (int m : minutes) {
                    slots.add(date.atTime(h, m));
                }
            }
        }
        return slots;
    }

    private static <T> List<TimedItem<T>> matchExact(List<TimedItem<T>> candidates, List<LocalDateTime> slots) {
        Set<LocalDateTime> slotSet = new HashSet<>(slots);
        return candidates.stream()
                .filter(item -> slotSet.contains(item.timestamp().truncatedTo(ChronoUnit.MINUTES)))
                .collect(Collectors.toList());
    }

    private static <T> List<TimedItem<T>> matchNearest(List<TimedItem<T>> candidates,
                                                       List<LocalDateTime> slots,
                                                       Duration window) {
        // an item nearest to several slots is emitted once
        boolean[] taken = new boolean[candidates.size()];
        for (int s = 0; s < slots.size(); s++) {
            LocalDateTime slot = slots.get(s);
            int idx = lowerBound(candidates, slot);

            int best = -1;
            Duration bestDistance = null;
            if (idx > 0) {
                best = firstOfGroup(candidates, idx - 1);
                bestDistance = Duration.between(candidates.get(best).timestamp(), slot);
            }
            if (idx < candidates.size()) {
                Duration d = Duration.between(slot, candidates.get(idx).timestamp());
                // strict: on a tie the earlier item wins
                if (best < 0 || d.compareTo(bestDistance) < 0) {
                    best = idx;
                    bestDistance = d;
                }
            }

            if (best >= 0 && bestDistance.compareTo(window) <= 0) {
                taken[best] = true;
            }
        }

        List<TimedItem<T>> selected = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            if (taken[i]) {
                selected.add(candidates.get(i));
            }
        }
        return selected;
    }

    // first index whose timestamp is >= target
    private static <T> int lowerBound(List<TimedItem<T>> sorted, LocalDateTime target) {
        int lo = 0;
        int hi = sorted.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted.get(mid).timestamp().isBefore(target)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static <T> int firstOfGroup(List<TimedItem<T>> sorted, int i) {
        LocalDateTime ts = sorted.get(i).timestamp();
        while (i > 0 && sorted.get(i - 1).timestamp().equals(ts)) {
            i--;
        }
        return i;
    }
}
