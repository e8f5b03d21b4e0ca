package com.cliniq.engine.service;

import com.cliniq.engine.entity.QueueEntry;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Position arithmetic over one doctor's queue day. Callers pass every entry of that day.
 */
public final class QueuePositionCalculator {

    /** Priority rank descending, then check-in time, then token. */
    public static final Comparator<QueueEntry> EFFECTIVE_ORDER =
            Comparator.comparingInt((QueueEntry e) -> e.getPriority().rank()).reversed()
                    .thenComparing(QueueEntry::getCheckedInAt)
                    .thenComparingInt(QueueEntry::getToken);

    private QueuePositionCalculator() {
    }

    /** 1-based among waiting entries; 0 once the entry is with the doctor or closed. */
    public static int position(QueueEntry target, Collection<QueueEntry> sameDay) {
        if (!target.getStatus().isWaiting()) {
            return 0;
        }
        long ahead = sameDay.stream()
                .filter(e -> e.getStatus().isWaiting())
                .filter(e -> !e.getId().equals(target.getId()))
                .filter(e -> EFFECTIVE_ORDER.compare(e, target) < 0)
                .count();
        return (int) ahead + 1;
    }

    public static int peopleAhead(int position) {
        return position > 0 ? position - 1 : 0;
    }

    /** Flat {@code peopleAhead x duration}; null while the duration is unknown. */
    public static Integer estimatedWaitMinutes(QueueEntry target, int peopleAhead, Integer durationMin) {
        if (!target.getStatus().isWaiting()) {
            return 0;
        }
        return durationMin == null ? null : peopleAhead * durationMin;
    }

    /**
     * Display order: the entry with the doctor, then waiting entries in effective
     * order, then closed entries by token.
     */
    public static List<QueueEntry> displayOrder(Collection<QueueEntry> sameDay) {
        Comparator<QueueEntry> byGroup = Comparator.comparingInt(QueuePositionCalculator::group);
        return sameDay.stream()
                .sorted(byGroup.thenComparing((a, b) -> group(a) == 1
                        ? EFFECTIVE_ORDER.compare(a, b)
                        : Integer.compare(a.getToken(), b.getToken())))
                .toList();
    }

    private static int group(QueueEntry e) {
        return switch (e.getStatus()) {
            case WITH_DOCTOR -> 0;
            case QUEUED, WAITING -> 1;
            default -> 2;
        };
    }
}
