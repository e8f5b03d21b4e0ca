package com.cliniq.engine.service;

import com.cliniq.engine.domain.QueuePriority;
import com.cliniq.engine.domain.QueueStatus;
import com.cliniq.engine.entity.QueueEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueuePositionCalculatorTest {

    private static final Instant T0 = Instant.parse("2030-01-07T09:00:00Z");

    private static QueueEntry entry(long id, int token, QueuePriority priority, QueueStatus status, int minute) {
        return QueueEntry.builder()
                .id(id)
                .token(token)
                .priority(priority)
                .status(status)
                .checkedInAt(T0.plusSeconds(minute * 60L))
                .build();
    }

    @Test
    void normalEntriesFollowCheckInOrder() {
        QueueEntry a = entry(1, 1, QueuePriority.NORMAL, QueueStatus.QUEUED, 0);
        QueueEntry b = entry(2, 2, QueuePriority.NORMAL, QueueStatus.WAITING, 1);
        QueueEntry c = entry(3, 3, QueuePriority.NORMAL, QueueStatus.QUEUED, 2);
        List<QueueEntry> day = List.of(a, b, c);

        assertThat(QueuePositionCalculator.position(a, day)).isEqualTo(1);
        assertThat(QueuePositionCalculator.position(b, day)).isEqualTo(2);
        assertThat(QueuePositionCalculator.position(c, day)).isEqualTo(3);
    }

    @Test
    void higherPriorityJumpsAheadWithoutRenumbering() {
        QueueEntry a = entry(1, 1, QueuePriority.NORMAL, QueueStatus.QUEUED, 0);
        QueueEntry b = entry(2, 2, QueuePriority.EMERGENCY, QueueStatus.QUEUED, 5);
        QueueEntry c = entry(3, 3, QueuePriority.URGENT, QueueStatus.QUEUED, 6);
        List<QueueEntry> day = List.of(a, b, c);

        assertThat(QueuePositionCalculator.position(b, day)).isEqualTo(1);
        assertThat(QueuePositionCalculator.position(c, day)).isEqualTo(2);
        assertThat(QueuePositionCalculator.position(a, day)).isEqualTo(3);
        assertThat(a.getToken()).isEqualTo(1);
    }

    @Test
    void closedAndCalledEntriesDoNotCount() {
        QueueEntry done = entry(1, 1, QueuePriority.NORMAL, QueueStatus.COMPLETED, 0);
        QueueEntry inRoom = entry(2, 2, QueuePriority.NORMAL, QueueStatus.WITH_DOCTOR, 1);
        QueueEntry waiting = entry(3, 3, QueuePriority.NORMAL, QueueStatus.WAITING, 2);
        List<QueueEntry> day = List.of(done, inRoom, waiting);

        assertThat(QueuePositionCalculator.position(waiting, day)).isEqualTo(1);
        assertThat(QueuePositionCalculator.position(inRoom, day)).isZero();
        assertThat(QueuePositionCalculator.position(done, day)).isZero();
    }

    @Test
    void waitIsPeopleAheadTimesDuration() {
        QueueEntry waiting = entry(3, 3, QueuePriority.NORMAL, QueueStatus.WAITING, 2);
        QueueEntry inRoom = entry(2, 2, QueuePriority.NORMAL, QueueStatus.WITH_DOCTOR, 1);

        assertThat(QueuePositionCalculator.estimatedWaitMinutes(waiting, 3, 15)).isEqualTo(45);
        assertThat(QueuePositionCalculator.estimatedWaitMinutes(waiting, 3, null)).isNull();
        assertThat(QueuePositionCalculator.estimatedWaitMinutes(inRoom, 0, null)).isZero();
        assertThat(QueuePositionCalculator.peopleAhead(0)).isZero();
        assertThat(QueuePositionCalculator.peopleAhead(4)).isEqualTo(3);
    }

    @Test
    void displayOrderPutsDoctorFirstAndClosedLast() {
        QueueEntry done = entry(1, 1, QueuePriority.NORMAL, QueueStatus.COMPLETED, 0);
        QueueEntry normal = entry(2, 2, QueuePriority.NORMAL, QueueStatus.QUEUED, 1);
        QueueEntry urgent = entry(3, 3, QueuePriority.URGENT, QueueStatus.QUEUED, 2);
        QueueEntry inRoom = entry(4, 4, QueuePriority.NORMAL, QueueStatus.WITH_DOCTOR, 3);

        assertThat(QueuePositionCalculator.displayOrder(List.of(done, normal, urgent, inRoom)))
                .extracting(QueueEntry::getToken)
                .containsExactly(4, 3, 2, 1);
    }
}
