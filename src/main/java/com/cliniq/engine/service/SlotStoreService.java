package com.cliniq.engine.service;

import com.cliniq.engine.dto.ClearSlotsResult;
import com.cliniq.engine.dto.SlotStatusSummary;
import com.cliniq.engine.dto.SlotView;
import com.cliniq.engine.entity.Appointment;
import com.cliniq.engine.entity.AppointmentSlot;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.exception.AlreadyBookedException;
import com.cliniq.engine.exception.NotFoundException;
import com.cliniq.engine.exception.StateException;
import com.cliniq.engine.exception.ValidationException;
import com.cliniq.engine.repository.AppointmentRepository;
import com.cliniq.engine.repository.AppointmentSlotRepository;
import com.cliniq.engine.repository.DoctorRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

/**
 * Persisted slots and their AVAILABLE/BOOKED status.
 * <p>
 * Lock order everywhere: doctor row, then appointment row, then slot row.
 */
@Service
@RequiredArgsConstructor
public class SlotStoreService {

    private static final Logger log = LoggerFactory.getLogger(SlotStoreService.class);

    private final DoctorRepository doctorRepository;
    private final AppointmentSlotRepository slotRepository;
    private final AppointmentRepository appointmentRepository;

    /**
     * AVAILABLE -> BOOKED. The first committer wins; later callers get {@link AlreadyBookedException}.
     */
    @Transactional
    public AppointmentSlot reserve(Long slotId) {
        lockDoctorOfSlot(slotId);
        AppointmentSlot slot = slotRepository.findByIdForUpdate(slotId)
                .orElseThrow(() -> NotFoundException.of("Slot", slotId));
        if (slot.getStatus() != AppointmentSlot.Status.AVAILABLE) {
            log.warn("Reservation lost: slot {} is {}", slotId, slot.getStatus());
            throw new AlreadyBookedException(slotId);
        }
        slot.setStatus(AppointmentSlot.Status.BOOKED);
        slotRepository.save(slot);
        log.info("Reserved slot {} ({} {})", slotId, slot.getSlotDate(), slot.getStartTime());
        return slot;
    }

    /**
     * BOOKED -> AVAILABLE, no-op when already AVAILABLE. Refuses while a live appointment holds the slot.
     */
    @Transactional
    public AppointmentSlot release(Long slotId) {
        lockDoctorOfSlot(slotId);
        AppointmentSlot slot = slotRepository.findByIdForUpdate(slotId)
                .orElseThrow(() -> NotFoundException.of("Slot", slotId));
        if (slot.getStatus() == AppointmentSlot.Status.AVAILABLE) {
            return slot;
        }
        appointmentRepository.findFirstBySlotIdAndStatusIn(slotId,
                        EnumSet.of(Appointment.Status.BOOKED, Appointment.Status.CHECKED_IN))
                .ifPresent(a -> {
                    throw new StateException("Slot " + slotId + " is held by appointment " + a.getId()
                            + "; cancel the appointment instead");
                });
        slot.setStatus(AppointmentSlot.Status.AVAILABLE);
        slotRepository.save(slot);
        log.info("Released slot {}", slotId);
        return slot;
    }

    /**
     * Deletes AVAILABLE slots dated at or after {@code fromDate}. BOOKED slots stay.
     */
    @Transactional
    public ClearSlotsResult clearAvailable(Long doctorId, LocalDate fromDate) {
        if (fromDate == null) {
            throw new ValidationException("from date is required");
        }
        doctorRepository.findByIdForUpdate(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        int deleted = slotRepository.deleteByStatusFrom(doctorId, AppointmentSlot.Status.AVAILABLE, fromDate);
        log.info("Cleared {} available slots for doctor {} from {}", deleted, doctorId, fromDate);
        return new ClearSlotsResult(deleted);
    }

    @Transactional(readOnly = true)
    public SlotStatusSummary statusSummary(Long doctorId) {
        Doctor doctor = doctorRepository.findById(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
        long available = slotRepository.countByDoctorIdAndStatus(doctorId, AppointmentSlot.Status.AVAILABLE);
        long booked = slotRepository.countByDoctorIdAndStatus(doctorId, AppointmentSlot.Status.BOOKED);
        return new SlotStatusSummary(available + booked, available, booked,
                doctor.getSlotsGeneratedFrom(), doctor.getSlotsGeneratedTo());
    }

    @Transactional(readOnly = true)
    public List<SlotView> listSlots(Long doctorId, LocalDate date) {
        if (date == null) {
            throw new ValidationException("date is required");
        }
        if (!doctorRepository.existsById(doctorId)) {
            throw NotFoundException.of("Doctor", doctorId);
        }
        return slotRepository.findByDoctorIdAndSlotDateOrderByStartTimeAsc(doctorId, date).stream()
                .map(SlotView::from)
                .toList();
    }

    private void lockDoctorOfSlot(Long slotId) {
        Long doctorId = slotRepository.findDoctorIdById(slotId)
                .orElseThrow(() -> NotFoundException.of("Slot", slotId));
        doctorRepository.findByIdForShare(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));
    }
}
