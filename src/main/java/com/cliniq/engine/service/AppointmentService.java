package com.cliniq.engine.service;

import com.cliniq.engine.entity.Appointment;
import com.cliniq.engine.entity.AppointmentSlot;
import com.cliniq.engine.exception.NotFoundException;
import com.cliniq.engine.exception.StateException;
import com.cliniq.engine.exception.ValidationException;
import com.cliniq.engine.repository.AppointmentRepository;
import com.cliniq.engine.repository.DoctorRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    private final DoctorRepository doctorRepository;
    private final AppointmentRepository appointmentRepository;
    private final SlotStoreService slotStore;

    // =========================================================
    // BOOK (CONCURRENCY SAFE)
    // =========================================================
    @Transactional
    public Appointment book(Long slotId, String patientRef) {
        if (slotId == null) {
            throw new ValidationException("slotId is required");
        }
        if (StringUtils.isBlank(patientRef)) {
            throw new ValidationException("patientRef is required");
        }

        AppointmentSlot slot = slotStore.reserve(slotId);

        Appointment appointment = Appointment.builder()
                .doctor(slot.getDoctor())
                .slot(slot)
                .patientRef(patientRef.trim())
                .appointmentDate(slot.getSlotDate())
                .startTime(slot.getStartTime())
                .endTime(slot.getEndTime())
                .status(Appointment.Status.BOOKED)
                .build();
        appointment = appointmentRepository.save(appointment);

        log.info("Booked appointment {}: slot={} patient={} date={} time={}",
                appointment.getId(), slotId, appointment.getPatientRef(),
                slot.getSlotDate(), slot.getStartTime());
        return appointment;
    }

    // =========================================================
    // CANCEL
    // =========================================================
    @Transactional
    public Appointment cancel(Long appointmentId) {
        Long doctorId = appointmentRepository.findDoctorIdById(appointmentId)
                .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
        doctorRepository.findByIdForShare(doctorId)
                .orElseThrow(() -> NotFoundException.of("Doctor", doctorId));

        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
        if (appointment.getStatus() != Appointment.Status.BOOKED) {
            throw new StateException("Only booked appointments can be cancelled; appointment "
                    + appointmentId + " is " + appointment.getStatus());
        }
        return cancelAndRelease(appointment);
    }

    /**
     * Marks the appointment CANCELLED and frees its slot. Caller holds the doctor lock.
     */
    Appointment cancelAndRelease(Appointment appointment) {
        AppointmentSlot slot = appointment.getSlot();
        appointment.setStatus(Appointment.Status.CANCELLED);
        appointment.setSlot(null);
        appointmentRepository.save(appointment);
        if (slot != null) {
            slotStore.release(slot.getId());
        }
        log.info("Cancelled appointment {} for patient {}", appointment.getId(), appointment.getPatientRef());
        return appointment;
    }

    @Transactional(readOnly = true)
    public Appointment get(Long appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
    }
}
