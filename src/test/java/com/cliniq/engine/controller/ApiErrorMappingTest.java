package com.cliniq.engine.controller;

import com.cliniq.engine.domain.ConflictReason;
import com.cliniq.engine.domain.QueuePriority;
import com.cliniq.engine.domain.QueueSource;
import com.cliniq.engine.domain.QueueStatus;
import com.cliniq.engine.domain.ShiftType;
import com.cliniq.engine.domain.SlotConflict;
import com.cliniq.engine.dto.SlotGenerationResult;
import com.cliniq.engine.entity.Doctor;
import com.cliniq.engine.entity.QueueEntry;
import com.cliniq.engine.exception.ConcurrencyException;
import com.cliniq.engine.exception.ConfigurationException;
import com.cliniq.engine.exception.ConflictException;
import com.cliniq.engine.exception.NotFoundException;
import com.cliniq.engine.exception.StateException;
import com.cliniq.engine.exception.ValidationException;
import com.cliniq.engine.service.AppointmentService;
import com.cliniq.engine.service.AvailabilityService;
import com.cliniq.engine.service.QueueService;
import com.cliniq.engine.service.QueueStatusService;
import com.cliniq.engine.service.SlotGenerationService;
import com.cliniq.engine.service.SlotStoreService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ApiErrorMappingTest {

    private static final LocalDate MONDAY = LocalDate.of(2030, 1, 7);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SlotGenerationService slotGenerationService;
    @MockBean
    private SlotStoreService slotStore;
    @MockBean
    private AvailabilityService availabilityService;
    @MockBean
    private AppointmentService appointmentService;
    @MockBean
    private QueueService queueService;
    @MockBean
    private QueueStatusService queueStatusService;

    @Test
    void generateReturnsCounts() throws Exception {
        when(slotGenerationService.generateSlots(1L, MONDAY, MONDAY.plusDays(2)))
                .thenReturn(new SlotGenerationResult(48, 0, MONDAY, MONDAY.plusDays(2)));

        mockMvc.perform(post("/api/doctors/1/slots/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":\"2030-01-07\",\"to\":\"2030-01-09\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(48))
                .andExpect(jsonPath("$.from").value("2030-01-07"));
    }

    @Test
    void validationIsBadRequest() throws Exception {
        when(slotGenerationService.generateSlots(any(), any(), any()))
                .thenThrow(new ValidationException("Start date must be before or equal to end date"));

        mockMvc.perform(post("/api/doctors/1/slots/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":\"2030-01-09\",\"to\":\"2030-01-07\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void missingDoctorIsNotFound() throws Exception {
        when(slotStore.statusSummary(99L)).thenThrow(NotFoundException.of("Doctor", 99L));

        mockMvc.perform(get("/api/doctors/99/slots/summary"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void unconfiguredDoctorIsUnprocessable() throws Exception {
        when(slotGenerationService.generateSlots(any(), any(), any()))
                .thenThrow(new ConfigurationException("Doctor 1 has no appointment duration configured"));

        mockMvc.perform(post("/api/doctors/1/slots/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":\"2030-01-07\",\"to\":\"2030-01-07\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("CONFIGURATION_ERROR"));
    }

    @Test
    void scheduleConflictCarriesTheFullList() throws Exception {
        SlotConflict conflict = new SlotConflict(5L, 8L, "P-1", MONDAY.plusDays(2), LocalTime.of(15, 0),
                LocalTime.of(15, 15), ShiftType.EVENING, ConflictReason.SHIFT_DISABLED,
                "EVENING shift is not enabled on Wednesday");
        when(availabilityService.updateAvailabilityWithResolution(eq(1L), any(), eq(false)))
                .thenThrow(new ConflictException(List.of(conflict)));

        mockMvc.perform(put("/api/doctors/1/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weekly\":[{\"dayOfWeek\":3,\"shiftType\":\"EVENING\",\"enabled\":false}]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SCHEDULE_CONFLICT"))
                .andExpect(jsonPath("$.conflicts[0].reason").value("SHIFT_DISABLED"))
                .andExpect(jsonPath("$.conflicts[0].appointmentId").value(8));
    }

    @Test
    void illegalTransitionIsConflict() throws Exception {
        when(queueService.transition(3L, QueueStatus.WITH_DOCTOR))
                .thenThrow(new StateException("Doctor 1 is already with token 2 (entry 2)"));

        mockMvc.perform(post("/api/queue/3/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"WITH_DOCTOR\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("STATE_ERROR"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void concurrencyFailuresAreRetryable() throws Exception {
        when(appointmentService.cancel(anyLong())).thenThrow(new ConcurrencyException("token race", null));
        when(availabilityService.updateAvailabilityWithResolution(anyLong(), any(), anyBoolean()))
                .thenThrow(new CannotAcquireLockException("lock timeout"));

        mockMvc.perform(post("/api/appointments/4/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONCURRENCY_ERROR"))
                .andExpect(jsonPath("$.retryable").value(true));
        mockMvc.perform(put("/api/doctors/1/availability?cancelConflicts=true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"appointmentDurationMin\":20}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONCURRENCY_ERROR"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void checkInIsCreated() throws Exception {
        QueueEntry entry = QueueEntry.builder()
                .id(11L)
                .doctor(Doctor.builder().id(1L).build())
                .queueDate(MONDAY)
                .token(4)
                .patientRef("W-1")
                .source(QueueSource.WALKIN)
                .priority(QueuePriority.URGENT)
                .status(QueueStatus.QUEUED)
                .checkedInAt(Instant.parse("2030-01-07T09:00:00Z"))
                .build();
        when(queueService.checkIn(any())).thenReturn(entry);

        mockMvc.perform(post("/api/queue/check-in")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"doctorId\":1,\"patientRef\":\"W-1\",\"source\":\"WALKIN\",\"priority\":\"URGENT\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token").value(4))
                .andExpect(jsonPath("$.priority").value("URGENT"));
    }
}
