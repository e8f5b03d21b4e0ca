package com.cliniq.engine.controller;

import com.cliniq.engine.domain.SlotConflict;
import com.cliniq.engine.dto.AvailabilityUpdateRequest;
import com.cliniq.engine.dto.AvailabilityUpdateResult;
import com.cliniq.engine.dto.AvailabilityView;
import com.cliniq.engine.dto.ClearSlotsResult;
import com.cliniq.engine.dto.GenerateSlotsRequest;
import com.cliniq.engine.dto.RegenerationResult;
import com.cliniq.engine.dto.SlotGenerationResult;
import com.cliniq.engine.dto.SlotStatusSummary;
import com.cliniq.engine.dto.SlotView;
import com.cliniq.engine.dto.TimeOffRequest;
import com.cliniq.engine.dto.TimeOffResult;
import com.cliniq.engine.service.AvailabilityService;
import com.cliniq.engine.service.SlotGenerationService;
import com.cliniq.engine.service.SlotStoreService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/doctors/{doctorId}")
public class DoctorScheduleController {

    private final SlotGenerationService slotGenerationService;
    private final SlotStoreService slotStore;
    private final AvailabilityService availabilityService;

    public DoctorScheduleController(SlotGenerationService slotGenerationService,
                                    SlotStoreService slotStore,
                                    AvailabilityService availabilityService) {
        this.slotGenerationService = slotGenerationService;
        this.slotStore = slotStore;
        this.availabilityService = availabilityService;
    }

    // ---- slots ----

    @PostMapping("/slots/generate")
    public SlotGenerationResult generateSlots(@PathVariable Long doctorId, @RequestBody GenerateSlotsRequest request) {
        return slotGenerationService.generateSlots(doctorId, request.from(), request.to());
    }

    @DeleteMapping("/slots")
    public ClearSlotsResult clearAvailableSlots(@PathVariable Long doctorId,
                                                @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from) {
        return slotStore.clearAvailable(doctorId, from);
    }

    @GetMapping("/slots/summary")
    public SlotStatusSummary slotStatusSummary(@PathVariable Long doctorId) {
        return slotStore.statusSummary(doctorId);
    }

    @GetMapping("/slots")
    public List<SlotView> listSlots(@PathVariable Long doctorId,
                                    @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return slotStore.listSlots(doctorId, date);
    }

    // ---- availability ----

    @GetMapping("/availability")
    public AvailabilityView getAvailability(@PathVariable Long doctorId) {
        return availabilityService.getAvailability(doctorId);
    }

    @PostMapping("/availability/conflicts")
    public List<SlotConflict> checkConflicts(@PathVariable Long doctorId,
                                             @RequestBody AvailabilityUpdateRequest request) {
        return availabilityService.checkConflicts(doctorId, request);
    }

    @PutMapping("/availability")
    public AvailabilityUpdateResult updateAvailability(@PathVariable Long doctorId,
                                                       @RequestBody AvailabilityUpdateRequest request,
                                                       @RequestParam(defaultValue = "false") boolean cancelConflicts) {
        return availabilityService.updateAvailabilityWithResolution(doctorId, request, cancelConflicts);
    }

    // ---- time-off ----

    @PostMapping("/time-off")
    public ResponseEntity<TimeOffResult> addTimeOff(@PathVariable Long doctorId,
                                                    @RequestBody TimeOffRequest request,
                                                    @RequestParam(defaultValue = "false") boolean cancelConflicts) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(availabilityService.addTimeOff(doctorId, request, cancelConflicts));
    }

    @DeleteMapping("/time-off/{timeOffId}")
    public RegenerationResult removeTimeOff(@PathVariable Long doctorId, @PathVariable Long timeOffId) {
        return availabilityService.removeTimeOff(doctorId, timeOffId);
    }
}
