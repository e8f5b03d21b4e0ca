package com.cliniq.engine.controller;

import com.cliniq.engine.dto.AppointmentView;
import com.cliniq.engine.dto.BookAppointmentRequest;
import com.cliniq.engine.service.AppointmentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final AppointmentService appointmentService;

    public AppointmentController(AppointmentService appointmentService) {
        this.appointmentService = appointmentService;
    }

    @PostMapping
    public ResponseEntity<AppointmentView> book(@RequestBody BookAppointmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AppointmentView.from(appointmentService.book(request.slotId(), request.patientRef())));
    }

    @GetMapping("/{appointmentId}")
    public AppointmentView get(@PathVariable Long appointmentId) {
        return AppointmentView.from(appointmentService.get(appointmentId));
    }

    @PostMapping("/{appointmentId}/cancel")
    public AppointmentView cancel(@PathVariable Long appointmentId) {
        return AppointmentView.from(appointmentService.cancel(appointmentId));
    }
}
