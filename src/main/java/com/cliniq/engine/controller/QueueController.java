package com.cliniq.engine.controller;

import com.cliniq.engine.dto.CheckInRequest;
import com.cliniq.engine.dto.DoctorCheckInView;
import com.cliniq.engine.dto.QueueEntryView;
import com.cliniq.engine.dto.QueueStatusView;
import com.cliniq.engine.dto.TransitionRequest;
import com.cliniq.engine.service.QueueService;
import com.cliniq.engine.service.QueueStatusService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/queue")
public class QueueController {

    private final QueueService queueService;
    private final QueueStatusService queueStatusService;

    public QueueController(QueueService queueService, QueueStatusService queueStatusService) {
        this.queueService = queueService;
        this.queueStatusService = queueStatusService;
    }

    @PostMapping("/check-in")
    public ResponseEntity<QueueEntryView> checkIn(@RequestBody CheckInRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(QueueEntryView.from(queueService.checkIn(request)));
    }

    @PostMapping("/{entryId}/status")
    public QueueEntryView transition(@PathVariable Long entryId, @RequestBody TransitionRequest request) {
        return QueueEntryView.from(queueService.transition(entryId, request.status()));
    }

    @GetMapping("/{entryId}/status")
    public QueueStatusView queueStatus(@PathVariable Long entryId) {
        return queueStatusService.queueStatus(entryId);
    }

    @GetMapping("/doctors/{doctorId}/tokens/{token}")
    public QueueStatusView queueStatusByToken(@PathVariable Long doctorId, @PathVariable int token,
                                              @RequestParam(required = false)
                                              @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return queueStatusService.queueStatus(doctorId, date, token);
    }

    @GetMapping("/doctors/{doctorId}")
    public List<QueueEntryView> listQueue(@PathVariable Long doctorId,
                                          @RequestParam(required = false)
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return queueStatusService.listQueue(doctorId, date);
    }

    @PostMapping("/doctors/{doctorId}/check-in")
    public DoctorCheckInView doctorCheckIn(@PathVariable Long doctorId) {
        return DoctorCheckInView.from(doctorId, queueService.doctorCheckIn(doctorId));
    }

    @PostMapping("/doctors/{doctorId}/check-out")
    public DoctorCheckInView doctorCheckOut(@PathVariable Long doctorId) {
        return DoctorCheckInView.from(doctorId, queueService.doctorCheckOut(doctorId));
    }
}
