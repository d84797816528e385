package com.github.linkyeeter.controller;

import com.github.linkyeeter.model.QueueStatus;
import com.github.linkyeeter.service.TaskManager;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/queue")
@RequiredArgsConstructor
public class QueueController {

    private final TaskManager taskManager;

    /**
     * Number of active tasks and what the worker is doing.
     */
    @GetMapping
    public QueueStatus getStatus() {
        return taskManager.getStatus();
    }
}
