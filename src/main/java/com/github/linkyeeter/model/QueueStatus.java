package com.github.linkyeeter.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class QueueStatus {
    private final int size;
    private final WorkerState workerState;
}
