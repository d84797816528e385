package com.github.linkyeeter.service.state;

import com.github.linkyeeter.model.WorkerState;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for the worker loop.
 *
 * Valid state flow:
 * <pre>
 * IDLE → BUSY → IDLE → ... → STOPPED
 *          ↓
 *       STOPPED
 * </pre>
 */
@Component
@Slf4j
public class WorkerStateMachine {

    private final Map<WorkerState, Set<WorkerState>> validTransitions;

    public WorkerStateMachine() {
        validTransitions = new EnumMap<>(WorkerState.class);
        initializeTransitions();
    }

    private void initializeTransitions() {
        validTransitions.put(WorkerState.IDLE, EnumSet.of(WorkerState.BUSY, WorkerState.STOPPED));

        // BUSY -> STOPPED only when the loop dies mid-task (interrupt)
        validTransitions.put(WorkerState.BUSY, EnumSet.of(WorkerState.IDLE, WorkerState.STOPPED));

        validTransitions.put(WorkerState.STOPPED, EnumSet.noneOf(WorkerState.class));
    }

    /**
     * Check if a state transition is valid.
     *
     * @param currentState Current state
     * @param newState Desired new state
     * @return true if transition is valid
     */
    public boolean isValidTransition(@NonNull WorkerState currentState, @NonNull WorkerState newState) {
        if (currentState == newState) {
            return true;
        }
        Set<WorkerState> allowed = validTransitions.get(currentState);
        return allowed != null && allowed.contains(newState);
    }

    /**
     * Validate and perform state transition.
     *
     * @return New state if valid, current state if invalid
     */
    public WorkerState transition(@NonNull WorkerState currentState, @NonNull WorkerState newState) {
        if (isValidTransition(currentState, newState)) {
            if (currentState != newState) {
                log.debug("Worker state transition: {} → {}", currentState, newState);
            }
            return newState;
        }
        log.warn("Invalid worker state transition attempted: {} → {} (rejected)", currentState, newState);
        return currentState;
    }

    public boolean isTerminalState(@NonNull WorkerState state) {
        Set<WorkerState> allowed = validTransitions.get(state);
        return allowed == null || allowed.isEmpty();
    }

    public Set<WorkerState> getValidNextStates(@NonNull WorkerState currentState) {
        Set<WorkerState> states = validTransitions.get(currentState);
        return states != null ? EnumSet.copyOf(states) : EnumSet.noneOf(WorkerState.class);
    }
}
