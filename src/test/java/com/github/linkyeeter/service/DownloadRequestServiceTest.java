package com.github.linkyeeter.service;

import com.github.linkyeeter.model.Submission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("DownloadRequestService")
class DownloadRequestServiceTest {

    private TaskManager taskManager;
    private DownloadRequestService service;

    @BeforeEach
    void setUp() {
        taskManager = new TaskManager(new AdmissionController(), mock(Worker.class));
        service = new DownloadRequestService(taskManager);
    }

    @Test
    @DisplayName("should hand out increasing positions")
    void shouldHandOutIncreasingPositions() {
        Submission first = service.submit("https://example.com/a", false);
        Submission second = service.submit("https://example.com/b", true);
        Submission third = service.submit("https://example.com/c", false);

        assertEquals(0, first.getPosition());
        assertEquals(1, second.getPosition());
        assertEquals(2, third.getPosition());
        assertEquals(3, taskManager.getQueueSize());
        assertFalse(first.getResult().isDone());
    }

    @Test
    @DisplayName("the reservation should be counted while the requester is told its position")
    void reservationShouldBeCountedBeforeEnqueue() {
        service.submit("https://example.com/a", false);
        AtomicInteger sizeSeen = new AtomicInteger(-1);

        Submission submission = service.submit("https://example.com/b", false,
                position -> sizeSeen.set(taskManager.getQueueSize()));

        assertEquals(1, submission.getPosition());
        assertEquals(2, sizeSeen.get());
        assertEquals(2, taskManager.getQueueSize());
    }

    @Test
    @DisplayName("should refuse submissions after shutdown")
    void shouldRefuseAfterShutdown() {
        taskManager.stop();
        AtomicInteger notified = new AtomicInteger();

        assertThrows(IllegalStateException.class,
                () -> service.submit("https://example.com/a", false, position -> notified.incrementAndGet()));

        assertEquals(0, notified.get());
        assertEquals(0, taskManager.getQueueSize());
    }

    @Test
    @DisplayName("a failing notification should release the reservation")
    void failingNotificationShouldReleaseReservation() {
        service.submit("https://example.com/a", false);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> service.submit("https://example.com/b", false, position -> {
                    throw new IllegalStateException("chat unavailable");
                }));

        assertEquals("chat unavailable", e.getMessage());
        assertEquals(1, taskManager.getQueueSize());
    }
}
