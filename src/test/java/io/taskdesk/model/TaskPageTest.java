package io.taskdesk.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TaskPageTest {
    @Test
    void totalPagesRoundsUp() {
        assertEquals(0, new TaskPage(List.of(), 0, 1, 50).totalPages());
        assertEquals(1, new TaskPage(List.of(), 1, 1, 50).totalPages());
        assertEquals(1, new TaskPage(List.of(), 50, 1, 50).totalPages());
        assertEquals(2, new TaskPage(List.of(), 51, 1, 50).totalPages());
        assertEquals(3, new TaskPage(List.of(), 101, 1, 50).totalPages());
    }
}
