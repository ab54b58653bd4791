package com.agentloop.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static Task task(String id, String... deps) {
        return new Task(id, "Do " + id, "echo", Map.of(), List.of(deps));
    }

    @Nested
    @DisplayName("TaskResult")
    class TaskResultTests {

        @Test
        @DisplayName("failure without error text gets a default error")
        void defaultError() {
            var result = TaskResult.failure("T1", null, 5, List.of());
            assertEquals("Unknown error", result.error());
            assertFalse(result.success());
        }

        @Test
        @DisplayName("success clears the error")
        void successClearsError() {
            var result = new TaskResult("T1", true, "out", "ignored", List.of(), 5, Map.of());
            assertNull(result.error());
        }

        @Test
        @DisplayName("withMetadata merges flags without touching the original")
        void withMetadata() {
            var original = TaskResult.failure("T1", "boom", 5, List.of("line"));
            var annotated = original.withMetadata(Map.of(TaskResult.RETRY_EXHAUSTED, true, TaskResult.RETRIES, 2));

            assertTrue(annotated.retryExhausted());
            assertEquals(2, annotated.metadata().get(TaskResult.RETRIES));
            assertTrue(original.metadata().isEmpty());
            assertEquals(List.of("line"), annotated.logs());
        }

        @Test
        @DisplayName("durationSeconds converts milliseconds")
        void durationSeconds() {
            assertEquals(1.5, TaskResult.success("T1", null, 1500, List.of()).durationSeconds());
        }
    }

    @Nested
    @DisplayName("Task")
    class TaskTests {

        @Test
        @DisplayName("applyResult maps success, failure and cancellation to statuses")
        void applyResult() {
            var ok = task("A");
            ok.applyResult(TaskResult.success("A", 42, 1, List.of()), Instant.now(), Instant.now());
            assertEquals(TaskStatus.COMPLETED, ok.status());
            assertEquals(42, ok.result());

            var failed = task("B");
            failed.applyResult(TaskResult.failure("B", "boom", 1, List.of()), Instant.now(), Instant.now());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals("boom", failed.error());

            var cancelled = task("C");
            cancelled.applyResult(TaskResult.failure("C", "stop", 1, List.of(), Map.of(TaskResult.CANCELLED, true)),
                    Instant.now(), Instant.now());
            assertEquals(TaskStatus.CANCELLED, cancelled.status());
        }

        @Test
        @DisplayName("expectedTimeSeconds reads numeric and string metadata")
        void expectedTime() {
            var numeric = new Task("A", null, "", "echo", Map.of(), List.of(), Map.of("expected_time_seconds", 2));
            var text = new Task("B", null, "", "echo", Map.of(), List.of(), Map.of("expected_time_seconds", "1.5"));
            var junk = new Task("C", null, "", "echo", Map.of(), List.of(), Map.of("expected_time_seconds", "soon"));

            assertEquals(2.0, numeric.expectedTimeSeconds());
            assertEquals(1.5, text.expectedTimeSeconds());
            assertNull(junk.expectedTimeSeconds());
        }

        @Test
        @DisplayName("blank id gets a generated one and capability is required")
        void idAndCapability() {
            assertFalse(new Task("", "d", "echo", Map.of(), List.of()).id().isBlank());
            assertThrows(NullPointerException.class, () -> new Task("A", "d", null, Map.of(), List.of()));
        }
    }

    @Nested
    @DisplayName("Plan")
    class PlanTests {

        @Test
        @DisplayName("adopts pending copies of generated tasks")
        void adoptsCopies() {
            var generated = task("A");
            generated.markRunning(Instant.now());

            var plan = Plan.of(new Goal("g"), List.of(generated));

            var adopted = plan.getTask("A").orElseThrow();
            assertNotSame(generated, adopted);
            assertEquals(TaskStatus.PENDING, adopted.status());
            assertEquals(plan.id(), adopted.planId());
            assertEquals(PlanStatus.DRAFT, plan.status());
        }

        @Test
        @DisplayName("applyRevision keeps completed tasks and drops unnamed ones")
        void applyRevision() {
            var plan = Plan.of(new Goal("g"), List.of(task("A"), task("B", "A"), task("C", "B")));
            var a = plan.getTask("A").orElseThrow();
            a.applyResult(TaskResult.success("A", "ok", 1, List.of()), Instant.now(), Instant.now());
            plan.getTask("B").orElseThrow()
                    .applyResult(TaskResult.failure("B", "boom", 1, List.of()), Instant.now(), Instant.now());

            var dropped = plan.applyRevision(List.of(task("A"), task("B2", "A")), "B");

            assertEquals(List.of("B", "C"), dropped);
            assertEquals(List.of("A", "B2"), plan.tasks().stream().map(Task::id).toList());
            assertSame(a, plan.getTask("A").orElseThrow());
            assertEquals(TaskStatus.PENDING, plan.getTask("B2").orElseThrow().status());
            assertEquals(1, plan.revision());
        }

        @Test
        @DisplayName("applyRevision re-adopts a failed task named again as pending")
        void revisionRetriesFailedTask() {
            var plan = Plan.of(new Goal("g"), List.of(task("A")));
            plan.getTask("A").orElseThrow()
                    .applyResult(TaskResult.failure("A", "boom", 1, List.of()), Instant.now(), Instant.now());

            var dropped = plan.applyRevision(plan.tasks(), "A");

            assertTrue(dropped.isEmpty());
            assertEquals(TaskStatus.PENDING, plan.getTask("A").orElseThrow().status());
        }

        @Test
        @DisplayName("applyRevision keeps other failed tasks the revision does not name")
        void revisionKeepsUnrelatedFailures() {
            var plan = Plan.of(new Goal("g"), List.of(task("X"), task("Y"), task("Z", "Y")));
            plan.getTask("X").orElseThrow()
                    .applyResult(TaskResult.failure("X", "permission denied", 1, List.of()), Instant.now(), Instant.now());
            plan.getTask("Y").orElseThrow()
                    .applyResult(TaskResult.failure("Y", "Network unreachable", 1, List.of()), Instant.now(), Instant.now());

            var dropped = plan.applyRevision(List.of(task("Y2"), task("Z", "Y2")), "Y");

            assertEquals(List.of("Y"), dropped);
            assertEquals(List.of("X", "Y2", "Z"), plan.tasks().stream().map(Task::id).toList());
            assertEquals(TaskStatus.FAILED, plan.getTask("X").orElseThrow().status());
            assertFalse(plan.allTasksCompleted());
        }

        @Test
        @DisplayName("status moves through executing to a terminal state")
        void lifecycle() {
            var plan = Plan.of(new Goal("g"), List.of(task("A")));
            plan.markExecuting();
            assertEquals(PlanStatus.EXECUTING, plan.status());
            assertNotNull(plan.startedAt());

            plan.finish(PlanStatus.COMPLETED);
            assertEquals(PlanStatus.COMPLETED, plan.status());
            assertNotNull(plan.completedAt());
        }
    }

    @Nested
    @DisplayName("Evaluation")
    class EvaluationTests {

        @Test
        @DisplayName("requires exactly one target")
        void exactlyOneTarget() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Evaluation(null, null, true, 1.0, List.of(), List.of(), false));
            assertThrows(IllegalArgumentException.class,
                    () -> new Evaluation("T", "P", true, 1.0, List.of(), List.of(), false));
        }

        @Test
        @DisplayName("clamps confidence into [0, 1]")
        void clampsConfidence() {
            assertEquals(1.0, Evaluation.forTask("T", true, 3.0, null, null, false).confidence());
            assertEquals(0.0, Evaluation.forPlan("P", false, -1.0, null, null, false).confidence());
        }
    }

    @Nested
    @DisplayName("ExecutionStats")
    class ExecutionStatsTests {

        @Test
        @DisplayName("counts tasks by status and computes the success rate")
        void counts() {
            var a = task("A");
            var b = task("B");
            var c = task("C");
            var d = task("D");
            a.applyResult(TaskResult.success("A", "ok", 1, List.of()), Instant.now(), Instant.now());
            b.applyResult(TaskResult.failure("B", "boom", 1, List.of()), Instant.now(), Instant.now());
            c.markRunning(Instant.now());

            var stats = ExecutionStats.of(List.of(a, b, c, d));

            assertEquals(4, stats.totalTasks());
            assertEquals(1, stats.completedTasks());
            assertEquals(1, stats.failedTasks());
            assertEquals(1, stats.runningTasks());
            assertEquals(1, stats.pendingTasks());
            assertEquals(0.25, stats.successRate(), 1e-9);
        }

        @Test
        @DisplayName("an empty task list has a zero success rate")
        void empty() {
            assertEquals(0.0, ExecutionStats.of(List.of()).successRate());
        }
    }

    @Nested
    @DisplayName("ResourceLimits")
    class ResourceLimitsTests {

        @Test
        @DisplayName("fromMap falls back to defaults for missing keys")
        void fromMap() {
            var limits = ResourceLimits.fromMap(Map.of("memory_limit_mb", 256));
            assertEquals(ResourceLimits.DEFAULT_TIMEOUT_SECONDS, limits.timeoutSeconds());
            assertEquals(256, limits.memoryLimitMb());
            assertNull(limits.cpuLimitPercent());
            assertTrue(limits.hasAdvisoryLimits());
            assertFalse(ResourceLimits.defaults().hasAdvisoryLimits());
        }

        @Test
        @DisplayName("rejects a non-positive timeout")
        void rejectsBadTimeout() {
            assertThrows(IllegalArgumentException.class, () -> new ResourceLimits(0, null, null));
        }
    }

    @Test
    @DisplayName("AutonomyLevel only PARANOID requires approval")
    void autonomy() {
        assertTrue(AutonomyLevel.PARANOID.requiresApproval());
        assertFalse(AutonomyLevel.BALANCED.requiresApproval());
        assertFalse(AutonomyLevel.AUTONOMOUS.requiresApproval());
    }
}
