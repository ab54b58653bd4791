package com.agentloop.core.engine;

import com.agentloop.core.capability.CapabilityOutcome;
import com.agentloop.core.capability.CapabilityRegistry;
import com.agentloop.core.config.AgentloopProperties;
import com.agentloop.core.events.EngineEvent;
import com.agentloop.core.events.EventBus;
import com.agentloop.core.executor.TaskExecutor;
import com.agentloop.core.executor.TaskExecutorFactory;
import com.agentloop.core.graph.PlanStructureException;
import com.agentloop.core.memory.EpisodeRecorder;
import com.agentloop.core.metrics.EngineMetrics;
import com.agentloop.core.model.AutonomyLevel;
import com.agentloop.core.model.Episode;
import com.agentloop.core.model.Goal;
import com.agentloop.core.model.Plan;
import com.agentloop.core.model.PlanStatus;
import com.agentloop.core.model.Task;
import com.agentloop.core.model.TaskResult;
import com.agentloop.core.model.TaskStatus;
import com.agentloop.core.planning.FailureContext;
import com.agentloop.core.planning.PlanGenerator;
import com.agentloop.core.reflection.Reflector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GoalOrchestratorTest {

    private PlanGenerator planGenerator;
    private EpisodeRecorder episodeRecorder;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private AgentloopProperties properties;
    private CapabilityRegistry capabilities;
    private AtomicInteger invocations;
    private RecordingExecutorFactory executorFactory;
    private GoalOrchestrator orchestrator;
    private List<EngineEvent> events;

    /** Keeps a handle on every executor it creates. */
    static class RecordingExecutorFactory extends TaskExecutorFactory {
        final List<TaskExecutor> created = new CopyOnWriteArrayList<>();

        RecordingExecutorFactory(CapabilityRegistry invoker, AgentloopProperties properties, EngineMetrics metrics) {
            super(invoker, properties, metrics);
        }

        @Override
        public TaskExecutor create() {
            var executor = super.create();
            created.add(executor);
            return executor;
        }
    }

    @BeforeEach
    void setUp() {
        planGenerator = mock(PlanGenerator.class);
        episodeRecorder = mock(EpisodeRecorder.class);
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        properties = new AgentloopProperties();
        properties.getExecutor().setTaskTimeoutSeconds(5);
        properties.getExecutor().setRetryDelayMs(0);
        properties.getOrchestrator().setMaxReplanningAttempts(1);

        invocations = new AtomicInteger();
        capabilities = new CapabilityRegistry()
                .register("echo", params -> {
                    invocations.incrementAndGet();
                    return CapabilityOutcome.ok("done");
                })
                .register("fetch", params -> {
                    invocations.incrementAndGet();
                    return CapabilityOutcome.failed("Network unreachable");
                })
                .register("write", params -> {
                    invocations.incrementAndGet();
                    return CapabilityOutcome.failed("permission denied");
                });

        var metrics = new EngineMetrics(meterRegistry);
        executorFactory = new RecordingExecutorFactory(capabilities, properties, metrics);
        orchestrator = new GoalOrchestrator(planGenerator, capabilities, new Reflector(properties),
                episodeRecorder, eventBus, metrics, properties, executorFactory);

        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
    }

    private static Task task(String id, String capability, String... deps) {
        return new Task(id, "Do " + id, capability, Map.of(), List.of(deps));
    }

    private void planReturns(Task... tasks) {
        when(planGenerator.generatePlan(any(), any())).thenReturn(List.of(tasks));
    }

    private void revisionKeepsTasks() {
        when(planGenerator.revisePlan(any(), any())).thenAnswer(inv -> ((Plan) inv.getArgument(0)).tasks());
    }

    private List<String> eventTypes() {
        return events.stream().map(EngineEvent::eventType).toList();
    }

    @Nested
    @DisplayName("successful execution")
    class Success {

        @Test
        @DisplayName("runs a linear chain in three waves")
        void linearChain() {
            planReturns(task("A", "echo"), task("B", "echo", "A"), task("C", "echo", "B"));

            var result = orchestrator.execute(new Goal("chain"));

            assertTrue(result.success());
            assertEquals(3, result.waves());
            assertEquals(List.of("A", "B", "C"), result.results().stream().map(TaskResult::taskId).toList());
            assertEquals(PlanStatus.COMPLETED, result.plan().status());
            assertEquals(0, result.replanningAttempts());
            assertFalse(result.awaitingApproval());
            assertFalse(result.stuck());
            assertNull(result.failureReason());
            assertTrue(result.evaluation().success());
            assertEquals(3, result.stats().completedTasks());
            assertNotNull(result.episodeId());
        }

        @Test
        @DisplayName("independent tasks share one wave")
        void parallelWave() {
            planReturns(task("A", "echo"), task("B", "echo"), task("C", "echo", "A", "B"));

            var result = orchestrator.execute(new Goal("fan-in"));

            assertTrue(result.success());
            assertEquals(2, result.waves());
            assertEquals(3, invocations.get());
        }

        @Test
        @DisplayName("offers the capability catalog to the plan generator")
        void passesCatalog() {
            planReturns(task("A", "echo"));
            var goal = new Goal("catalog");

            orchestrator.execute(goal);

            verify(planGenerator).generatePlan(goal, List.of("echo", "fetch", "write"));
        }

        @Test
        @DisplayName("publishes lifecycle events from plan.created to goal.completed")
        void events() {
            planReturns(task("A", "echo"));

            var result = orchestrator.execute(new Goal("events"));

            var types = eventTypes();
            assertEquals("plan.created", types.get(0));
            assertEquals("goal.completed", types.get(types.size() - 1));
            assertTrue(types.containsAll(List.of("task.started", "task.completed", "episode.recorded", "plan.evaluated")));
            assertTrue(events.stream().allMatch(e -> e.goalId().equals(result.goal().id())));
        }

        @Test
        @DisplayName("records one episode and a goal metric")
        void episodeAndMetrics() throws Exception {
            planReturns(task("A", "echo"));

            var result = orchestrator.execute(new Goal("episode"));

            var captor = ArgumentCaptor.forClass(Episode.class);
            verify(episodeRecorder).recordEpisode(captor.capture());
            assertEquals(result.episodeId(), captor.getValue().id());
            assertTrue(captor.getValue().success());
            assertEquals(1.0, meterRegistry.find("agentloop.goals.total").tag("status", "completed").counter().count());
        }

        @Test
        @DisplayName("closes the executor when the goal finishes")
        void closesExecutor() {
            planReturns(task("A", "echo"));

            orchestrator.execute(new Goal("close"));

            assertEquals(1, executorFactory.created.size());
            assertTrue(executorFactory.created.get(0).isShutdown());
        }
    }

    @Nested
    @DisplayName("replanning")
    class Replanning {

        @Test
        @DisplayName("a network failure in a chain triggers exactly one revision when the limit is one")
        void singleReplan() {
            planReturns(task("A", "echo"), task("B", "fetch", "A"), task("C", "echo", "B"));
            revisionKeepsTasks();

            var result = orchestrator.execute(new Goal("chain with flaky fetch"));

            verify(planGenerator, times(1)).revisePlan(any(), any());
            assertEquals(1, result.replanningAttempts());
            assertFalse(result.success());
            assertEquals(PlanStatus.FAILED, result.plan().status());
            assertTrue(result.stuck());
            assertEquals(List.of("C"), result.blockedTaskIds());
            assertEquals(List.of("A", "B"), result.results().stream().map(TaskResult::taskId).toList());
            assertEquals(1, result.supersededResults().size());
            assertTrue(eventTypes().contains("plan.revised"));
        }

        @Test
        @DisplayName("passes the failure context to the plan generator")
        void failureContext() {
            planReturns(task("A", "fetch"));
            revisionKeepsTasks();

            orchestrator.execute(new Goal("context"));

            var captor = ArgumentCaptor.forClass(FailureContext.class);
            verify(planGenerator).revisePlan(any(), captor.capture());
            assertEquals("A", captor.getValue().failedTaskId());
            assertEquals("Network unreachable", captor.getValue().error());
            assertTrue(captor.getValue().evaluation().shouldReplan());
            assertEquals(1, captor.getValue().replanningAttempt());
        }

        @Test
        @DisplayName("a revision that fixes the failure lets the goal succeed")
        void revisionRecovers() {
            planReturns(task("A", "echo"), task("B", "fetch", "A"), task("C", "echo", "B"));
            when(planGenerator.revisePlan(any(), any()))
                    .thenReturn(List.of(task("A", "echo"), task("B2", "echo", "A"), task("C", "echo", "B2")));

            var result = orchestrator.execute(new Goal("recover"));

            assertTrue(result.success());
            assertEquals(1, result.replanningAttempts());
            assertEquals(List.of("A", "B2", "C"), result.plan().tasks().stream().map(Task::id).toList());
            assertEquals(List.of("A", "B2", "C"), result.results().stream().map(TaskResult::taskId).toList());
            assertEquals("B", result.supersededResults().get(0).taskId());
            assertEquals(1, result.plan().revision());
        }

        @Test
        @DisplayName("a revision answering one failure leaves other failures standing")
        void unrelatedFailureSurvivesRevision() {
            planReturns(task("X", "write"), task("Y", "fetch"));
            when(planGenerator.revisePlan(any(), any())).thenReturn(List.of(task("Y2", "echo")));

            var result = orchestrator.execute(new Goal("two failures"));

            assertEquals(1, result.replanningAttempts());
            assertFalse(result.success());
            assertEquals(PlanStatus.FAILED, result.plan().status());
            assertEquals(List.of("X", "Y2"), result.plan().tasks().stream().map(Task::id).toList());
            assertEquals(TaskStatus.FAILED, result.plan().getTask("X").orElseThrow().status());
            assertEquals(TaskStatus.COMPLETED, result.plan().getTask("Y2").orElseThrow().status());
            assertEquals(List.of("X", "Y2"), result.results().stream().map(TaskResult::taskId).toList());
            assertEquals(List.of("Y"), result.supersededResults().stream().map(TaskResult::taskId).toList());
            assertTrue(result.failureReason().contains("permission denied"));
        }

        @Test
        @DisplayName("permission failures are not replanned")
        void noReplanForPermission() {
            planReturns(task("A", "write"), task("B", "echo"));

            var result = orchestrator.execute(new Goal("write"));

            verify(planGenerator, never()).revisePlan(any(), any());
            assertEquals(0, result.replanningAttempts());
            assertFalse(result.success());
            assertEquals(TaskStatus.COMPLETED, result.plan().getTask("B").orElseThrow().status());
            assertTrue(result.failureReason().contains("permission denied"));
        }

        @Test
        @DisplayName("zero allowed attempts disables replanning")
        void replanningDisabled() {
            properties.getOrchestrator().setMaxReplanningAttempts(0);
            planReturns(task("A", "fetch"));

            var result = orchestrator.execute(new Goal("no replans"));

            verify(planGenerator, never()).revisePlan(any(), any());
            assertEquals(0, result.replanningAttempts());
        }

        @Test
        @DisplayName("a failing planner keeps the failure and counts the attempt")
        void plannerThrows() {
            planReturns(task("A", "fetch"));
            when(planGenerator.revisePlan(any(), any())).thenThrow(new IllegalStateException("planner offline"));

            var result = orchestrator.execute(new Goal("planner down"));

            assertEquals(1, result.replanningAttempts());
            assertFalse(result.success());
            assertEquals(TaskStatus.FAILED, result.plan().getTask("A").orElseThrow().status());
        }

        @Test
        @DisplayName("a cyclic revision aborts the goal and still closes the executor")
        void cyclicRevision() {
            planReturns(task("A", "fetch"));
            when(planGenerator.revisePlan(any(), any()))
                    .thenReturn(List.of(task("A", "echo", "B"), task("B", "echo", "A")));

            assertThrows(PlanStructureException.class, () -> orchestrator.execute(new Goal("bad revision")));
            assertTrue(executorFactory.created.get(0).isShutdown());
        }
    }

    @Nested
    @DisplayName("gates and structural failures")
    class Gates {

        @Test
        @DisplayName("PARANOID autonomy returns the plan for approval without running anything")
        void paranoid() {
            planReturns(task("A", "echo"), task("B", "echo", "A"));

            var result = orchestrator.execute(new Goal("careful"), AutonomyLevel.PARANOID);

            assertTrue(result.awaitingApproval());
            assertTrue(result.results().isEmpty());
            assertFalse(result.success());
            assertEquals(0, invocations.get());
            assertEquals(PlanStatus.DRAFT, result.plan().status());
            assertTrue(executorFactory.created.isEmpty());
        }

        @Test
        @DisplayName("the configured autonomy level is used by default")
        void configuredAutonomy() {
            properties.getOrchestrator().setAutonomy(AutonomyLevel.PARANOID);
            planReturns(task("A", "echo"));

            assertTrue(orchestrator.execute(new Goal("configured")).awaitingApproval());
            assertEquals(0, invocations.get());
        }

        @Test
        @DisplayName("a cyclic plan is rejected before any task runs")
        void cyclicPlan() {
            planReturns(task("A", "echo", "C"), task("B", "echo", "A"), task("C", "echo", "B"));

            var ex = assertThrows(PlanStructureException.class, () -> orchestrator.execute(new Goal("cycle")));

            assertEquals(PlanStructureException.Kind.CYCLE, ex.kind());
            assertEquals(0, invocations.get());
            assertTrue(executorFactory.created.isEmpty());
            assertFalse(eventTypes().contains("plan.created"));
        }

        @Test
        @DisplayName("a planner that throws yields a failed result instead of an exception")
        void plannerUnavailable() {
            when(planGenerator.generatePlan(any(), any())).thenThrow(new IllegalStateException("LLM backend down"));

            var result = assertDoesNotThrow(() -> orchestrator.execute(new Goal("no planner")));

            assertFalse(result.success());
            assertEquals("Plan generator unavailable: LLM backend down", result.failureReason());
            assertEquals(PlanStatus.FAILED, result.plan().status());
            assertTrue(result.results().isEmpty());
            assertTrue(executorFactory.created.isEmpty());
            assertTrue(eventTypes().contains("goal.completed"));
            assertEquals(1.0, meterRegistry.find("agentloop.goals.total").tag("status", "failed").counter().count());
        }

        @Test
        @DisplayName("an empty plan fails without execution")
        void emptyPlan() {
            when(planGenerator.generatePlan(any(), any())).thenReturn(List.of());

            var result = orchestrator.execute(new Goal("nothing to do"));

            assertFalse(result.success());
            assertEquals("Plan generator returned no tasks", result.failureReason());
            assertTrue(executorFactory.created.isEmpty());
        }
    }

    @Nested
    @DisplayName("isolation")
    class Isolation {

        @Test
        @DisplayName("failing subscribers and recorders do not affect the result")
        void sinksIsolated() throws Exception {
            eventBus.subscribeAll(e -> {
                throw new RuntimeException("subscriber broke");
            });
            doThrow(new IllegalStateException("store down")).when(episodeRecorder).recordEpisode(any());
            planReturns(task("A", "echo"), task("B", "echo", "A"));

            var result = orchestrator.execute(new Goal("noisy sinks"));

            assertTrue(result.success());
            assertEquals(2, result.results().size());
            assertFalse(eventTypes().contains("episode.recorded"));
        }

        @Test
        @DisplayName("cancel stops further waves and cancels remaining tasks")
        void cancel() throws Exception {
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            capabilities.register("block", params -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return CapabilityOutcome.ok("late");
            });
            planReturns(task("A", "block"), task("B", "echo", "A"));
            var goal = new Goal("cancel me");

            var future = CompletableFuture.supplyAsync(() -> orchestrator.execute(goal));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertTrue(orchestrator.isRunning(goal.id()));
            assertTrue(orchestrator.cancel(goal.id()));
            release.countDown();
            var result = future.get(10, TimeUnit.SECONDS);

            assertFalse(result.success());
            assertEquals(PlanStatus.CANCELLED, result.plan().status());
            assertEquals(TaskStatus.CANCELLED, result.plan().getTask("A").orElseThrow().status());
            assertEquals(TaskStatus.CANCELLED, result.plan().getTask("B").orElseThrow().status());
            assertEquals("Goal cancelled", result.failureReason());
            assertFalse(orchestrator.isRunning(goal.id()));
            assertFalse(orchestrator.cancel(goal.id()));
        }
    }
}
