package dev.nodalis.backend;

import com.google.common.collect.ImmutableList;
import dev.nodalis.schedule.ProgramInstance;
import dev.nodalis.schedule.SchedulingModel;
import dev.nodalis.schedule.TaskDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerPlanTest {

    private static TaskDefinition task(String name, long interval, String... programs) {
        ImmutableList.Builder<ProgramInstance> instances = ImmutableList.builder();
        for (String program : programs) {
            instances.add(new ProgramInstance(program, program + "1", name));
        }
        return new TaskDefinition(name, interval, null, instances.build());
    }

    private static SchedulingModel model(List<TaskDefinition> tasks, List<String> programs) {
        return new SchedulingModel(tasks, List.of(), List.of(), programs, List.of());
    }

    @Test
    void keepsTaskThenInstanceOrder() {
        SchedulerPlan plan = SchedulerPlan.from(model(
                List.of(task("Fast", 2, "A", "B"), task("Slow", 4, "C")), List.of("A", "B", "C")));

        assertThat(plan.isGated()).isTrue();
        assertThat(plan.getFallbackPrograms()).isEmpty();
        assertThat(plan.getGates()).extracting(SchedulerPlan.Gate::getTaskName).containsExactly("Fast", "Slow");
        assertThat(plan.getGates()).extracting(SchedulerPlan.Gate::getInterval).containsExactly(2L, 4L);
        assertThat(plan.getGates().get(0).getPrograms()).containsExactly("A", "B");
        assertThat(plan.getGates().get(1).getPrograms()).containsExactly("C");
    }

    @Test
    void programBoundToTwoTasksAppearsInBothGates() {
        SchedulerPlan plan = SchedulerPlan.from(model(
                List.of(task("Fast", 1, "A"), task("Slow", 10, "A")), List.of("A")));

        assertThat(plan.getGates()).allSatisfy(gate -> assertThat(gate.getPrograms()).containsExactly("A"));
    }

    @Test
    void fallsBackToEveryProgramWithoutTasks() {
        SchedulerPlan plan = SchedulerPlan.from(model(List.of(), List.of("A", "B")));

        assertThat(plan.isGated()).isFalse();
        assertThat(plan.getGates()).isEmpty();
        assertThat(plan.getFallbackPrograms()).containsExactly("A", "B");
    }

    @Test
    void taskWithoutInstancesStillGatesThePlan() {
        SchedulerPlan plan = SchedulerPlan.from(model(List.of(task("Idle", 3)), List.of("A")));

        assertThat(plan.isGated()).isTrue();
        assertThat(plan.getFallbackPrograms()).isEmpty();
        assertThat(plan.getGates()).singleElement().satisfies(gate -> {
            assertThat(gate.getTaskName()).isEqualTo("Idle");
            assertThat(gate.getPrograms()).isEmpty();
        });
    }
}
