package work.lcod.summation.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.summation.runtime.SummationStep.Stage;
import work.lcod.summation.runtime.SummationStep.Type;
import work.lcod.summation.support.SummationTestSupport;
import work.lcod.summation.table.Column;

class SummationSpecificationTest {
    @Test
    void builderTracksStages() {
        var spec = SummationSpecification.builder()
            .groupBy("Layer", "Ladder")
            .count()
            .perSample()
            .groupBy("Layer")
            .save()
            .reduce("MEAN")
            .save()
            .build();

        assertEquals(List.of(SummationTestSupport.LAYER, SummationTestSupport.LADDER), spec.keyColumns());
        assertTrue(spec.hasPerSampleHarvesting());
        assertTrue(spec.isFollowedByHarvest(1));
        assertTrue(spec.isFollowedByHarvest(2));
        assertFalse(spec.isFollowedByHarvest(3));
        assertEquals(Stage.ONLINE_HARVEST, spec.step(3).stage());
        assertEquals(Stage.OFFLINE, spec.step(4).stage());
        assertEquals(Type.REDUCE, spec.step(4).type());
        assertEquals(
            "ONLINE GROUPBY Layer/Ladder | ONLINE COUNT | ONLINE_HARVEST GROUPBY Layer | ONLINE_HARVEST SAVE"
                + " | OFFLINE REDUCE (MEAN) | OFFLINE SAVE",
            spec.describe(SummationTestSupport.detector())
        );
    }

    @Test
    void walkSkipsLeadingGroupByAndOtherStages() {
        var spec = SummationSpecification.builder()
            .groupBy("Layer", "Ladder")
            .extendX("Ladder")
            .save()
            .groupBy("Layer")
            .save()
            .build();

        var visited = new ArrayList<Integer>();
        spec.walk(EnumSet.of(Stage.ONLINE), (index, step) -> visited.add(index));
        assertEquals(List.of(1, 2), visited);

        visited.clear();
        spec.walk(EnumSet.of(Stage.ONLINE, Stage.OFFLINE), (index, step) -> {
            visited.add(index);
            return step.type() != Type.SAVE;
        });
        assertEquals(List.of(1, 2), visited);
    }

    @Test
    void firstStepMustBeOnlineGroupBy() {
        assertIllegal(List.of());
        assertIllegal(List.of(SummationStep.of(Stage.ONLINE, Type.SAVE)));
        assertIllegal(List.of(SummationStep.of(Stage.OFFLINE, Type.GROUPBY, Column.of("Layer"))));
    }

    @Test
    void stagesCannotGoBack() {
        assertIllegal(List.of(
            SummationStep.of(Stage.ONLINE, Type.GROUPBY, Column.of("Layer")),
            SummationStep.of(Stage.OFFLINE, Type.SAVE),
            SummationStep.of(Stage.ONLINE, Type.SAVE)
        ));
    }

    @Test
    void perSampleHarvestingNeedsCount() {
        assertIllegal(List.of(
            SummationStep.of(Stage.ONLINE, Type.GROUPBY, Column.of("Layer"), Column.of("Ladder")),
            SummationStep.of(Stage.ONLINE_HARVEST, Type.GROUPBY, Column.of("Layer"))
        ));
    }

    @Test
    void onlineRejectsGroupByReduceAndCustom() {
        var layer = Column.of("Layer");
        assertIllegal(List.of(
            SummationStep.of(Stage.ONLINE, Type.GROUPBY, layer, Column.of("Ladder")),
            SummationStep.of(Stage.ONLINE, Type.GROUPBY, layer)
        ));
        assertIllegal(List.of(
            SummationStep.of(Stage.ONLINE, Type.GROUPBY, layer),
            new SummationStep(Stage.ONLINE, Type.REDUCE, List.of(), "MEAN")
        ));
        assertIllegal(List.of(
            SummationStep.of(Stage.ONLINE, Type.GROUPBY, layer),
            new SummationStep(Stage.ONLINE, Type.CUSTOM, List.of(), "hook")
        ));
    }

    @Test
    void extendNeedsExactlyOneColumn() {
        assertIllegal(List.of(
            SummationStep.of(Stage.ONLINE, Type.GROUPBY, Column.of("Layer"), Column.of("Ladder")),
            SummationStep.of(Stage.ONLINE, Type.EXTEND_X, Column.of("Layer"), Column.of("Ladder"))
        ));
        assertIllegal(List.of(
            SummationStep.of(Stage.ONLINE, Type.GROUPBY, Column.of("Layer")),
            SummationStep.of(Stage.OFFLINE, Type.EXTEND_Y)
        ));
    }

    @Test
    void countIsOnlineOnly() {
        assertIllegal(List.of(
            SummationStep.of(Stage.ONLINE, Type.GROUPBY, Column.of("Layer")),
            SummationStep.of(Stage.OFFLINE, Type.COUNT)
        ));
    }

    @Test
    void parsesStageAndTypeNames() {
        assertEquals(Stage.ONLINE_HARVEST, Stage.from("online-harvest"));
        assertEquals(Type.EXTEND_X, Type.from(" extend_x "));
        assertThrows(IllegalArgumentException.class, () -> Type.from("SPLIT"));
        assertThrows(IllegalArgumentException.class, () -> Stage.from(null));
    }

    private static void assertIllegal(List<SummationStep> steps) {
        var ex = assertThrows(SpecificationException.class, () -> new SummationSpecification(steps));
        assertEquals(SpecificationException.ILLEGAL_STEP, ex.code());
    }
}
