package com.example.cratebridge.application.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cratebridge.domain.enumtype.CueType;
import com.example.cratebridge.domain.model.CueMarker;
import com.example.cratebridge.support.TestLibraries;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class CueRemapperTest {

    private final CueRemapper remapper = new CueRemapper();

    @Test
    void firstHotCueShouldGainMemoryCueWhenEnabled() {
        List<CueMarker> cues = Arrays.asList(
                TestLibraries.hotCue(1.5D, "Hot Cue 1", 0),
                TestLibraries.hotCue(30D, "Hot Cue 2", 1));

        List<CueMarker> mapped = remapper.toRekordbox(cues, true);

        assertEquals(3, mapped.size());
        assertEquals(CueType.MEMORY_CUE, mapped.get(0).getType());
        assertEquals("Memory 2", mapped.get(0).getLabel());
        assertEquals(1.5D, mapped.get(0).getStartSeconds(), 1e-9);
        assertEquals(CueType.HOT_CUE, mapped.get(1).getType());
        assertEquals(CueType.HOT_CUE, mapped.get(2).getType());
    }

    @Test
    void hotCuesShouldStayUntouchedWhenMappingDisabled() {
        List<CueMarker> cues = Arrays.asList(TestLibraries.hotCue(1.5D, "Hot Cue 1", 0));

        List<CueMarker> mapped = remapper.toRekordbox(cues, false);

        assertEquals(1, mapped.size());
        assertEquals(CueType.HOT_CUE, mapped.get(0).getType());
        assertTrue(mapped.get(0) != cues.get(0));
    }

    @Test
    void existingMemoryCueAtSameStartShouldNotBeDuplicated() {
        List<CueMarker> cues = Arrays.asList(
                new CueMarker(CueType.MEMORY_CUE, 1.5D, "Memory 2"),
                TestLibraries.hotCue(1.5D, "Hot Cue 1", 0));

        List<CueMarker> mapped = remapper.toRekordbox(cues, true);

        assertEquals(2, mapped.size());
    }

    @Test
    void gridAndBeatMarkersShouldBecomeGrid() {
        List<CueMarker> cues = Arrays.asList(
                new CueMarker(CueType.GRID, 0.1D, "Beat anchor"),
                new CueMarker(CueType.BEAT, 0.6D, "Beat"));

        List<CueMarker> mapped = remapper.toRekordbox(cues, false);

        for (CueMarker cue : mapped) {
            assertEquals(CueType.GRID, cue.getType());
            assertEquals("Grid", cue.getLabel());
        }
        assertEquals(0.6D, mapped.get(1).getStartSeconds(), 1e-9);
    }

    @Test
    void memoryCuesShouldBeDroppedUnlessMapped() {
        List<CueMarker> cues = Arrays.asList(
                new CueMarker(CueType.MEMORY_CUE, 12D, "Memory 3"),
                new CueMarker(CueType.LOOP, 20D, "Loop"));

        List<CueMarker> dropped = remapper.toNml(cues, false);
        List<CueMarker> mapped = remapper.toNml(cues, true);

        assertEquals(1, dropped.size());
        assertEquals(CueType.LOOP, dropped.get(0).getType());
        assertEquals(2, mapped.size());
        assertEquals(CueType.HOT_CUE, mapped.get(0).getType());
        assertEquals("Hot Cue 3", mapped.get(0).getLabel());
    }

    @Test
    void unlabeledMemoryCueShouldBeNumberedByOrder() {
        List<CueMarker> cues = Arrays.asList(
                new CueMarker(CueType.MEMORY_CUE, 12D, ""),
                new CueMarker(CueType.MEMORY_CUE, 40D, null));

        List<CueMarker> mapped = remapper.toNml(cues, true);

        assertEquals("Hot Cue 1", mapped.get(0).getLabel());
        assertEquals("Hot Cue 2", mapped.get(1).getLabel());
    }

    @Test
    void repeatedRoundTripsShouldKeepCueCountStable() {
        List<CueMarker> cues = new ArrayList<>(Arrays.asList(
                TestLibraries.hotCue(1.5D, "Hot Cue 1", 0),
                new CueMarker(CueType.LOOP, 64D, "Loop")));

        List<CueMarker> rekordbox = remapper.toRekordbox(cues, true);
        List<CueMarker> nml = remapper.toNml(rekordbox, true);
        List<CueMarker> rekordboxAgain = remapper.toRekordbox(nml, true);
        List<CueMarker> nmlAgain = remapper.toNml(rekordboxAgain, true);

        assertEquals(3, rekordbox.size());
        assertEquals(2, nml.size());
        assertEquals(rekordbox.size(), rekordboxAgain.size());
        assertEquals(nml.size(), nmlAgain.size());
    }

    @Test
    void labelNumberShouldFallBackToSlot() {
        assertEquals(4, CueRemapper.labelNumber(TestLibraries.hotCue(0D, "Hot Cue 4", 0)));
        assertEquals(2, CueRemapper.labelNumber(TestLibraries.hotCue(0D, "Drop", 2)));
        assertEquals(0, CueRemapper.labelNumber(new CueMarker(CueType.HOT_CUE, 0D, null)));
    }
}
