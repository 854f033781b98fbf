package com.example.cratebridge.application.convert;

import com.example.cratebridge.domain.enumtype.CueType;
import com.example.cratebridge.domain.model.CueMarker;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps cue markers between the Traktor and rekordbox cue models. Both directions return copies and leave the
 * input untouched.
 *
 * <p>The two mappings are not inverses: rekordbox has memory cues and Traktor does not. Markers
 * induced by one direction are recognized by their start position in the other, so repeated round trips keep
 * the cue count stable.
 */
@Component
public class CueRemapper {

    static final String GRID_LABEL = "Grid";
    static final String MEMORY_LABEL_PREFIX = "Memory ";
    static final String HOT_CUE_LABEL_PREFIX = "Hot Cue ";

    private static final double SAME_POSITION_TOLERANCE_SEC = 0.001D;
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)\\s*$");

    public List<CueMarker> toRekordbox(List<CueMarker> cues, boolean mapFirstHotCueToMemory) {
        List<CueMarker> mapped = new ArrayList<>();
        if (cues == null) {
            return mapped;
        }
        boolean firstHotCueSeen = false;
        for (CueMarker cue : cues) {
            switch (cue.getType()) {
                case HOT_CUE:
                    if (mapFirstHotCueToMemory && !firstHotCueSeen
                            && !hasAt(cues, CueType.MEMORY_CUE, cue.getStartSeconds())) {
                        mapped.add(new CueMarker(CueType.MEMORY_CUE, cue.getStartSeconds(),
                                MEMORY_LABEL_PREFIX + (labelNumber(cue) + 1)));
                    }
                    firstHotCueSeen = true;
                    mapped.add(cue.copy());
                    break;
                case GRID:
                case BEAT:
                    mapped.add(new CueMarker(CueType.GRID, cue.getStartSeconds(), GRID_LABEL));
                    break;
                default:
                    mapped.add(cue.copy());
                    break;
            }
        }
        return mapped;
    }

    public List<CueMarker> toNml(List<CueMarker> cues, boolean mapMemoryToHotCue) {
        List<CueMarker> mapped = new ArrayList<>();
        if (cues == null) {
            return mapped;
        }
        int induced = 0;
        for (CueMarker cue : cues) {
            if (cue.getType() != CueType.MEMORY_CUE) {
                mapped.add(cue.copy());
                continue;
            }
            if (!mapMemoryToHotCue || hasAt(cues, CueType.HOT_CUE, cue.getStartSeconds())) {
                continue;
            }
            induced++;
            String suffix = lastToken(cue.getLabel());
            mapped.add(new CueMarker(CueType.HOT_CUE, cue.getStartSeconds(),
                    HOT_CUE_LABEL_PREFIX + (suffix == null ? String.valueOf(induced) : suffix)));
        }
        return mapped;
    }

    private static boolean hasAt(List<CueMarker> cues, CueType type, double startSeconds) {
        for (CueMarker cue : cues) {
            if (cue.getType() == type && Math.abs(cue.getStartSeconds() - startSeconds) < SAME_POSITION_TOLERANCE_SEC) {
                return true;
            }
        }
        return false;
    }

    /**
     * Numeric suffix of the label, else the pad slot, else 0.
     */
    static int labelNumber(CueMarker cue) {
        if (cue.getLabel() != null) {
            Matcher matcher = TRAILING_NUMBER.matcher(cue.getLabel());
            if (matcher.find()) {
                try {
                    return Integer.parseInt(matcher.group(1));
                } catch (NumberFormatException e) {
                    return Math.max(0, cue.getHotCueSlot());
                }
            }
        }
        return Math.max(0, cue.getHotCueSlot());
    }

    private static String lastToken(String label) {
        if (label == null || label.trim().isEmpty()) {
            return null;
        }
        String[] tokens = label.trim().split("\\s+");
        return tokens[tokens.length - 1];
    }
}
