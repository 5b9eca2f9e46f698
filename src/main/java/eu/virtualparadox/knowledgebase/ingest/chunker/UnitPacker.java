package eu.virtualparadox.knowledgebase.ingest.chunker;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy packing of contiguous units into groups of at most {@code maxTokens}.
 * <p>
 * Each group after the first repeats a tail of its predecessor as overlap. A unit larger
 * than {@code maxTokens} forms a group of its own. A last group below {@code minTokens}
 * is folded into the one before it.
 */
final class UnitPacker {

    /**
     * How many trailing units of a finished group the next group starts with.
     */
    @FunctionalInterface
    interface OverlapPolicy {
        int unitsToRepeat(List<Unit> finishedGroup);
    }

    static final OverlapPolicy NO_OVERLAP = group -> 0;

    private UnitPacker() {
    }

    /**
     * Repeats trailing units whose combined size stays within {@code tokens}.
     */
    static OverlapPolicy overlapTokens(final int tokens) {
        return group -> {
            int sum = 0;
            int n = 0;
            for (int i = group.size() - 1; i > 0; i--) {
                sum += group.get(i).tokens();
                if (sum > tokens) {
                    break;
                }
                n++;
            }
            return n;
        };
    }

    /**
     * Repeats trailing units covering at most {@code lines} lines.
     */
    static OverlapPolicy overlapLines(final int lines) {
        return group -> {
            int sum = 0;
            int n = 0;
            for (int i = group.size() - 1; i > 0; i--) {
                sum += group.get(i).lines();
                if (sum > lines) {
                    break;
                }
                n++;
            }
            return n;
        };
    }

    /**
     * @return half-open index ranges {@code [from, to)} into {@code units}
     */
    static List<int[]> pack(final List<Unit> units,
                            final int minTokens,
                            final int maxTokens,
                            final OverlapPolicy overlap) {
        final List<int[]> groups = new ArrayList<>();
        if (units.isEmpty()) {
            return groups;
        }

        int from = 0;
        int tokens = 0;
        int i = 0;
        while (i < units.size()) {
            final Unit u = units.get(i);
            final boolean fresh = i == from;
            if (!fresh && tokens + u.tokens() > maxTokens) {
                groups.add(new int[]{from, i});
                // never repeat the whole group, or packing would not advance
                final int repeat = Math.min(overlap.unitsToRepeat(units.subList(from, i)), i - from - 1);
                from = i - Math.max(0, repeat);
                tokens = 0;
                for (int j = from; j < i; j++) {
                    tokens += units.get(j).tokens();
                }
                if (tokens + u.tokens() > maxTokens) {
                    // overlap plus this unit would not fit; start clean
                    from = i;
                    tokens = 0;
                }
                continue;
            }
            tokens += u.tokens();
            i++;
        }
        groups.add(new int[]{from, units.size()});

        if (groups.size() > 1) {
            final int[] last = groups.get(groups.size() - 1);
            int lastTokens = 0;
            for (int j = last[0]; j < last[1]; j++) {
                lastTokens += units.get(j).tokens();
            }
            if (lastTokens < minTokens || lastTokens == 0) {
                groups.remove(groups.size() - 1);
                groups.get(groups.size() - 1)[1] = last[1];
            }
        }
        return groups;
    }

    static int start(final List<Unit> units, final int[] group) {
        return units.get(group[0]).start();
    }

    static int end(final List<Unit> units, final int[] group) {
        return units.get(group[1] - 1).end();
    }
}
