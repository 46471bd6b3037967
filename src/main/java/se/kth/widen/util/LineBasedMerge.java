package se.kth.widen.util;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.SequenceComparator;
import org.eclipse.jgit.merge.MergeAlgorithm;
import org.eclipse.jgit.merge.MergeChunk;
import org.eclipse.jgit.merge.MergeResult;
import se.kth.widen.conflict.ConflictMarkers;
import se.kth.widen.conflict.ConflictRegionParser;
import se.kth.widen.exception.MergeException;

/**
 * Line-based three-way merge using JGit, producing conflict markers for overlapping changes.
 *
 * @author Simon Larsén
 */
public class LineBasedMerge {
    private static final LazyLogger LOGGER = new LazyLogger(LineBasedMerge.class);

    private LineBasedMerge() {}

    /**
     * Merge three revisions of a string using line-based merge. The left revision is the "ours"
     * side of each conflict, the right revision the "theirs" side.
     *
     * @param base The base revision.
     * @param left The left revision.
     * @param right The right revision.
     * @return A pair containing the merge and the amount of conflicts.
     * @throws MergeException If a revision already contains conflict markers.
     */
    public static Pair<String, Integer> merge(String base, String left, String right) {
        checkNoConflicts("base", base);
        checkNoConflicts("left", left);
        checkNoConflicts("right", right);

        RawText baseRaw = new RawText(base.getBytes(StandardCharsets.UTF_8));
        RawText leftRaw = new RawText(left.getBytes(StandardCharsets.UTF_8));
        RawText rightRaw = new RawText(right.getBytes(StandardCharsets.UTF_8));

        MergeAlgorithm merge = new MergeAlgorithm();
        MergeResult<RawText> res =
                merge.merge(
                        new SequenceComparator<RawText>() {
                            @Override
                            public boolean equals(RawText s, int i, RawText s1, int i1) {
                                return s.getString(i).equals(s1.getString(i1));
                            }

                            @Override
                            public int hash(RawText s, int i) {
                                return Objects.hash(s.getString(i));
                            }
                        },
                        baseRaw,
                        leftRaw,
                        rightRaw);

        Iterator<MergeChunk> it = res.iterator();
        List<RawText> seqs = res.getSequences();
        List<String> lines = new ArrayList<>();
        int numConflicts = 0;

        while (it.hasNext()) {
            MergeChunk chunk = it.next();
            MergeChunk.ConflictState state = chunk.getConflictState();

            if (state == MergeChunk.ConflictState.FIRST_CONFLICTING_RANGE) {
                numConflicts++;
                lines.add(ConflictMarkers.START_CONFLICT);
            } else if (state == MergeChunk.ConflictState.NEXT_CONFLICTING_RANGE) {
                lines.add(ConflictMarkers.MID_CONFLICT);
            } else if (state != MergeChunk.ConflictState.NO_CONFLICT) {
                // base ranges are not rendered
                continue;
            }

            RawText seq = seqs.get(chunk.getSequenceIndex());
            for (int i = chunk.getBegin(); i < chunk.getEnd(); i++) {
                lines.add(seq.getString(i));
            }

            if (state == MergeChunk.ConflictState.NEXT_CONFLICTING_RANGE) {
                lines.add(ConflictMarkers.END_CONFLICT);
            }
        }

        int conflicts = numConflicts;
        LOGGER.info(() -> "Line-based merge produced " + conflicts + " conflict(s)");
        return Pair.of(String.join("\n", lines), numConflicts);
    }

    private static void checkNoConflicts(String revision, String content) {
        if (ConflictRegionParser.countConflicts(content) > 0) {
            throw new MergeException("the " + revision + " revision contains conflict markers");
        }
    }
}
