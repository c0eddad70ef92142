package com.vibeforge.core.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * AuditReconciler: decides which prior concerns survive a code change and merges
 * them with freshly reported ones. Pure: no I/O, no collaborator.
 *
 * Staleness is per concern:
 *   global        - reusable iff the whole-code hash is unchanged
 *   line-scoped   - reusable iff every referenced line still hashes the same
 */
public final class AuditReconciler {

    private static final Logger log = LoggerFactory.getLogger(AuditReconciler.class);

    private AuditReconciler() {}

    // =========================================================================
    // Staleness
    // =========================================================================

    public static boolean isReusable(Concern concern, String priorCodeHash,
                                     String currentCodeHash, Map<Integer, String> currentLineHashes) {
        if (concern.isGlobal()) {
            return Objects.equals(priorCodeHash, currentCodeHash);
        }
        List<Integer> lines  = concern.getLocation().getLines();
        List<String>  hashes = concern.getLineHashes();
        if (hashes.size() != lines.size()) return false;
        for (int i = 0; i < lines.size(); i++) {
            if (!hashes.get(i).equals(currentLineHashes.get(lines.get(i)))) return false;
        }
        return true;
    }

    public static Classification classify(AuditRecord prior, String currentCodeHash,
                                          Map<Integer, String> currentLineHashes) {
        List<Concern> reusable = new ArrayList<>();
        List<Concern> stale    = new ArrayList<>();
        for (Concern concern : prior.getConcerns()) {
            if (isReusable(concern, prior.getCodeHash(), currentCodeHash, currentLineHashes)) {
                reusable.add(concern);
            } else {
                stale.add(concern);
            }
        }
        return new Classification(reusable, stale);
    }

    /**
     * Lines whose hash differs between the two maps, over [1, max(prevMax, currMax)].
     * A line present on only one side counts as changed.
     */
    public static SortedSet<Integer> changedLines(Map<Integer, String> previous, Map<Integer, String> current) {
        int maxLine = Math.max(maxKey(previous), maxKey(current));
        SortedSet<Integer> changed = new TreeSet<>();
        for (int line = 1; line <= maxLine; line++) {
            if (!Objects.equals(previous.get(line), current.get(line))) changed.add(line);
        }
        return changed;
    }

    // =========================================================================
    // Merge
    // =========================================================================

    /**
     * Reused concerns first, in prior order, then the surviving fresh ones.
     *
     * A fresh line-scoped concern survives only if it touches a changed line (when
     * any changed lines are given) and at least one of its lines exists in the
     * current code; its line hashes are taken from {@code currentLineHashes}.
     * On an id collision the reused concern wins.
     */
    public static List<Concern> mergeConcerns(List<Concern> reused, List<Concern> fresh,
                                              Set<Integer> changedLines,
                                              Map<Integer, String> currentLineHashes) {
        List<Concern> merged = new ArrayList<>(reused);
        Set<String>   ids    = new LinkedHashSet<>();
        for (Concern c : reused) ids.add(c.getId());

        for (Concern concern : fresh) {
            Concern hashed;
            if (concern.isGlobal()) {
                hashed = concern.withLineHashes(List.of());
            } else {
                if (!changedLines.isEmpty() && Collections.disjoint(concern.getLocation().getLines(), changedLines)) {
                    log.debug("[Reconciler] Dropping {}: outside changed lines", concern.getId());
                    continue;
                }
                hashed = rehash(concern, currentLineHashes);
                if (hashed == null) {
                    log.warn("[Reconciler] Dropping {}: none of its lines {} exist in the current code",
                            concern.getId(), concern.getLocation());
                    continue;
                }
            }
            if (!ids.add(hashed.getId())) {
                log.info("[Reconciler] Keeping reused {} over fresh duplicate", hashed.getId());
                continue;
            }
            merged.add(hashed);
        }
        return merged;
    }

    /** Concatenate and de-duplicate, first occurrence wins. */
    public static List<String> mergeQuestions(List<String> prior, List<String> fresh) {
        Set<String> merged = new LinkedHashSet<>(prior);
        merged.addAll(fresh);
        return List.copyOf(merged);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static Concern rehash(Concern concern, Map<Integer, String> currentLineHashes) {
        List<Integer> kept   = new ArrayList<>();
        List<String>  hashes = new ArrayList<>();
        for (Integer line : concern.getLocation().getLines()) {
            String hash = currentLineHashes.get(line);
            if (hash != null) {
                kept.add(line);
                hashes.add(hash);
            }
        }
        if (kept.isEmpty()) return null;
        return concern.toBuilder()
                .location(ConcernLocation.lines(kept))
                .lineHashes(hashes)
                .build();
    }

    private static int maxKey(Map<Integer, String> map) {
        int max = 0;
        for (Integer key : map.keySet()) max = Math.max(max, key);
        return max;
    }

    /** Prior concerns split into reusable and stale, each in prior order. */
    public static final class Classification {
        private final List<Concern> reusable;
        private final List<Concern> stale;

        Classification(List<Concern> reusable, List<Concern> stale) {
            this.reusable = List.copyOf(reusable);
            this.stale    = List.copyOf(stale);
        }

        public List<Concern> getReusable() { return reusable; }
        public List<Concern> getStale()    { return stale; }
        public boolean       hasStale()    { return !stale.isEmpty(); }
    }
}
