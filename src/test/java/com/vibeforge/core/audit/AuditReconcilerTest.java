package com.vibeforge.core.audit;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

class AuditReconcilerTest {

    private static final String V1 = "a\nb\nc\nd";
    private static final String V2 = "a\nB\nc\nd";

    private static Concern atLines(String id, String code, Integer... lines) {
        SortedMap<Integer, String> hashes = LineHasher.lineHashes(code);
        Concern concern = Concern.builder(id, ConcernLocation.lines(lines)).summary(id).build();
        return concern.withLineHashes(concern.getLocation().getLines().stream().map(hashes::get).toList());
    }

    private static AuditRecord record(String code, List<Concern> concerns) {
        return new AuditRecord("fast-1", AuditLevel.FAST, "abc-v1", null,
                LineHasher.codeHash(code), LineHasher.lineHashes(code), concerns, List.of(), Instant.EPOCH);
    }

    @Test
    void testLineConcernReusableWhenItsLinesAreUnchanged() {
        Concern onThree = atLines("c3", V1, 3);

        assertTrue(AuditReconciler.isReusable(onThree, LineHasher.codeHash(V1),
                LineHasher.codeHash(V2), LineHasher.lineHashes(V2)));
    }

    @Test
    void testLineConcernStaleWhenAnyLineChanged() {
        Concern span = atLines("span", V1, 1, 2, 3);

        assertFalse(AuditReconciler.isReusable(span, LineHasher.codeHash(V1),
                LineHasher.codeHash(V2), LineHasher.lineHashes(V2)));
    }

    @Test
    void testGlobalConcernStaleOnAnyCodeChange() {
        Concern global = Concern.builder("g", ConcernLocation.GLOBAL).build();

        assertTrue(AuditReconciler.isReusable(global, LineHasher.codeHash(V1),
                LineHasher.codeHash(V1), LineHasher.lineHashes(V1)));
        assertFalse(AuditReconciler.isReusable(global, LineHasher.codeHash(V1),
                LineHasher.codeHash(V2), LineHasher.lineHashes(V2)));
    }

    @Test
    void testConcernWithoutStoredHashesIsStale() {
        Concern unhashed = Concern.builder("u", ConcernLocation.lines(1)).build();

        assertFalse(AuditReconciler.isReusable(unhashed, LineHasher.codeHash(V1),
                LineHasher.codeHash(V1), LineHasher.lineHashes(V1)));
    }

    @Test
    void testClassifyKeepsPriorOrder() {
        AuditRecord prior = record(V1, List.of(
                atLines("first", V1, 1),
                atLines("changed", V1, 2),
                Concern.builder("global", ConcernLocation.GLOBAL).build(),
                atLines("last", V1, 4)));

        AuditReconciler.Classification c = AuditReconciler.classify(prior,
                LineHasher.codeHash(V2), LineHasher.lineHashes(V2));

        assertEquals(List.of("first", "last"), c.getReusable().stream().map(Concern::getId).toList());
        assertEquals(List.of("changed", "global"), c.getStale().stream().map(Concern::getId).toList());
        assertTrue(c.hasStale());
    }

    @Test
    void testChangedLinesIsSymmetricDifference() {
        assertEquals(Set.of(2), AuditReconciler.changedLines(LineHasher.lineHashes(V1), LineHasher.lineHashes(V2)));
        assertEquals(Set.of(5, 6), AuditReconciler.changedLines(
                LineHasher.lineHashes(V1), LineHasher.lineHashes(V1 + "\ne\nf")));
        assertEquals(Set.of(4), AuditReconciler.changedLines(
                LineHasher.lineHashes(V1), LineHasher.lineHashes("a\nb\nc")));
        assertTrue(AuditReconciler.changedLines(LineHasher.lineHashes(V1), LineHasher.lineHashes(V1)).isEmpty());
    }

    @Test
    void testMergeFiltersFreshConcernsToChangedLines() {
        Map<Integer, String> current = LineHasher.lineHashes(V2);
        List<Concern> reused = List.of(atLines("kept", V1, 1));
        List<Concern> fresh = List.of(
                Concern.builder("inside", ConcernLocation.lines(2)).build(),
                Concern.builder("outside", ConcernLocation.lines(4)).build(),
                Concern.builder("code_wide", ConcernLocation.GLOBAL).build());

        List<Concern> merged = AuditReconciler.mergeConcerns(reused, fresh, Set.of(2), current);

        assertEquals(List.of("kept", "inside", "code_wide"), merged.stream().map(Concern::getId).toList());
        assertEquals(List.of(current.get(2)), merged.get(1).getLineHashes());
    }

    @Test
    void testMergeDropsLinesPastEndOfCode() {
        Map<Integer, String> current = LineHasher.lineHashes(V1);
        List<Concern> fresh = List.of(
                Concern.builder("partly", ConcernLocation.lines(4, 9)).build(),
                Concern.builder("gone", ConcernLocation.lines(40)).build());

        List<Concern> merged = AuditReconciler.mergeConcerns(List.of(), fresh, Set.of(), current);

        assertEquals(1, merged.size());
        assertEquals(List.of(4), merged.get(0).getLocation().getLines());
    }

    @Test
    void testReusedConcernWinsIdCollision() {
        Concern reused = atLines("dup", V1, 1).toBuilder().summary("old").build();
        Concern fresh  = Concern.builder("dup", ConcernLocation.lines(2)).summary("new").build();

        List<Concern> merged = AuditReconciler.mergeConcerns(List.of(reused), List.of(fresh), Set.of(2),
                LineHasher.lineHashes(V2));

        assertEquals(1, merged.size());
        assertEquals("old", merged.get(0).getSummary());
    }

    @Test
    void testQuestionsDeduplicatedFirstWins() {
        assertEquals(List.of("q1", "q2", "q3"),
                AuditReconciler.mergeQuestions(List.of("q1", "q2"), List.of("q2", "q3", "q1")));
    }
}
