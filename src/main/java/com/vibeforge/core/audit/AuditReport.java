package com.vibeforge.core.audit;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of one RunAudit: the record now current for the artifact plus how it was reached.
 */
public final class AuditReport {

    /** How the record was produced. */
    public enum Source {
        /** Prior record returned verbatim; nothing written, no collaborator call. */
        REUSED,
        /** Prior record copied onto a revision unchanged from its base; no collaborator call. */
        INHERITED,
        /** Collaborator consulted, result merged with reusable prior concerns. */
        RECONCILED,
        /** No prior record used; collaborator consulted unscoped. */
        FRESH
    }

    private final AuditRecord        record;
    private final Source             source;
    private final List<String>       reusedConcernIds;
    private final List<String>       staleConcernIds;
    private final SortedSet<Integer> changedLines;
    private final int                collaboratorCalls;

    public AuditReport(AuditRecord record, Source source, List<String> reusedConcernIds,
                       List<String> staleConcernIds, Collection<Integer> changedLines, int collaboratorCalls) {
        this.record            = record;
        this.source            = source;
        this.reusedConcernIds  = List.copyOf(reusedConcernIds);
        this.staleConcernIds   = List.copyOf(staleConcernIds);
        this.changedLines      = Collections.unmodifiableSortedSet(new TreeSet<>(changedLines));
        this.collaboratorCalls = collaboratorCalls;
    }

    public AuditRecord        getRecord()            { return record; }
    public Source             getSource()            { return source; }
    public List<String>       getReusedConcernIds()  { return reusedConcernIds; }
    public List<String>       getStaleConcernIds()   { return staleConcernIds; }
    public SortedSet<Integer> getChangedLines()      { return changedLines; }
    public int                getCollaboratorCalls() { return collaboratorCalls; }

    public List<Concern> getConcerns()      { return record.getConcerns(); }
    public List<String>  getOpenQuestions() { return record.getOpenQuestions(); }

    @Override
    public String toString() {
        return "AuditReport{" + source + ", " + record + ", stale=" + staleConcernIds
                + ", changedLines=" + changedLines.size() + "}";
    }
}
