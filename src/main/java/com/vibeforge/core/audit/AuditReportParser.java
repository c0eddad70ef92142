package com.vibeforge.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibeforge.llm.CodeFences;
import com.vibeforge.llm.CodeGenRole;
import com.vibeforge.llm.CollaboratorException;
import com.vibeforge.util.StableJson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the collaborator's audit text into concerns and open questions.
 *
 * The report as a whole must be JSON with a {@code fast_audit} / {@code full_audit}
 * root (either is accepted), or a bare object with a {@code concerns} array;
 * otherwise it is unusable output. Individual malformed concerns are dropped
 * with a warning rather than failing the audit.
 */
@Component
public class AuditReportParser {

    private static final Logger log = LoggerFactory.getLogger(AuditReportParser.class);

    private final ObjectMapper mapper = StableJson.mapper();

    public ParsedAudit parse(String text, AuditLevel level) {
        JsonNode root = readRoot(text);
        JsonNode body = locateBody(root, level);

        List<Concern> concerns = new ArrayList<>();
        Set<String>   seenIds  = new LinkedHashSet<>();
        for (JsonNode node : body.path("concerns")) {
            try {
                Concern concern = mapper.treeToValue(node, Concern.class);
                if (!seenIds.add(concern.getId())) {
                    log.warn("[AuditParser] Duplicate concern id {} in one report, keeping the first", concern.getId());
                    continue;
                }
                // line hashes are computed by the engine, never trusted from the report
                concerns.add(concern.getLineHashes().isEmpty() ? concern : concern.withLineHashes(List.of()));
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("[AuditParser] Dropping malformed concern {}: {}", node.path("id").asText("?"), e.getMessage());
            }
        }

        List<String> questions = new ArrayList<>();
        for (JsonNode q : body.path("open_questions")) {
            if (q.isTextual() && !q.asText().isBlank()) questions.add(q.asText().trim());
        }

        log.info("[AuditParser] Parsed {} concern(s), {} open question(s)", concerns.size(), questions.size());
        return new ParsedAudit(concerns, questions);
    }

    private JsonNode readRoot(String text) {
        String cleaned = CodeFences.strip(text);
        int start = cleaned.indexOf('{');
        int end   = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new CollaboratorException(CodeGenRole.AUDIT, "Audit report contains no JSON object", null);
        }
        try {
            return mapper.readTree(cleaned.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new CollaboratorException(CodeGenRole.AUDIT, "Audit report is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode locateBody(JsonNode root, AuditLevel level) {
        if (root.has(level.reportRootKey())) return root.get(level.reportRootKey());
        for (AuditLevel other : AuditLevel.values()) {
            if (root.has(other.reportRootKey())) {
                log.warn("[AuditParser] Asked for {} but report root is {}", level.reportRootKey(), other.reportRootKey());
                return root.get(other.reportRootKey());
            }
        }
        if (root.has("concerns")) return root;
        throw new CollaboratorException(CodeGenRole.AUDIT,
                "Audit report has no " + level.reportRootKey() + " root", null);
    }

    /** Concerns and open questions as the collaborator reported them, without line hashes. */
    public static final class ParsedAudit {
        private final List<Concern> concerns;
        private final List<String>  openQuestions;

        public ParsedAudit(List<Concern> concerns, List<String> openQuestions) {
            this.concerns      = List.copyOf(concerns);
            this.openQuestions = List.copyOf(openQuestions);
        }

        public List<Concern> getConcerns()      { return concerns; }
        public List<String>  getOpenQuestions() { return openQuestions; }
    }
}
