package com.eainde.literature.orchestrator;

import com.eainde.literature.exception.PipelineConfigurationException;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Per-stage forcing directive, validated once at the pipeline boundary.
 *
 * <p>Text form: empty, {@code none} or {@code false} for no force; {@code all} or
 * {@code true} to force every document; a comma-separated list of document ids
 * otherwise. Anything else is a configuration error.</p>
 */
public sealed interface ForceDirective
        permits ForceDirective.NoForce, ForceDirective.ForceAll, ForceDirective.ForceSpecific {

    boolean appliesTo(long documentId);

    static ForceDirective none() {
        return new NoForce();
    }

    static ForceDirective all() {
        return new ForceAll();
    }

    static ForceDirective of(Set<Long> documentIds) {
        return new ForceSpecific(documentIds);
    }

    static ForceDirective parse(String value) {
        if (value == null) return none();
        String text = value.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty() || text.equals("none") || text.equals("false")) return none();
        if (text.equals("all") || text.equals("true")) return all();

        Set<Long> ids = new LinkedHashSet<>();
        for (String part : text.split(",")) {
            String token = part.trim();
            if (!token.matches("\\d{1,18}")) {
                throw new PipelineConfigurationException(
                        "Invalid forcing directive '" + value + "': expected none, all, or comma-separated document ids");
            }
            long id = Long.parseLong(token);
            if (id <= 0) {
                throw new PipelineConfigurationException(
                        "Invalid forcing directive '" + value + "': document ids must be positive");
            }
            ids.add(id);
        }
        if (ids.isEmpty()) {
            throw new PipelineConfigurationException(
                    "Invalid forcing directive '" + value + "': no document ids given");
        }
        return of(ids);
    }

    record NoForce() implements ForceDirective {
        @Override
        public boolean appliesTo(long documentId) {
            return false;
        }
    }

    record ForceAll() implements ForceDirective {
        @Override
        public boolean appliesTo(long documentId) {
            return true;
        }
    }

    record ForceSpecific(Set<Long> documentIds) implements ForceDirective {
        public ForceSpecific {
            if (documentIds == null || documentIds.isEmpty()) {
                throw new PipelineConfigurationException("A specific forcing directive needs at least one document id");
            }
            documentIds = Set.copyOf(documentIds);
        }

        @Override
        public boolean appliesTo(long documentId) {
            return documentIds.contains(documentId);
        }
    }
}
