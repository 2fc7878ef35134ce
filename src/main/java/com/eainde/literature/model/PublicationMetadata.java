package com.eainde.literature.model;

import lombok.Builder;

import java.util.List;

/**
 * Bibliographic fields extracted by the metadata stage. Every field is optional.
 */
@Builder(toBuilder = true)
public record PublicationMetadata(
        String title,
        String firstAuthorLastname,
        List<String> authors,
        Integer publicationYear,
        String doi,
        String journal,
        String volume,
        String issue,
        String pages,
        String issn,
        String publisher,
        List<String> bibliography,
        String language
) {

    public static PublicationMetadata empty() {
        return PublicationMetadata.builder().build();
    }

    /**
     * This metadata with every null field taken from {@code other}; present values are kept.
     */
    public PublicationMetadata fillGapsFrom(PublicationMetadata other) {
        if (other == null) return this;
        return PublicationMetadata.builder()
                .title(either(title, other.title))
                .firstAuthorLastname(either(firstAuthorLastname, other.firstAuthorLastname))
                .authors(either(authors, other.authors))
                .publicationYear(either(publicationYear, other.publicationYear))
                .doi(either(doi, other.doi))
                .journal(either(journal, other.journal))
                .volume(either(volume, other.volume))
                .issue(either(issue, other.issue))
                .pages(either(pages, other.pages))
                .issn(either(issn, other.issn))
                .publisher(either(publisher, other.publisher))
                .bibliography(either(bibliography, other.bibliography))
                .language(either(language, other.language))
                .build();
    }

    /** At least one of title, first author, publication year is present. */
    public boolean hasCoreFields() {
        return notBlank(title) || notBlank(firstAuthorLastname) || publicationYear != null;
    }

    private static <T> T either(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
