package com.eainde.literature.crossref;

import com.eainde.literature.model.PublicationMetadata;
import com.eainde.literature.util.TextUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Looks up a publication in the CrossRef works API.
 *
 * <p>A DOI is resolved directly. Without one, or when CrossRef does not know the DOI,
 * the title and first author are searched and the best hit is accepted only if its
 * title matches the one given.</p>
 */
@Log4j2
public class CrossRefClient {

    private static final String[] DATE_FIELDS = {"published-print", "published-online", "issued"};

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String userAgent;
    private final ObjectMapper objectMapper;

    public CrossRefClient(OkHttpClient httpClient, String baseUrl, String mailto, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.userAgent = TextUtils.isBlank(mailto)
                ? "literature-pipeline"
                : "literature-pipeline (mailto:" + mailto + ")";
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IOException when CrossRef cannot be reached or answers with an error other than 404
     */
    public Optional<PublicationMetadata> lookup(PublicationMetadata known) throws IOException {
        if (!TextUtils.isBlank(known.doi())) {
            HttpUrl url = baseUrl.newBuilder().addPathSegment("works").addPathSegment(known.doi().trim()).build();
            Optional<JsonNode> work = get(url).map(root -> root.path("message"));
            if (work.isPresent()) {
                log.debug("CrossRef resolved DOI {}", known.doi());
                return Optional.of(toMetadata(work.get()));
            }
            log.debug("CrossRef does not know DOI {}", known.doi());
        }

        String author = firstAuthor(known);
        if (TextUtils.isBlank(known.title()) || TextUtils.isBlank(author)) {
            return Optional.empty();
        }
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("works")
                .addQueryParameter("query.bibliographic", known.title())
                .addQueryParameter("query.author", author)
                .addQueryParameter("rows", "1")
                .build();
        Optional<JsonNode> hit = get(url)
                .map(root -> root.path("message").path("items"))
                .filter(items -> items.isArray() && !items.isEmpty())
                .map(items -> items.get(0));
        if (hit.isEmpty()) {
            return Optional.empty();
        }
        PublicationMetadata found = toMetadata(hit.get());
        if (!sameTitle(known.title(), found.title())) {
            log.info("CrossRef best match '{}' does not match title '{}', ignoring it", found.title(), known.title());
            return Optional.empty();
        }
        return Optional.of(found);
    }

    private Optional<JsonNode> get(HttpUrl url) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw new IOException("CrossRef call failed: " + response.code() + " " + response.message());
            }
            if (body == null) {
                throw new IOException("CrossRef returned an empty body for " + url);
            }
            return Optional.of(objectMapper.readTree(body.string()));
        }
    }

    // =========================================================================
    //  Mapping
    // =========================================================================

    static PublicationMetadata toMetadata(JsonNode work) {
        List<String> authors = new ArrayList<>();
        String firstFamily = null;
        for (JsonNode author : work.path("author")) {
            String given = text(author, "given");
            String family = text(author, "family");
            if (family == null && given == null) continue;
            if (firstFamily == null) firstFamily = family != null ? family : given;
            authors.add(family == null ? given : given == null ? family : family + ", " + given);
        }

        return PublicationMetadata.builder()
                .title(first(work, "title"))
                .firstAuthorLastname(firstFamily)
                .authors(authors.isEmpty() ? null : authors)
                .publicationYear(year(work))
                .doi(text(work, "DOI"))
                .journal(first(work, "container-title"))
                .volume(text(work, "volume"))
                .issue(text(work, "issue"))
                .pages(text(work, "page"))
                .issn(first(work, "ISSN"))
                .publisher(text(work, "publisher"))
                .language(text(work, "language"))
                .build();
    }

    /** First {@code date-parts} year of the print date, else the online date, else the issue date. */
    static Integer year(JsonNode work) {
        for (String field : DATE_FIELDS) {
            JsonNode year = work.path(field).path("date-parts").path(0).path(0);
            if (year.canConvertToInt() && year.asInt() > 0) {
                return year.asInt();
            }
        }
        return null;
    }

    static boolean sameTitle(String a, String b) {
        return a != null && b != null && normalize(a).equals(normalize(b));
    }

    private static String normalize(String title) {
        return title.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ").trim();
    }

    private static String firstAuthor(PublicationMetadata known) {
        if (!TextUtils.isBlank(known.firstAuthorLastname())) return known.firstAuthorLastname();
        return known.authors() != null && !known.authors().isEmpty() ? known.authors().get(0) : null;
    }

    private static String first(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isArray()) {
            return value.isEmpty() ? null : blankToNull(value.get(0).asText());
        }
        return text(node, field);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        return blankToNull(value.asText());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
