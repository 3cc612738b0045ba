package io.croissant.core.model;

import java.util.Set;

/**
 * Vocabulary of the metadata document: the compact keys read from the wire and the expanded
 * IRIs used when reporting problems about them.
 */
public final class Terms {

    public static final String SCHEMA_ORG = "https://schema.org/";
    public static final String ML_COMMONS = "http://mlcommons.org/schema/";

    public static final String TYPE = "@type";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String LICENSE = "license";
    public static final String URL = "url";
    public static final String CITATION = "citation";
    public static final String VERSION = "version";
    public static final String CREATOR = "creator";
    public static final String CONTRIBUTOR = "contributor";
    public static final String DISTRIBUTION = "distribution";
    public static final String RECORD_SET = "recordSet";
    public static final String FIELD = "field";
    public static final String SUB_FIELD = "subField";
    public static final String CONTENT_URL = "contentUrl";
    public static final String CONTENT_SIZE = "contentSize";
    public static final String ENCODING_FORMAT = "encodingFormat";
    public static final String MD5 = "md5";
    public static final String SHA256 = "sha256";
    public static final String CONTAINED_IN = "containedIn";
    public static final String INCLUDES = "includes";
    public static final String KEY = "key";
    public static final String DATA = "data";
    public static final String DATA_TYPE = "dataType";
    public static final String SOURCE = "source";
    public static final String REFERENCES = "references";
    public static final String APPLY_TRANSFORM = "applyTransform";
    public static final String REGEX = "regex";

    private static final Set<String> ML_COMMONS_TERMS = Set.of(
            RECORD_SET, FIELD, SUB_FIELD, INCLUDES, KEY, DATA, DATA_TYPE, SOURCE, REFERENCES, APPLY_TRANSFORM, REGEX);

    private Terms() {}

    /**
     * Expands a compact property key to its IRI, e.g. {@code name} to
     * {@code https://schema.org/name}.
     */
    public static String iri(String property) {
        return (ML_COMMONS_TERMS.contains(property) ? ML_COMMONS : SCHEMA_ORG) + property;
    }

    /**
     * Expands a compact type tag ({@code sc:Text}, {@code ml:Field}) to its IRI. Tags that are
     * already expanded, or carry an unknown prefix, are returned unchanged.
     */
    public static String expand(String tag) {
        if (tag == null) {
            return null;
        }
        if (tag.startsWith("sc:")) {
            return SCHEMA_ORG + tag.substring(3);
        }
        if (tag.startsWith("ml:")) {
            return ML_COMMONS + tag.substring(3);
        }
        return tag;
    }
}
