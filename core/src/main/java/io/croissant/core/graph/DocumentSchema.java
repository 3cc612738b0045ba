package io.croissant.core.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.Set;

/**
 * Checks the envelope of a document (which properties hold arrays, objects or strings) against
 * the bundled JSON Schema 2020-12 {@code croissant-document.schema.json}. Violations are
 * appended as error issues; the semantics of each node are left to the builder.
 */
final class DocumentSchema {

    private static final String RESOURCE = "/croissant-document.schema.json";
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final JsonSchema SCHEMA = load();

    private DocumentSchema() {}

    static void validate(JsonNode document, Issues issues, Context context) {
        Set<ValidationMessage> violations = SCHEMA.validate(document);
        violations.stream()
                .map(ValidationMessage::getMessage)
                .sorted(Comparator.naturalOrder())
                .forEach(message -> issues.error(context, "Invalid document structure: " + message + "."));
    }

    private static JsonSchema load() {
        try (InputStream in = DocumentSchema.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }
}
