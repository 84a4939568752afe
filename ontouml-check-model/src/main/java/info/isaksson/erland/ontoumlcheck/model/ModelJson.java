package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON snapshot codec for {@link OntoModel}.
 *
 * <p>Writing is deterministic: properties follow the declared order, map keys are sorted and
 * the document ends with a newline.</p>
 */
public final class ModelJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private ModelJson() {}

    public static OntoModel read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, OntoModel.class);
        }
    }

    /** Parse a model snapshot from a JSON string. */
    public static OntoModel readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json must not be null");
        return MAPPER.readValue(json, OntoModel.class);
    }

    public static void write(OntoModel model, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        if (model == null) throw new IllegalArgumentException("model must not be null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, model);
            // Trailing newline keeps diffs clean.
            out.write('\n');
        }
    }

    public static String toJsonString(OntoModel model) throws IOException {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        return MAPPER.writer(PRETTY).writeValueAsString(model) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        // Editors add view-only attributes (positions, colors); the validator ignores them.
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
