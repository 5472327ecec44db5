package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the import IR as JSON.
 *
 * <p>Output is byte-stable for equal models: lists are ordered by {@link IrNormalizer}, map keys
 * are sorted, indentation is two spaces and the text ends with a newline. Reading ignores
 * properties this version does not know.</p>
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final ObjectWriter WRITER = MAPPER.writer(createPrettyPrinter());

    private IrJson() {}

    public static IrModel read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        return MAPPER.readValue(Files.readAllBytes(path), IrModel.class);
    }

    public static IrModel readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, IrModel.class);
    }

    /** Writes {@link #toJsonString} as UTF-8, creating parent directories. */
    public static void write(IrModel model, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, toJsonString(model), StandardCharsets.UTF_8);
    }

    public static String toJsonString(IrModel model) throws IOException {
        if (model == null) throw new IllegalArgumentException("model is null");
        return WRITER.writeValueAsString(IrNormalizer.normalize(model)) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
