package de.bsommerfeld.gamesync.updater.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.gamesync.updater.model.ContentEntry;
import de.bsommerfeld.gamesync.updater.model.ContentScope;
import de.bsommerfeld.gamesync.updater.model.DirEntry;
import de.bsommerfeld.gamesync.updater.model.FileEntry;
import de.bsommerfeld.gamesync.updater.model.Manifest;
import de.bsommerfeld.gamesync.updater.model.SignedManifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON mapping of manifests and their signed wire envelope.
 *
 * <h3>Wire format</h3>
 * <pre>{@code
 * {
 *   "manifest": {
 *     "contentScope": "client",
 *     "generatedAt": "2024-05-01T12:00:00Z",
 *     "root": { "type": "dir", "path": "", "entries": {
 *       "game.jar": { "type": "file", "path": "game.jar", "size": 1024, "hash": "9f86d0..." }
 *     } }
 *   },
 *   "signature": "5c3a..."
 * }
 * }</pre>
 *
 * <h3>Canonical form</h3>
 * The signed bytes are the {@code manifest} object written as compact UTF-8
 * JSON with every object's keys sorted. Canonicalization works on the raw
 * JSON tree, so a client can check the signature before interpreting any
 * path in it.
 */
public final class ManifestCodec {

    static final String MANIFEST = "manifest";
    static final String SIGNATURE = "signature";

    private static final String ROOT = "root";
    private static final String GENERATED_AT = "generatedAt";
    private static final String CONTENT_SCOPE = "contentScope";
    private static final String TYPE = "type";
    private static final String PATH = "path";
    private static final String ENTRIES = "entries";
    private static final String SIZE = "size";
    private static final String HASH = "hash";
    private static final String TYPE_DIR = "dir";
    private static final String TYPE_FILE = "file";

    private final ObjectMapper mapper;
    private final JsonNodeFactory nodes;

    public ManifestCodec() {
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
        this.nodes = mapper.getNodeFactory();
    }

    // =====================================================================
    // Encoding
    // =====================================================================

    /** Canonical bytes of a manifest, as signed by the publisher. */
    public byte[] canonicalBytes(Manifest manifest) {
        return canonicalize(toJson(manifest));
    }

    /** Serializes a signed manifest into its wire envelope. */
    public String toWireJson(SignedManifest signed) {
        ObjectNode envelope = nodes.objectNode();
        envelope.set(MANIFEST, parseTree(signed.manifestBytes()));
        envelope.put(SIGNATURE, signed.signature());
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize manifest envelope", e);
        }
    }

    ObjectNode toJson(Manifest manifest) {
        ObjectNode node = nodes.objectNode();
        node.set(ROOT, entryToJson(manifest.root()));
        node.put(GENERATED_AT, manifest.generatedAt().toString());
        node.put(CONTENT_SCOPE, manifest.contentScope().wireName());
        return node;
    }

    private ObjectNode entryToJson(ContentEntry entry) {
        ObjectNode node = nodes.objectNode();
        if (entry instanceof FileEntry file) {
            node.put(TYPE, TYPE_FILE);
            node.put(PATH, file.relativePath());
            node.put(SIZE, file.size());
            node.put(HASH, file.contentHash());
        } else if (entry instanceof DirEntry dir) {
            node.put(TYPE, TYPE_DIR);
            node.put(PATH, dir.relativePath());
            ObjectNode children = node.putObject(ENTRIES);
            dir.children().forEach((name, child) -> children.set(name, entryToJson(child)));
        }
        return node;
    }

    // =====================================================================
    // Canonicalization
    // =====================================================================

    /**
     * Writes any JSON tree in canonical form: compact, keys sorted at every
     * level, array order preserved.
     */
    public byte[] canonicalize(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(sorted(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize canonical JSON", e);
        }
    }

    /** Parses bytes of any JSON shape and returns their canonical form. */
    public byte[] canonicalize(byte[] json) {
        return canonicalize(parseTree(json));
    }

    private JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> fields = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                fields.put(field.getKey(), sorted(field.getValue()));
            }
            ObjectNode out = nodes.objectNode();
            fields.forEach(out::set);
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = nodes.arrayNode();
            node.forEach(element -> out.add(sorted(element)));
            return out;
        }
        return node;
    }

    // =====================================================================
    // Decoding
    // =====================================================================

    /**
     * Reads the outer envelope only. The manifest payload is returned as an
     * uninterpreted tree.
     *
     * @throws ManifestFormatException if the JSON is malformed or a field is missing
     */
    public Envelope readEnvelope(String wireJson) {
        JsonNode envelope = parseTree(wireJson.getBytes(StandardCharsets.UTF_8));
        if (!envelope.isObject())
            throw new ManifestFormatException("Envelope is not a JSON object");
        JsonNode manifest = envelope.get(MANIFEST);
        JsonNode signature = envelope.get(SIGNATURE);
        if (manifest == null || !manifest.isObject())
            throw new ManifestFormatException("Missing 'manifest' object");
        if (signature == null || !signature.isTextual())
            throw new ManifestFormatException("Missing 'signature' string");
        return new Envelope(manifest, signature.asText());
    }

    /**
     * Builds a {@link Manifest} from a payload tree. Path validation happens
     * while the entries are constructed.
     *
     * @throws ManifestFormatException                                 for structural problems
     * @throws de.bsommerfeld.gamesync.updater.model.PathEscapeException for unsafe paths
     */
    public Manifest decode(JsonNode manifest) {
        JsonNode root = required(manifest, ROOT);
        ContentEntry rootEntry = entryFromJson(root);
        if (!(rootEntry instanceof DirEntry dir))
            throw new ManifestFormatException("Manifest root is not a directory");

        Instant generatedAt;
        try {
            generatedAt = Instant.parse(requiredText(manifest, GENERATED_AT));
        } catch (DateTimeParseException e) {
            throw new ManifestFormatException("Invalid 'generatedAt' timestamp", e);
        }

        ContentScope scope;
        try {
            scope = ContentScope.fromWireName(requiredText(manifest, CONTENT_SCOPE));
        } catch (IllegalArgumentException e) {
            throw new ManifestFormatException(e.getMessage(), e);
        }
        return new Manifest(dir, generatedAt, scope);
    }

    /** Decodes canonical manifest bytes. */
    public Manifest decode(byte[] manifestBytes) {
        return decode(parseTree(manifestBytes));
    }

    private ContentEntry entryFromJson(JsonNode node) {
        if (!node.isObject())
            throw new ManifestFormatException("Entry is not a JSON object");

        String type = requiredText(node, TYPE);
        String path = requiredText(node, PATH);
        switch (type) {
            case TYPE_FILE -> {
                JsonNode size = required(node, SIZE);
                if (!size.canConvertToLong() || !size.isIntegralNumber())
                    throw new ManifestFormatException("Invalid size for '" + path + "'");
                try {
                    return new FileEntry(path, size.longValue(), requiredText(node, HASH));
                } catch (IllegalArgumentException e) {
                    throw new ManifestFormatException(e.getMessage(), e);
                }
            }
            case TYPE_DIR -> {
                JsonNode entries = required(node, ENTRIES);
                if (!entries.isObject())
                    throw new ManifestFormatException("'entries' of '" + path + "' is not an object");
                TreeMap<String, ContentEntry> children = new TreeMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = entries.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> child = it.next();
                    children.put(child.getKey(), entryFromJson(child.getValue()));
                }
                return new DirEntry(path, children);
            }
            default -> throw new ManifestFormatException("Unknown entry type '" + type + "' at '" + path + "'");
        }
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull())
            throw new ManifestFormatException("Missing field '" + field + "'");
        return value;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isTextual())
            throw new ManifestFormatException("Field '" + field + "' is not a string");
        return value.asText();
    }

    private JsonNode parseTree(byte[] json) {
        try {
            JsonNode tree = mapper.readTree(json);
            if (tree == null || tree.isMissingNode())
                throw new ManifestFormatException("Empty JSON document");
            return tree;
        } catch (IOException e) {
            throw new ManifestFormatException("Malformed JSON: " + e.getMessage(), e);
        }
    }

    /** Outer envelope as read from the wire: unverified payload plus signature. */
    public record Envelope(JsonNode manifest, String signature) {
    }
}
