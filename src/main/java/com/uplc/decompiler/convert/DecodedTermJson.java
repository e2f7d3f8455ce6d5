package com.uplc.decompiler.convert;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the JSON form of a decoded term tree.
 *
 * <pre>
 * {"type":"app","func":{...},"arg":{...}}
 * {"type":"lam","body":{...}}
 * {"type":"var","index":0}
 * {"type":"con","constType":[5,0],"value":[1,2]}
 * {"type":"builtin","name":"addInteger"}   or   {"type":"builtin","tag":0}
 * {"type":"force","term":{...}}  {"type":"delay","term":{...}}  {"type":"error"}
 * {"type":"case","scrutinee":{...},"branches":[...]}
 * {"type":"constr","index":0,"fields":[...]}
 * </pre>
 *
 * Objects that match none of these become {@link DecodedTerm.Unrecognized} nodes; the converter
 * decides whether that is fatal.
 */
public final class DecodedTermJson {

    // decoded trees of real contracts nest far deeper than Jackson's default limit
    private static final ObjectMapper om = new ObjectMapper(JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(200_000).build())
            .build());

    private DecodedTermJson() {}

    public static DecodedTerm read(String json) throws IOException {
        return read(om.readTree(json));
    }

    /** Walks the JSON tree with an explicit frame stack; nesting depth is bounded only by the heap. */
    public static DecodedTerm read(JsonNode root) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        DecodedTerm result = null;
        while (!stack.isEmpty()) {
            Frame f = stack.peek();
            if (f.built.size() < f.children.size()) {
                stack.push(new Frame(f.children.get(f.built.size())));
                continue;
            }
            stack.pop();
            DecodedTerm t = build(f);
            if (stack.isEmpty()) result = t;
            else stack.peek().built.add(t);
        }
        return result;
    }

    private static String typeOf(JsonNode node) {
        return node != null && node.isObject() ? node.path("type").asText("") : null;
    }

    /** Child term nodes in construction order; leaves have none. */
    private static List<JsonNode> children(JsonNode node) {
        List<JsonNode> out = new ArrayList<>();
        String type = typeOf(node);
        if (type == null) return out;
        switch (type) {
            case "app":
                out.add(node.get("func"));
                out.add(node.get("arg"));
                break;
            case "lam":
                out.add(node.get("body"));
                break;
            case "force":
            case "delay":
                out.add(node.get("term"));
                break;
            case "case":
                out.add(node.get("scrutinee"));
                addAll(out, node.get("branches"));
                break;
            case "constr":
                addAll(out, node.get("fields"));
                break;
            default:
                break;
        }
        return out;
    }

    private static void addAll(List<JsonNode> out, JsonNode array) {
        if (array != null && array.isArray()) {
            for (JsonNode n : array) out.add(n);
        }
    }

    private static DecodedTerm build(Frame f) {
        JsonNode node = f.node;
        List<DecodedTerm> kids = f.built;
        String type = typeOf(node);
        if (type == null) {
            return DecodedTerm.unrecognized("expected JSON object, got " + (node == null ? "nothing" : node.getNodeType()));
        }
        switch (type) {
            case "app":
                return DecodedTerm.application(kids.get(0), kids.get(1));
            case "lam":
                return DecodedTerm.lambda(kids.get(0));
            case "var": {
                JsonNode index = node.get("index");
                if (index == null || !index.canConvertToInt()) return DecodedTerm.unrecognized("var without index");
                return DecodedTerm.variable(index.intValue());
            }
            case "con":
                return constant(node);
            case "builtin":
                if (node.hasNonNull("name")) return DecodedTerm.builtin(node.get("name").asText());
                if (node.path("tag").canConvertToInt()) return DecodedTerm.builtinTag(node.get("tag").intValue());
                return DecodedTerm.unrecognized("builtin without name or tag");
            case "force":
                return DecodedTerm.force(kids.get(0));
            case "delay":
                return DecodedTerm.delay(kids.get(0));
            case "error":
                return DecodedTerm.error();
            case "case":
                return DecodedTerm.caseOf(kids.get(0), new ArrayList<>(kids.subList(1, kids.size())));
            case "constr": {
                JsonNode index = node.get("index");
                if (index == null || !index.canConvertToLong()) return DecodedTerm.unrecognized("constr without index");
                return DecodedTerm.constr(index.longValue(), new ArrayList<>(kids));
            }
            default:
                return DecodedTerm.unrecognized("node type '" + type + "'");
        }
    }

    private static DecodedTerm constant(JsonNode node) {
        JsonNode tags = node.get("constType");
        if (tags == null || !tags.isArray()) return DecodedTerm.unrecognized("con without constType");
        List<Integer> typeTags = new ArrayList<>();
        for (JsonNode t : tags) {
            if (!t.canConvertToInt()) return DecodedTerm.unrecognized("con with non-numeric type tag " + t);
            typeTags.add(t.intValue());
        }
        try {
            return DecodedTerm.constant(typeTags, payload(node.get("value")));
        } catch (IllegalArgumentException e) {
            return DecodedTerm.unrecognized("con with malformed value: " + e.getMessage());
        }
    }

    /** JSON value to the plain Java payload shapes {@link PayloadNormalizer} accepts. */
    private static Object payload(JsonNode v) {
        if (v == null || v.isNull()) return null;
        if (v.isIntegralNumber()) return v.bigIntegerValue();
        if (v.isBoolean()) return v.booleanValue();
        if (v.isTextual()) return v.textValue();
        if (v.isBinary()) return binary(v);
        if (v.isArray()) {
            List<Object> items = new ArrayList<>();
            for (JsonNode n : v) items.add(payload(n));
            return items;
        }
        if (v.isObject()) {
            DecodedData data = data(v);
            if (data != null) return data;
        }
        return v.toString();
    }

    private static byte[] binary(JsonNode v) {
        try {
            return v.binaryValue();
        } catch (IOException e) {
            throw new IllegalArgumentException("unreadable binary payload", e);
        }
    }

    /** Data object, or a {"bytes": hex} wrapper; null when neither. */
    private static DecodedData data(JsonNode v) {
        if (v.has("constr")) {
            List<DecodedData> fields = new ArrayList<>();
            for (JsonNode f : v.path("fields")) fields.add(requireData(f));
            return DecodedData.constr(payload(v.get("constr")), fields);
        }
        if (v.has("map")) {
            List<Map.Entry<DecodedData, DecodedData>> entries = new ArrayList<>();
            for (JsonNode e : v.get("map")) {
                if (!e.isArray() || e.size() != 2) throw new IllegalArgumentException("map entry must be [key, value]: " + e);
                entries.add(Map.entry(requireData(e.get(0)), requireData(e.get(1))));
            }
            return DecodedData.map(entries);
        }
        if (v.has("list")) {
            List<DecodedData> items = new ArrayList<>();
            for (JsonNode i : v.get("list")) items.add(requireData(i));
            return DecodedData.list(items);
        }
        if (v.has("int")) return DecodedData.integer(payload(v.get("int")));
        if (v.has("bytes")) return DecodedData.bytes(payload(v.get("bytes")));
        return null;
    }

    private static DecodedData requireData(JsonNode v) {
        DecodedData d = v != null && v.isObject() ? data(v) : null;
        if (d == null) throw new IllegalArgumentException("not a data object: " + v);
        return d;
    }

    private static final class Frame {
        final JsonNode node;
        final List<JsonNode> children;
        final List<DecodedTerm> built = new ArrayList<>();

        Frame(JsonNode node) {
            this.node = node;
            this.children = children(node);
        }
    }
}
