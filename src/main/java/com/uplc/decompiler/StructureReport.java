package com.uplc.decompiler;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.uplc.decompiler.codegen.Binding;
import com.uplc.decompiler.codegen.BindingEnvironment;
import com.uplc.decompiler.codegen.ExpressionWriter;
import com.uplc.decompiler.patterns.ContractStructure;
import com.uplc.decompiler.patterns.FieldInfo;
import com.uplc.decompiler.patterns.PatternMatch;
import com.uplc.decompiler.patterns.RedeemerVariant;
import com.uplc.decompiler.patterns.ScriptParameter;
import com.uplc.decompiler.patterns.ScriptPurpose;
import com.uplc.decompiler.patterns.ValidationCheck;
import com.uplc.decompiler.patterns.VariableFlow;

/** JSON view of an analysis: what the pattern engine found, without the source text. */
public final class StructureReport {

    private static final ObjectMapper om = new ObjectMapper();

    private StructureReport() {}

    public static ObjectNode toJson(ContractStructure s) {
        ObjectNode root = om.createObjectNode();
        root.put("purpose", s.purpose.label);
        root.put("purposeConfidence", s.purposeRecognition.confidence());
        root.put("purposeAmbiguous", s.purposeRecognition.isAmbiguous());
        ArrayNode candidates = root.putArray("purposeCandidates");
        for (ScriptPurpose p : s.purposeRecognition.candidates()) candidates.add(p.label);

        ArrayNode params = root.putArray("params");
        for (String p : s.params) params.add(p);
        putNullable(root, "datumParam", s.datumParam);
        putNullable(root, "redeemerParam", s.redeemerParam);
        putNullable(root, "contextParam", s.contextParam);

        ObjectNode datum = root.putObject("datum");
        datum.put("used", s.datum.used);
        datum.put("optional", s.datum.optional);
        datum.put("inferredType", s.datum.inferredType);
        fields(datum.putArray("fields"), s.datum.fields);

        ObjectNode redeemer = root.putObject("redeemer");
        redeemer.put("matchPattern", s.redeemer.matchPattern.name().toLowerCase());
        ArrayNode variants = redeemer.putArray("variants");
        for (RedeemerVariant v : s.redeemer.variants) {
            ObjectNode vn = variants.addObject();
            vn.put("index", v.index);
            vn.put("name", v.name);
            fields(vn.putArray("fields"), v.fields);
        }
        fields(redeemer.putArray("fields"), s.redeemer.fields);

        ArrayNode checks = root.putArray("checks");
        for (ValidationCheck c : s.checks) {
            ObjectNode cn = checks.addObject();
            cn.put("category", c.category.label);
            cn.put("builtin", c.builtin);
            cn.put("description", c.description);
        }

        ArrayNode scriptParams = root.putArray("scriptParameters");
        for (ScriptParameter p : s.scriptParameters) {
            ObjectNode pn = scriptParams.addObject();
            pn.put("name", p.name);
            pn.put("type", p.typeName());
            pn.put("value", ExpressionWriter.constantText(p.value));
        }

        ArrayNode patterns = root.putArray("patterns");
        for (PatternMatch m : s.commonPatterns) {
            ObjectNode mn = patterns.addObject();
            mn.put("kind", m.kind.name().toLowerCase());
            mn.put("description", m.description);
            mn.put("confidence", m.confidence);
        }

        ObjectNode flows = root.putObject("dataFlow");
        for (Map.Entry<String, VariableFlow> e : s.flows.entrySet()) {
            VariableFlow f = e.getValue();
            ObjectNode fn = flows.putObject(e.getKey());
            fn.put("source", f.source.name().toLowerCase());
            fn.put("semanticName", f.semanticName());
            fn.put("inferredType", f.inferredType());
            ArrayNode transforms = fn.putArray("transforms");
            for (String t : f.transforms()) transforms.add(t);
            fn.put("usages", f.usages().size());
        }
        return root;
    }

    /** The analysis plus the binding resolution of a full decompilation. */
    public static ObjectNode toJson(DecompileResult result) {
        ObjectNode root = toJson(result.structure);
        root.set("bindings", bindings(result.bindings));
        if (result.conversion != null) {
            ObjectNode conv = root.putObject("conversion");
            conv.put("unrecognized", result.conversion.unrecognizedCount());
            conv.put("unbound", result.conversion.unboundCount());
        }
        return root;
    }

    public static String write(DecompileResult result) throws JsonProcessingException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(result));
    }

    private static ArrayNode bindings(BindingEnvironment env) {
        ArrayNode out = om.createArrayNode();
        for (Binding b : env.all()) {
            ObjectNode bn = out.addObject();
            bn.put("name", b.name);
            bn.put("category", b.category.name().toLowerCase());
            bn.put("pattern", b.pattern.name().toLowerCase());
            bn.put("displayName", env.displayName(b.name));
            putNullable(bn, "inline", b.inlineText);
            putNullable(bn, "folded", b.foldedValue);
        }
        return out;
    }

    private static void fields(ArrayNode out, List<FieldInfo> fields) {
        for (FieldInfo f : fields) {
            ObjectNode fn = out.addObject();
            fn.put("index", f.index);
            putNullable(fn, "name", f.semanticName);
            fn.put("type", f.inferredType.label);
            fn.put("accessPath", f.accessPath);
        }
    }

    private static void putNullable(ObjectNode node, String key, String value) {
        if (value == null) node.putNull(key);
        else node.put(key, value);
    }
}
