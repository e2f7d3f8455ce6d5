package com.uplc.decompiler.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.uplc.debug.Debug;
import com.uplc.decompiler.patterns.ContractStructure;
import com.uplc.decompiler.patterns.FieldInfo;
import com.uplc.decompiler.patterns.FieldType;
import com.uplc.decompiler.patterns.OuterBinding;
import com.uplc.decompiler.patterns.RedeemerInfo;
import com.uplc.decompiler.patterns.RedeemerVariant;
import com.uplc.decompiler.patterns.ScriptParameter;
import com.uplc.decompiler.patterns.ScriptPurpose;
import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Turns an analyzed contract into {@link GeneratedCode}: datum and redeemer types, one
 * validator with a handler for the inferred purpose, and the handler body as nested blocks.
 *
 * Let chains become {@code let} statements (inline bindings vanish), the redeemer dispatch
 * becomes a {@code when}, conditionals with a failing branch become {@code expect}, and other
 * conditionals become {@code if}/{@code else}. Everything below {@link GeneratorOptions#maxBlockDepth()}
 * nested blocks, and anything without statement structure, is written as one expression.
 */
public final class CodeGenerator {

    private static final String TAG = "Codegen";

    public static final String DATUM_TYPE = "Datum";
    public static final String ACTION_TYPE = "Action";
    public static final String REDEEMER_TYPE = "Redeemer";

    private static final String TRANSACTION_IMPORT = "cardano/transaction.{OutputReference, Transaction}";

    /** Hex literals of at least 28 bytes. */
    private static final Pattern LONG_HEX = Pattern.compile("#\"([0-9a-f]{56,})\"");

    private static final List<String> BYTES_HINTS = List.of("owner", "beneficiary", "token_name", "signature");
    private static final List<String> INT_HINTS = List.of("amount", "deadline", "index", "count");

    private final ContractStructure structure;
    private final BindingEnvironment env;
    private final GeneratorOptions options;
    private final Set<String> imports = new TreeSet<>();
    private boolean dispatchEmitted;

    private CodeGenerator(ContractStructure structure, BindingEnvironment env, GeneratorOptions options) {
        this.structure = structure;
        this.env = env;
        this.options = options;
    }

    public static GeneratedCode generate(ContractStructure structure) {
        return generate(structure, bindingsFor(structure), GeneratorOptions.defaults());
    }

    public static GeneratedCode generate(ContractStructure structure, BindingEnvironment env, GeneratorOptions options) {
        return new CodeGenerator(structure, env, options).run();
    }

    /** Bindings of the whole program, with script parameters kept under their names. */
    public static BindingEnvironment bindingsFor(ContractStructure structure) {
        List<String> pinned = new ArrayList<>();
        for (ScriptParameter p : structure.scriptParameters) pinned.add(p.name);
        return BindingEnvironment.build(structure.fullTerm, pinned);
    }

    private GeneratedCode run() {
        Map<Integer, String> datumNames = fieldNames(structure.datum.fields);
        Map<Integer, String> structNames = fieldNames(structure.redeemer.fields);

        List<TypeDefinition> types = new ArrayList<>();
        if (!structure.datum.fields.isEmpty()) {
            types.add(TypeDefinition.struct(DATUM_TYPE, typeFields(structure.datum.fields, datumNames)));
        }
        if (!structure.redeemer.variants.isEmpty()) {
            List<TypeDefinition.Variant> variants = new ArrayList<>();
            for (RedeemerVariant v : structure.redeemer.variants) {
                variants.add(new TypeDefinition.Variant(v.name, typeFields(v.fields, fieldNames(v.fields))));
            }
            types.add(TypeDefinition.enumeration(ACTION_TYPE, variants));
        } else if (structure.redeemer.matchPattern == RedeemerInfo.MatchPattern.STRUCT && !structure.redeemer.fields.isEmpty()) {
            types.add(TypeDefinition.struct(REDEEMER_TYPE, typeFields(structure.redeemer.fields, structNames)));
        }

        ExpressionWriter writer = new ExpressionWriter(env, options);
        if (structure.datumParam != null) {
            writer = writer.withRename(structure.datumParam, "datum");
            if (!datumNames.isEmpty()) writer = writer.withFields(structure.datumParam, false, datumNames);
        }
        if (structure.redeemerParam != null) {
            writer = writer.withRename(structure.redeemerParam, "redeemer");
            if (!structNames.isEmpty()) writer = writer.withFields(structure.redeemerParam, false, structNames);
        }
        if (structure.contextParam != null) {
            writer = writer.withRename(structure.contextParam, "tx").withTransaction(structure.contextParam);
        }

        List<CodeBlock> statements = new ArrayList<>();
        for (OuterBinding b : structure.outerBindings) {
            if (!env.isInlinable(b.name)) statements.add(CodeBlock.let(writer.name(b.name), writer.write(b.value)));
        }
        CodeBlock main = lower(structure.body, 0, writer);
        if (!dispatchEmitted && !structure.redeemer.variants.isEmpty()) {
            // Dispatch sits inside an expression; lift it to the top after the leading statements.
            for (CodeBlock s : statementsOf(main)) {
                if (s.kind != CodeBlock.Kind.LET && s.kind != CodeBlock.Kind.EXPECT) break;
                statements.add(s);
            }
            statements.add(dispatch(0, writer));
        } else {
            statements.addAll(statementsOf(main));
        }
        CodeBlock body = CodeBlock.block(statements);

        List<GeneratedCode.ConstantDeclaration> constants = new ArrayList<>();
        for (ScriptParameter p : structure.scriptParameters) {
            constants.add(new GeneratedCode.ConstantDeclaration(p.name, ExpressionWriter.constantText(p.value)));
        }
        if (options.extractLongConstants()) body = extractConstants(body, constants);

        ScriptPurpose purpose = structure.purpose;
        HandlerBlock handler = new HandlerBlock(handlerKind(purpose), handlerParams(purpose), body);
        ValidatorBlock validator = new ValidatorBlock(validatorName(purpose), List.of(handler));

        imports.addAll(writer.imports());
        Debug.get().d(TAG, purpose.label + " validator, " + types.size() + " type(s), "
                + constants.size() + " constant(s), " + imports.size() + " import(s)");
        return new GeneratedCode(new ArrayList<>(imports), constants, types, validator);
    }

    // -------------------------
    // Lowering
    // -------------------------

    private CodeBlock lower(Term term, int depth, ExpressionWriter writer) {
        List<CodeBlock> out = new ArrayList<>();
        Term t = term;
        while (true) {
            t = Terms.stripForceDelay(t);
            if (depth > options.maxBlockDepth()) {
                out.add(CodeBlock.expression(writer.write(t)));
                break;
            }
            if (t.tag == Term.Tag.APPLY && ((Term.Apply) t).func.tag == Term.Tag.LAMBDA) {
                Term.Lambda lam = (Term.Lambda) ((Term.Apply) t).func;
                if (!env.isInlinable(lam.param)) {
                    out.add(CodeBlock.let(writer.name(lam.param), writer.write(((Term.Apply) t).arg)));
                }
                t = lam.body;
                continue;
            }
            if (isDispatch(t)) {
                out.add(dispatch(depth, writer));
                break;
            }
            Terms.Spine spine = Terms.flattenApp(t);
            if (spine.isBuiltin("ifThenElse") && spine.args.size() == 3 && !isBooleanShape(spine)) {
                Term cond = spine.args.get(0);
                Term then = Terms.stripForceDelay(spine.args.get(1));
                Term otherwise = Terms.stripForceDelay(spine.args.get(2));
                if (otherwise.tag == Term.Tag.ERROR) {
                    out.add(CodeBlock.expect(writer.write(cond)));
                    t = then;
                    continue;
                }
                if (then.tag == Term.Tag.ERROR) {
                    out.add(CodeBlock.expect(ExpressionWriter.negate(writer.write(cond))));
                    t = otherwise;
                    continue;
                }
                out.add(CodeBlock.ifElse(writer.write(cond), lower(then, depth + 1, writer), lower(otherwise, depth + 1, writer)));
                break;
            }
            if (t.tag == Term.Tag.CON && ((Term.Con) t).value.kind() == ConstType.Kind.UNIT) {
                out.add(CodeBlock.expression("True"));
                break;
            }
            out.add(CodeBlock.expression(writer.write(t)));
            break;
        }
        return CodeBlock.block(out);
    }

    private boolean isDispatch(Term t) {
        Term node = structure.redeemer.dispatchNode;
        if (dispatchEmitted || node == null || structure.redeemer.variants.isEmpty()) return false;
        return t == node || t == Terms.stripForceDelay(node);
    }

    private CodeBlock dispatch(int depth, ExpressionWriter writer) {
        dispatchEmitted = true;
        List<CodeBlock.Branch> branches = new ArrayList<>();
        for (RedeemerVariant v : structure.redeemer.variants) {
            Map<Integer, String> names = fieldNames(v.fields);
            ExpressionWriter branchWriter = structure.redeemerParam == null || names.isEmpty()
                    ? writer
                    : writer.withFields(structure.redeemerParam, true, names);
            CodeBlock body = v.body == null ? CodeBlock.expression("True") : lower(v.body, depth + 1, branchWriter);
            branches.add(new CodeBlock.Branch(variantPattern(v.name, names), body));
        }
        return CodeBlock.when("redeemer", branches);
    }

    /** {@code Name}, {@code Name { a, b }}, or {@code Name { a, .. }} when fields are skipped. */
    private static String variantPattern(String name, Map<Integer, String> names) {
        if (names.isEmpty()) return name;
        int max = 0;
        for (int k : names.keySet()) max = Math.max(max, k);
        String fields = String.join(", ", names.values());
        return name + " { " + fields + (names.size() <= max ? ", .." : "") + " }";
    }

    private static boolean isBooleanShape(Terms.Spine ite) {
        return boolConstant(ite.args.get(1)) != null && boolConstant(ite.args.get(2)) != null;
    }

    private static Boolean boolConstant(Term t) {
        Term s = Terms.stripForceDelay(t);
        if (s.tag != Term.Tag.CON) return null;
        Constant c = ((Term.Con) s).value;
        return c.kind() == ConstType.Kind.BOOL ? c.asBool() : null;
    }

    private static List<CodeBlock> statementsOf(CodeBlock block) {
        return block.kind == CodeBlock.Kind.BLOCK ? block.children : List.of(block);
    }

    // -------------------------
    // Naming and types
    // -------------------------

    /** Field index to surface name, in index order. */
    static Map<Integer, String> fieldNames(List<FieldInfo> fields) {
        Map<String, Integer> uses = new HashMap<>();
        Map<Integer, String> candidates = new TreeMap<>();
        int bytesSeen = 0;
        int intsSeen = 0;
        for (FieldInfo f : fields) {
            String name = f.semanticName;
            if (name == null || !isIdentifier(name)) {
                if (f.inferredType == FieldType.BYTESTRING && bytesSeen < BYTES_HINTS.size()) {
                    name = BYTES_HINTS.get(bytesSeen++);
                } else if (f.inferredType == FieldType.INTEGER && intsSeen < INT_HINTS.size()) {
                    name = INT_HINTS.get(intsSeen++);
                } else {
                    name = "field_" + f.index;
                }
            }
            candidates.put(f.index, name);
            uses.merge(name, 1, Integer::sum);
        }
        Map<Integer, String> out = new LinkedHashMap<>();
        for (Map.Entry<Integer, String> e : candidates.entrySet()) {
            String name = e.getValue();
            out.put(e.getKey(), uses.get(name) > 1 ? "field_" + e.getKey() : name);
        }
        return out;
    }

    private static boolean isIdentifier(String s) {
        if (s.isEmpty() || !Character.isLowerCase(s.charAt(0))) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') return false;
        }
        return true;
    }

    /** Fields 0..max, with gaps filled as untyped {@code field_i: Data}. */
    private static List<TypeDefinition.Field> typeFields(List<FieldInfo> fields, Map<Integer, String> names) {
        TreeMap<Integer, FieldInfo> byIndex = new TreeMap<>();
        for (FieldInfo f : fields) byIndex.put(f.index, f);
        List<TypeDefinition.Field> out = new ArrayList<>();
        if (byIndex.isEmpty()) return out;
        int max = byIndex.lastKey();
        for (int i = 0; i <= max; i++) {
            FieldInfo f = byIndex.get(i);
            if (f == null) {
                out.add(new TypeDefinition.Field("field_" + i, "Data"));
            } else {
                out.add(new TypeDefinition.Field(names.get(i), surfaceType(f.inferredType)));
            }
        }
        return out;
    }

    static String surfaceType(FieldType type) {
        switch (type) {
            case INTEGER: return "Int";
            case BYTESTRING: return "ByteArray";
            case STRING: return "String";
            case BOOL: return "Bool";
            case LIST: return "List<Data>";
            case MAP: return "Pairs<Data, Data>";
            default: return "Data";
        }
    }

    private static String handlerKind(ScriptPurpose purpose) {
        return purpose == ScriptPurpose.UNKNOWN ? ScriptPurpose.SPEND.label : purpose.label;
    }

    private static String validatorName(ScriptPurpose purpose) {
        switch (purpose) {
            case SPEND: return "script";
            case MINT: return "policy";
            case WITHDRAW: return "staking";
            case PUBLISH: return "certificate";
            case VOTE: return "governance";
            case PROPOSE: return "proposal";
            default: return "validator";
        }
    }

    private List<ParameterInfo> handlerParams(ScriptPurpose purpose) {
        String redeemerType = "Data";
        if (!structure.redeemer.variants.isEmpty()) redeemerType = ACTION_TYPE;
        else if (structure.redeemer.matchPattern == RedeemerInfo.MatchPattern.STRUCT && !structure.redeemer.fields.isEmpty()) redeemerType = REDEEMER_TYPE;

        List<ParameterInfo> params = new ArrayList<>();
        switch (purpose) {
            case MINT:
                params.add(new ParameterInfo("redeemer", redeemerType));
                params.add(new ParameterInfo("policy_id", "PolicyId"));
                imports.add("cardano/assets.{PolicyId}");
                break;
            case WITHDRAW:
                params.add(new ParameterInfo("redeemer", redeemerType));
                params.add(new ParameterInfo("credential", "Credential"));
                imports.add("cardano/address.{Credential}");
                break;
            case PUBLISH:
                params.add(new ParameterInfo("redeemer", redeemerType));
                params.add(new ParameterInfo("certificate", "Certificate"));
                imports.add("cardano/certificate.{Certificate}");
                break;
            case VOTE:
                params.add(new ParameterInfo("redeemer", redeemerType));
                params.add(new ParameterInfo("voter", "Voter"));
                imports.add("cardano/governance.{Voter}");
                break;
            case PROPOSE:
                params.add(new ParameterInfo("redeemer", redeemerType));
                params.add(new ParameterInfo("proposal", "ProposalProcedure"));
                imports.add("cardano/governance.{ProposalProcedure}");
                break;
            default: {
                String datumType = structure.datum.fields.isEmpty() ? "Data" : DATUM_TYPE;
                params.add(new ParameterInfo("datum", "Option<" + datumType + ">"));
                params.add(new ParameterInfo("redeemer", redeemerType));
                params.add(new ParameterInfo("own_ref", "OutputReference"));
                break;
            }
        }
        params.add(new ParameterInfo("tx", "Transaction"));
        imports.add(TRANSACTION_IMPORT);
        return params;
    }

    // -------------------------
    // Constants
    // -------------------------

    /** Hex literals of at least 28 bytes used twice or more become module constants. */
    private static CodeBlock extractConstants(CodeBlock body, List<GeneratedCode.ConstantDeclaration> constants) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Deque<CodeBlock> stack = new ArrayDeque<>();
        stack.push(body);
        while (!stack.isEmpty()) {
            CodeBlock b = stack.pop();
            for (String text : new String[] {b.content, b.label}) {
                if (text == null) continue;
                Matcher m = LONG_HEX.matcher(text);
                while (m.find()) counts.merge(m.group(), 1, Integer::sum);
            }
            for (CodeBlock.Branch br : b.branches) stack.push(br.body);
            for (CodeBlock c : b.children) stack.push(c);
        }

        Map<String, String> names = new HashMap<>();
        int scriptHashes = 0;
        int hashes = 0;
        int others = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() < 2) continue;
            String literal = e.getKey();
            int hexLength = literal.length() - 3;
            String name;
            if (hexLength == 56) name = "script_hash_" + scriptHashes++;
            else if (hexLength == 64) name = "hash_" + hashes++;
            else name = "const_" + others++;
            names.put(literal, name);
            constants.add(new GeneratedCode.ConstantDeclaration(name, literal));
        }
        if (names.isEmpty()) return body;
        return body.mapText(text -> text == null ? null : LONG_HEX.matcher(text)
                .replaceAll(r -> Matcher.quoteReplacement(names.getOrDefault(r.group(), r.group()))));
    }
}
