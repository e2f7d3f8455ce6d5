package com.uplc.decompiler.patterns;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Finds positional field reads of a constructor value.
 *
 * The canonical read of field k of {@code x} is
 * {@code headList(tailList(...tailList(sndPair(unConstrData(x)))...))} with k nested tailLists.
 */
public final class FieldExtractor {

    private FieldExtractor() {}

    /**
     * Field index read by {@code node} from variable {@code var}, or -1 when {@code node} is not
     * a canonical field read of it.
     */
    public static int fieldIndex(Term node, String var) {
        Terms.Spine head = Terms.flattenApp(node);
        if (!head.isBuiltin("headList") || head.args.size() != 1) return -1;
        Term list = head.args.get(0);
        return isFieldsOf(stripTails(list), var) ? tailDepth(list) : -1;
    }

    /** {@code sndPair(unConstrData(var))}. */
    static boolean isFieldsOf(Term term, String var) {
        Terms.Spine snd = Terms.flattenApp(term);
        if (!snd.isBuiltin("sndPair") || snd.args.size() != 1) return false;
        return isUnConstrOf(snd.args.get(0), var);
    }

    /** {@code unConstrData(var)}. */
    static boolean isUnConstrOf(Term term, String var) {
        Terms.Spine un = Terms.flattenApp(term);
        return un.isBuiltin("unConstrData") && un.args.size() == 1 && Terms.isVar(un.args.get(0), var);
    }

    /** Number of {@code tailList} applications wrapped around a list. */
    public static int tailDepth(Term term) {
        int depth = 0;
        Term list = term;
        Terms.Spine s = Terms.flattenApp(list);
        while (s.isBuiltin("tailList") && s.args.size() == 1) {
            depth++;
            list = s.args.get(0);
            s = Terms.flattenApp(list);
        }
        return depth;
    }

    /** The list underneath any {@code tailList} applications. */
    public static Term stripTails(Term term) {
        Term list = term;
        Terms.Spine s = Terms.flattenApp(list);
        while (s.isBuiltin("tailList") && s.args.size() == 1) {
            list = s.args.get(0);
            s = Terms.flattenApp(list);
        }
        return list;
    }

    public static List<FieldInfo> extract(Term scope, String var) {
        return extract(scope, var, null);
    }

    /**
     * All distinct fields of {@code var} read within {@code scope}, sorted by index. When
     * {@code parents} is given (a parent map covering {@code scope}) field types are inferred
     * from the consuming builtin.
     */
    public static List<FieldInfo> extract(Term scope, String var, Map<Term, Term> parents) {
        if (var == null) return List.of();
        Map<Integer, FieldInfo> byIndex = new TreeMap<>();
        List<Term> reads = Terms.findAll(scope, t -> t.tag == Term.Tag.APPLY && fieldIndex(t, var) >= 0);
        for (Term read : reads) {
            int index = fieldIndex(read, var);
            FieldType type = parents == null ? FieldType.UNKNOWN : consumerType(read, parents);
            FieldInfo existing = byIndex.get(index);
            if (existing == null) {
                byIndex.put(index, new FieldInfo(index, accessPath(index, var), type, null, read));
            } else if (existing.inferredType == FieldType.UNKNOWN && type != FieldType.UNKNOWN) {
                byIndex.put(index, new FieldInfo(index, existing.accessPath, type, null, existing.node));
            }
        }
        List<FieldInfo> out = new ArrayList<>(byIndex.values());
        out.sort(Comparator.comparingInt(f -> f.index));
        return out;
    }

    static String accessPath(int index, String var) {
        StringBuilder sb = new StringBuilder("headList(");
        for (int i = 0; i < index; i++) sb.append("tailList(");
        sb.append("sndPair(unConstrData(").append(var).append("))");
        for (int i = 0; i < index; i++) sb.append(')');
        return sb.append(')').toString();
    }

    /** Type implied by the builtin that receives the field value. */
    static FieldType consumerType(Term read, Map<Term, Term> parents) {
        Term cur = read;
        Term p = parents.get(cur);
        while (p != null && (p.tag == Term.Tag.FORCE || p.tag == Term.Tag.DELAY)) {
            cur = p;
            p = parents.get(cur);
        }
        if (p == null || p.tag != Term.Tag.APPLY || ((Term.Apply) p).arg != cur) return FieldType.UNKNOWN;
        String builtin = Terms.builtinName(p);
        if (builtin == null) return FieldType.UNKNOWN;
        switch (builtin) {
            case "unIData": return FieldType.INTEGER;
            case "unBData": return FieldType.BYTESTRING;
            case "unListData": return FieldType.LIST;
            case "unMapData": return FieldType.MAP;
            case "unConstrData":
            case "equalsData":
            case "serialiseData":
                return FieldType.DATA;
            default:
                if (BuiltinGroups.INTEGER_COMPARISONS.contains(builtin) || BuiltinGroups.ARITHMETIC.contains(builtin)) {
                    return FieldType.INTEGER;
                }
                if (BuiltinGroups.BYTES_COMPARISONS.contains(builtin)) return FieldType.BYTESTRING;
                return FieldType.UNKNOWN;
        }
    }
}
