package com.uplc.decompiler.patterns;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.PlutusData;
import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Discovers redeemer constructor variants.
 *
 * Tried in order: a {@code case} over the unpacked redeemer (one variant per branch), then
 * chains of {@code ifThenElse(equalsInteger(fstPair(unConstrData(r)), K), then, else)}, and
 * finally a redeemer that is unpacked without any dispatch (a single struct).
 */
public final class RedeemerAnalyzer {

    private RedeemerAnalyzer() {}

    /** Condition/branches of a saturated {@code ifThenElse}. */
    static final class IfThenElse {
        final Term condition;
        final Term thenBranch;
        final Term elseBranch;

        IfThenElse(Term condition, Term thenBranch, Term elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
    }

    static IfThenElse matchIfThenElse(Term term) {
        if (Terms.stripForce(term).tag != Term.Tag.APPLY) return null;
        Terms.Spine s = Terms.flattenApp(term);
        if (!s.isBuiltin("ifThenElse") || s.args.size() != 3) return null;
        return new IfThenElse(s.args.get(0), s.args.get(1), s.args.get(2));
    }

    public static RedeemerInfo analyze(Term body, String redeemerParam, Map<Term, Term> parents) {
        if (redeemerParam == null) return RedeemerInfo.NONE;

        RedeemerInfo fromCase = caseVariants(body, redeemerParam, parents);
        if (fromCase != null) return fromCase;

        RedeemerInfo fromIf = ifThenElseVariants(body, redeemerParam, parents);
        if (fromIf != null) return fromIf;

        if (Terms.findFirst(body, t -> FieldExtractor.isUnConstrOf(t, redeemerParam)) != null) {
            return new RedeemerInfo(List.of(), RedeemerInfo.MatchPattern.STRUCT,
                    FieldExtractor.extract(body, redeemerParam, parents), null);
        }
        return RedeemerInfo.NONE;
    }

    private static RedeemerInfo caseVariants(Term body, String r, Map<Term, Term> parents) {
        Term found = Terms.findFirst(body, t -> t.tag == Term.Tag.CASE && scrutinizesRedeemer(((Term.Case) t).scrutinee, r));
        if (found == null) return null;
        Term.Case cs = (Term.Case) found;
        List<RedeemerVariant> variants = new ArrayList<>();
        for (int i = 0; i < cs.branches.size(); i++) {
            Term branch = cs.branches.get(i);
            variants.add(new RedeemerVariant(i, VariantNames.forIndex(i), FieldExtractor.extract(branch, r, parents), branch));
        }
        return new RedeemerInfo(variants, RedeemerInfo.MatchPattern.CONSTRUCTOR, List.of(), cs);
    }

    private static boolean scrutinizesRedeemer(Term scrutinee, String r) {
        Term s = Terms.stripForceDelay(scrutinee);
        if (Terms.isVar(s, r)) return true;
        if (FieldExtractor.isUnConstrOf(s, r)) return true;
        if (s.tag == Term.Tag.APPLY) {
            Terms.Spine spine = Terms.flattenApp(s);
            return "unConstrData".equals(spine.builtin()) && spine.args.size() == 1 && Terms.referencesVar(spine.args.get(0), r);
        }
        return false;
    }

    private static RedeemerInfo ifThenElseVariants(Term body, String r, Map<Term, Term> parents) {
        List<RedeemerVariant> variants = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        Term dispatch = null;

        Deque<Term> stack = new ArrayDeque<>();
        stack.push(body);
        while (!stack.isEmpty()) {
            Term t = stack.pop();
            IfThenElse ite = matchIfThenElse(t);
            if (ite != null) {
                Integer k = constructorIndexCheck(ite.condition, r);
                if (k != null) {
                    if (dispatch == null) dispatch = t;
                    if (seen.add(k)) {
                        variants.add(new RedeemerVariant(k, VariantNames.forIndex(k),
                                FieldExtractor.extract(ite.thenBranch, r, parents), ite.thenBranch));
                    }
                }
                // else branch first so that chained checks are met in source order
                stack.push(ite.thenBranch);
                stack.push(ite.elseBranch);
                continue;
            }
            if (t.tag == Term.Tag.LAMBDA && ((Term.Lambda) t).param.equals(r)) continue;
            List<Term> children = t.children();
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }

        if (variants.isEmpty()) return null;
        variants.sort(Comparator.comparingInt(v -> v.index));
        return new RedeemerInfo(variants, RedeemerInfo.MatchPattern.CONSTRUCTOR, List.of(), dispatch);
    }

    /**
     * K for {@code equalsInteger(fstPair(unConstrData(r)), K)} in either operand order, where K may
     * also be written {@code unIData(I K)}; otherwise null.
     */
    static Integer constructorIndexCheck(Term condition, String r) {
        Terms.Spine eq = Terms.flattenApp(condition);
        if (!eq.isBuiltin("equalsInteger") || eq.args.size() != 2) return null;
        for (int i = 0; i < 2; i++) {
            Term tagSide = eq.args.get(i);
            Term constSide = eq.args.get(1 - i);
            if (!isConstructorTagOf(tagSide, r)) continue;
            BigInteger k = integerLiteral(constSide);
            if (k != null && k.signum() >= 0 && k.bitLength() < 31) return k.intValue();
        }
        return null;
    }

    /** {@code fstPair(unConstrData(r))}. */
    static boolean isConstructorTagOf(Term term, String r) {
        Terms.Spine fst = Terms.flattenApp(term);
        return fst.isBuiltin("fstPair") && fst.args.size() == 1 && FieldExtractor.isUnConstrOf(fst.args.get(0), r);
    }

    private static BigInteger integerLiteral(Term term) {
        BigInteger direct = Terms.extractIntConstant(term);
        if (direct != null) return direct;
        Terms.Spine un = Terms.flattenApp(term);
        if (un.isBuiltin("unIData") && un.args.size() == 1) {
            Term arg = Terms.stripForceDelay(un.args.get(0));
            if (arg.tag == Term.Tag.CON) {
                Constant c = ((Term.Con) arg).value;
                if (c.kind() == ConstType.Kind.DATA && c.asData().type == PlutusData.Type.INT) {
                    return c.asData().asInteger();
                }
            }
        }
        return null;
    }
}
