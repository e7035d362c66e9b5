package com.lawcheck.constraint;

import com.lawcheck.model.ComparisonOp;
import com.lawcheck.model.Condition;
import com.microsoft.z3.ArithSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.RealExpr;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Translates one condition into Z3 terms within a single {@link Context}.
 *
 * <ul>
 *   <li>age, income and each duration unit are non-negative integers</li>
 *   <li>each percentage context is a non-negative real</li>
 *   <li>every numeric quantity also has a presence flag; a comparison
 *       requires it, so a negated comparison holds for an absent quantity</li>
 *   <li>a string attribute is a presence flag plus an integer code; values
 *       mentioned anywhere in the query get distinct codes, any other code
 *       stands for an unmentioned string</li>
 *   <li>a pattern is a boolean indicator tied to the codes of every
 *       mentioned value by evaluating the regex on that value</li>
 *   <li>a custom condition is a free boolean keyed by its description</li>
 * </ul>
 */
final class Z3Encoder {

    private final Context ctx;
    private final Map<String, Map<String, Integer>> codes = new HashMap<>();
    private final Map<String, IntExpr> integers = new HashMap<>();
    private final Map<String, RealExpr> reals = new HashMap<>();
    private final Map<String, BoolExpr> booleans = new HashMap<>();
    private final List<BoolExpr> side = new ArrayList<>();

    Z3Encoder(Context ctx, Condition root) {
        this.ctx = ctx;
        assignCodes(root);
    }

    /** Domain and pattern constraints collected while encoding. */
    BoolExpr[] sideConstraints() {
        return side.toArray(new BoolExpr[0]);
    }

    BoolExpr encode(Condition condition) {
        if (condition instanceof Condition.And and) {
            return ctx.mkAnd(encode(and.left()), encode(and.right()));
        }
        if (condition instanceof Condition.Or or) {
            return ctx.mkOr(encode(or.left()), encode(or.right()));
        }
        if (condition instanceof Condition.Not not) {
            return ctx.mkNot(encode(not.inner()));
        }
        if (condition instanceof Condition.Age age) {
            return quantity(age, compare(age.op(), integer(SemanticKeys.numeric(age)), ctx.mkInt(age.value())));
        }
        if (condition instanceof Condition.Income income) {
            return quantity(income,
                compare(income.op(), integer(SemanticKeys.numeric(income)), ctx.mkInt(income.value())));
        }
        if (condition instanceof Condition.Duration duration) {
            return quantity(duration,
                compare(duration.op(), integer(SemanticKeys.numeric(duration)), ctx.mkInt(duration.value())));
        }
        if (condition instanceof Condition.Percentage percentage) {
            String literal = BigDecimal.valueOf(percentage.value()).toPlainString();
            return quantity(percentage,
                compare(percentage.op(), real(SemanticKeys.numeric(percentage)), ctx.mkReal(literal)));
        }
        if (condition instanceof Condition.HasAttribute has) {
            return present(has.key());
        }
        if (condition instanceof Condition.AttributeEquals equals) {
            return ctx.mkAnd(present(equals.key()), holds(equals.key(), equals.value()));
        }
        if (condition instanceof Condition.SetMembership membership) {
            List<BoolExpr> options = new ArrayList<>();
            for (String value : membership.values()) {
                options.add(holds(membership.attribute(), value));
            }
            BoolExpr member = options.isEmpty()
                ? ctx.mkFalse()
                : ctx.mkAnd(present(membership.attribute()), ctx.mkOr(options.toArray(new BoolExpr[0])));
            return membership.negated() ? ctx.mkNot(member) : member;
        }
        if (condition instanceof Condition.Pattern pattern) {
            BoolExpr matched = ctx.mkAnd(present(pattern.attribute()), indicator(pattern));
            return pattern.negated() ? ctx.mkNot(matched) : matched;
        }
        if (condition instanceof Condition.Custom custom) {
            return bool(SemanticKeys.custom(custom.description()));
        }
        throw new IllegalArgumentException("unsupported condition: " + condition);
    }

    private BoolExpr quantity(Condition atom, BoolExpr comparison) {
        return ctx.mkAnd(bool(SemanticKeys.quantityPresent(SemanticKeys.numeric(atom))), comparison);
    }

    private <S extends ArithSort> BoolExpr compare(ComparisonOp op, Expr<S> left, Expr<S> right) {
        return switch (op) {
            case EQUAL -> ctx.mkEq(left, right);
            case NOT_EQUAL -> ctx.mkNot(ctx.mkEq(left, right));
            case LESS_THAN -> ctx.mkLt(left, right);
            case LESS_OR_EQUAL -> ctx.mkLe(left, right);
            case GREATER_THAN -> ctx.mkGt(left, right);
            case GREATER_OR_EQUAL -> ctx.mkGe(left, right);
        };
    }

    private IntExpr integer(String name) {
        IntExpr existing = integers.get(name);
        if (existing != null) {
            return existing;
        }
        IntExpr variable = ctx.mkIntConst(name);
        integers.put(name, variable);
        side.add(ctx.mkGe(variable, ctx.mkInt(0)));
        return variable;
    }

    private RealExpr real(String name) {
        RealExpr existing = reals.get(name);
        if (existing != null) {
            return existing;
        }
        RealExpr variable = ctx.mkRealConst(name);
        reals.put(name, variable);
        side.add(ctx.mkGe(variable, ctx.mkReal(0)));
        return variable;
    }

    private BoolExpr bool(String name) {
        return booleans.computeIfAbsent(name, ctx::mkBoolConst);
    }

    private BoolExpr present(String attribute) {
        return bool(SemanticKeys.attributePresent(attribute));
    }

    private IntExpr valueOf(String attribute) {
        return integers.computeIfAbsent(SemanticKeys.attributeValue(attribute), ctx::mkIntConst);
    }

    private BoolExpr holds(String attribute, String value) {
        int code = codes.get(attribute).get(value);
        return ctx.mkEq(valueOf(attribute), ctx.mkInt(code));
    }

    private BoolExpr indicator(Condition.Pattern pattern) {
        String name = SemanticKeys.pattern(pattern);
        BoolExpr existing = booleans.get(name);
        if (existing != null) {
            return existing;
        }
        BoolExpr flag = ctx.mkBoolConst(name);
        booleans.put(name, flag);
        Pattern regex = Pattern.compile(pattern.regex());
        Map<String, Integer> known = codes.getOrDefault(pattern.attribute(), Map.of());
        for (Map.Entry<String, Integer> entry : known.entrySet()) {
            BoolExpr isValue = ctx.mkEq(valueOf(pattern.attribute()), ctx.mkInt(entry.getValue()));
            BoolExpr outcome = regex.matcher(entry.getKey()).find() ? flag : ctx.mkNot(flag);
            side.add(ctx.mkImplies(isValue, outcome));
        }
        return flag;
    }

    private void assignCodes(Condition root) {
        Map<String, TreeSet<String>> mentioned = new TreeMap<>();
        Deque<Condition> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Condition current = stack.pop();
            if (current instanceof Condition.And and) {
                stack.push(and.left());
                stack.push(and.right());
            } else if (current instanceof Condition.Or or) {
                stack.push(or.left());
                stack.push(or.right());
            } else if (current instanceof Condition.Not not) {
                stack.push(not.inner());
            } else if (current instanceof Condition.AttributeEquals equals) {
                mentioned.computeIfAbsent(equals.key(), k -> new TreeSet<>()).add(equals.value());
            } else if (current instanceof Condition.SetMembership membership) {
                mentioned.computeIfAbsent(membership.attribute(), k -> new TreeSet<>()).addAll(membership.values());
            }
        }
        mentioned.forEach((attribute, values) -> {
            Map<String, Integer> assigned = new TreeMap<>();
            for (String value : values) {
                assigned.put(value, assigned.size());
            }
            codes.put(attribute, assigned);
        });
    }
}
