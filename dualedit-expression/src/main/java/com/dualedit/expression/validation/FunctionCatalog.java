package com.dualedit.expression.validation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Functions an expression may call. {@link #defaults()} has the math and text functions the editors offer;
 * {@link #with(FunctionDefinition)} returns an extended copy.
 */
public final class FunctionCatalog {

    private static final FunctionCatalog DEFAULTS = buildDefaults();

    private final Map<String, FunctionDefinition> functions;

    private FunctionCatalog(Map<String, FunctionDefinition> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    public static FunctionCatalog defaults() {
        return DEFAULTS;
    }

    public static FunctionCatalog empty() {
        return new FunctionCatalog(Map.of());
    }

    public FunctionCatalog with(FunctionDefinition definition) {
        Map<String, FunctionDefinition> copy = new LinkedHashMap<>(functions);
        copy.put(definition.name(), definition);
        return new FunctionCatalog(copy);
    }

    public Optional<FunctionDefinition> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Collection<FunctionDefinition> all() {
        return functions.values();
    }

    private static FunctionCatalog buildDefaults() {
        Map<String, FunctionDefinition> m = new LinkedHashMap<>();
        unary(m, "sin", Math::sin);
        unary(m, "cos", Math::cos);
        unary(m, "tan", Math::tan);
        unary(m, "sqrt", Math::sqrt);
        unary(m, "abs", Math::abs);
        unary(m, "ceil", Math::ceil);
        unary(m, "floor", Math::floor);
        unary(m, "round", x -> (double) Math.round(x));
        unary(m, "exp", Math::exp);
        put(m, new FunctionDefinition("log", 1, 2, args -> {
            double x = Values.toNumber(args.get(0), "log");
            if (args.size() == 1) return Math.log(x);
            return Math.log(x) / Math.log(Values.toNumber(args.get(1), "log"));
        }));
        binary(m, "pow", Math::pow);
        binary(m, "atan2", Math::atan2);
        put(m, FunctionDefinition.fixed("gcd", 2, args -> (double) gcd(
                Values.toInteger(args.get(0), "gcd"), Values.toInteger(args.get(1), "gcd"))));
        put(m, FunctionDefinition.fixed("lcm", 2, args -> {
            long a = Values.toInteger(args.get(0), "lcm");
            long b = Values.toInteger(args.get(1), "lcm");
            return a == 0 || b == 0 ? 0.0 : (double) Math.abs(a / gcd(a, b) * b);
        }));
        put(m, FunctionDefinition.variadic("min", 1, args -> fold(args, "min", Math::min)));
        put(m, FunctionDefinition.variadic("max", 1, args -> fold(args, "max", Math::max)));
        put(m, FunctionDefinition.fixed("equalText", 2, args -> Values.requireText(args.get(0), "equalText")
                .equals(Values.requireText(args.get(1), "equalText"))));
        put(m, FunctionDefinition.fixed("compareText", 2, args -> (double) Integer.signum(
                Values.requireText(args.get(0), "compareText").compareTo(Values.requireText(args.get(1), "compareText")))));
        put(m, FunctionDefinition.variadic("concat", 2, args -> {
            StringBuilder sb = new StringBuilder();
            for (Object a : args) sb.append(Values.toText(a));
            return sb.toString();
        }));
        return new FunctionCatalog(m);
    }

    private static void put(Map<String, FunctionDefinition> m, FunctionDefinition d) {
        m.put(d.name(), d);
    }

    private static void unary(Map<String, FunctionDefinition> m, String name, DoubleUnaryOperator f) {
        put(m, FunctionDefinition.fixed(name, 1, args -> f.applyAsDouble(Values.toNumber(args.get(0), name))));
    }

    private static void binary(Map<String, FunctionDefinition> m, String name, DoubleBinaryOperator f) {
        put(m, FunctionDefinition.fixed(name, 2,
                args -> f.applyAsDouble(Values.toNumber(args.get(0), name), Values.toNumber(args.get(1), name))));
    }

    private static double fold(List<Object> args, String name, DoubleBinaryOperator f) {
        double acc = Values.toNumber(args.get(0), name);
        for (int i = 1; i < args.size(); i++) {
            acc = f.applyAsDouble(acc, Values.toNumber(args.get(i), name));
        }
        return acc;
    }

    private static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
