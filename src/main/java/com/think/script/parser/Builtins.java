package com.think.script.parser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.think.script.parser.ThinkRuntimeException.Kind;

/**
 * The fixed built-in function table. Calls resolve here before the subtask
 * registry is consulted, so a subtask cannot shadow a built-in.
 *
 * Errors raised here carry no position; the interpreter anchors them at the
 * call site.
 */
public final class Builtins {

    public interface BuiltinFunction {
        Value call(Interpreter interpreter, List<Value> args);
    }

    private static final Map<String, BuiltinFunction> TABLE;

    static {
        Map<String, BuiltinFunction> t = new LinkedHashMap<>();

        t.put("print", (interp, args) -> {
            interp.print(args);
            return Value.none();
        });

        t.put("sum", (interp, args) -> {
            arity("sum", args, 1);
            List<Value> items = requireList("sum", args.get(0));
            boolean floating = false;
            for (Value v : items) {
                if (!v.isNumber()) {
                    throw new ThinkRuntimeException(Kind.TYPE_MISMATCH,
                            "sum() can only add numbers, found " + v.typeName());
                }
                if (v.type == Value.Type.FLOAT) floating = true;
            }
            if (floating) {
                double fsum = 0.0;
                for (Value v : items) fsum += v.asNumber();
                return Value.floating(fsum);
            }
            long isum = 0L;
            for (Value v : items) isum = addInt("sum", isum, v.asInt());
            return Value.integer(isum);
        });

        t.put("len", (interp, args) -> {
            arity("len", args, 1);
            Value v = args.get(0);
            switch (v.type) {
                case STRING: return Value.integer(v.asString().codePointCount(0, v.asString().length()));
                case LIST:   return Value.integer(v.asList().size());
                case DICT:   return Value.integer(v.asDict().size());
                default:
                    throw new ThinkRuntimeException(Kind.TYPE_MISMATCH, "object of type '" + v.typeName() + "' has no len()");
            }
        });

        t.put("range", (interp, args) -> {
            if (args.isEmpty() || args.size() > 2) {
                throw new ThinkRuntimeException(Kind.INVALID_ARGUMENT, "range() expects 1 or 2 arguments, got " + args.size());
            }
            long start = args.size() == 2 ? requireInt("range", args.get(0)) : 0L;
            long stop = requireInt("range", args.get(args.size() - 1));
            List<Value> out = new ArrayList<>();
            for (long i = start; i < stop; i++) out.add(Value.integer(i));
            return Value.list(out);
        });

        t.put("enumerate", (interp, args) -> {
            arity("enumerate", args, 1);
            List<Value> items = iterationItems(args.get(0));
            List<Value> out = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                List<Value> pair = new ArrayList<>(2);
                pair.add(Value.integer(i));
                pair.add(items.get(i));
                out.add(Value.list(pair));
            }
            return Value.list(out);
        });

        t.put("max", (interp, args) -> extreme("max", args, 1));
        t.put("min", (interp, args) -> extreme("min", args, -1));

        t.put("str", (interp, args) -> {
            arity("str", args, 1);
            return Value.string(args.get(0).str());
        });

        t.put("int", (interp, args) -> {
            arity("int", args, 1);
            Value v = args.get(0);
            switch (v.type) {
                case INT:   return v;
                case FLOAT: return Value.integer(toInt("int", v.asNumber()));
                case BOOL:  return Value.integer(v.asBool() ? 1 : 0);
                case STRING:
                    try {
                        return Value.integer(Long.parseLong(v.asString().trim()));
                    } catch (NumberFormatException e) {
                        throw new ThinkRuntimeException(Kind.INVALID_ARGUMENT,
                                "invalid literal for int(): " + v.repr());
                    }
                default:
                    throw new ThinkRuntimeException(Kind.TYPE_MISMATCH, "int() cannot convert " + v.typeName());
            }
        });

        t.put("float", (interp, args) -> {
            arity("float", args, 1);
            Value v = args.get(0);
            switch (v.type) {
                case INT:
                case FLOAT: return Value.floating(v.asNumber());
                case BOOL:  return Value.floating(v.asBool() ? 1.0 : 0.0);
                case STRING:
                    try {
                        return Value.floating(Double.parseDouble(v.asString().trim()));
                    } catch (NumberFormatException e) {
                        throw new ThinkRuntimeException(Kind.INVALID_ARGUMENT,
                                "could not convert string to float: " + v.repr());
                    }
                default:
                    throw new ThinkRuntimeException(Kind.TYPE_MISMATCH, "float() cannot convert " + v.typeName());
            }
        });

        t.put("abs", (interp, args) -> {
            arity("abs", args, 1);
            Value v = requireNumber("abs", args.get(0));
            if (v.type == Value.Type.INT) {
                if (v.asInt() == Long.MIN_VALUE) {
                    throw new ThinkRuntimeException(Kind.INTEGER_OVERFLOW, "abs() of " + v.asInt() + " overflows int");
                }
                return Value.integer(Math.abs(v.asInt()));
            }
            return Value.floating(Math.abs(v.asNumber()));
        });

        t.put("round", (interp, args) -> {
            if (args.isEmpty() || args.size() > 2) {
                throw new ThinkRuntimeException(Kind.INVALID_ARGUMENT, "round() expects 1 or 2 arguments, got " + args.size());
            }
            Value v = requireNumber("round", args.get(0));
            if (args.size() == 1) {
                if (v.type == Value.Type.INT) return v;
                return Value.integer(toInt("round", Math.rint(v.asNumber())));
            }
            long digits = requireInt("round", args.get(1));
            if (v.type == Value.Type.INT) return v;
            double d = v.asNumber();
            if (Double.isNaN(d) || Double.isInfinite(d)) return v;
            BigDecimal rounded = new BigDecimal(Double.toString(d)).setScale((int) digits, RoundingMode.HALF_EVEN);
            return Value.floating(rounded.doubleValue());
        });

        TABLE = Collections.unmodifiableMap(t);
    }

    private Builtins() {}

    public static boolean isBuiltin(String name) {
        return TABLE.containsKey(name);
    }

    public static BuiltinFunction lookup(String name) {
        return TABLE.get(name);
    }

    /** Elements a for loop or enumerate walks: list items, string characters or dict keys. */
    static List<Value> iterationItems(Value v) {
        switch (v.type) {
            case LIST:
                return new ArrayList<>(v.asList());
            case STRING: {
                List<Value> out = new ArrayList<>();
                String s = v.asString();
                s.codePoints().forEach(cp -> out.add(Value.string(new String(Character.toChars(cp)))));
                return out;
            }
            case DICT: {
                List<Value> out = new ArrayList<>();
                for (String key : v.asDict().keySet()) out.add(Value.string(key));
                return out;
            }
            default:
                throw new ThinkRuntimeException(Kind.TYPE_MISMATCH, "'" + v.typeName() + "' object is not iterable");
        }
    }

    /**
     * Orders numbers numerically and strings lexicographically; any other pair
     * is a type mismatch.
     */
    static int compare(Value a, Value b, String op) {
        if (a.isNumber() && b.isNumber()) {
            if (a.type == Value.Type.INT && b.type == Value.Type.INT) return Long.compare(a.asInt(), b.asInt());
            return Double.compare(a.asNumber(), b.asNumber());
        }
        if (a.type == Value.Type.STRING && b.type == Value.Type.STRING) {
            return a.asString().compareTo(b.asString());
        }
        throw new ThinkRuntimeException(Kind.TYPE_MISMATCH,
                "'" + op + "' not supported between '" + a.typeName() + "' and '" + b.typeName() + "'");
    }

    private static Value extreme(String name, List<Value> args, int sign) {
        if (args.isEmpty()) {
            throw new ThinkRuntimeException(Kind.INVALID_ARGUMENT, name + "() expects at least 1 argument");
        }
        List<Value> items = args.size() == 1 ? iterationItems(args.get(0)) : args;
        if (items.isEmpty()) {
            throw new ThinkRuntimeException(Kind.INVALID_ARGUMENT, name + "() arg is an empty sequence");
        }
        Value best = items.get(0);
        for (int i = 1; i < items.size(); i++) {
            Value v = items.get(i);
            if (compare(v, best, sign > 0 ? ">" : "<") * sign > 0) best = v;
        }
        return best;
    }

    private static long addInt(String name, long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new ThinkRuntimeException(Kind.INTEGER_OVERFLOW, name + "() result overflows int");
        }
    }

    /** Truncates toward zero; NaN, infinities and out-of-range values are rejected. */
    private static long toInt(String name, double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new ThinkRuntimeException(Kind.INVALID_ARGUMENT, "cannot convert float " + d + " to int");
        }
        if (d >= 0x1p63 || d < -0x1p63) {
            throw new ThinkRuntimeException(Kind.INTEGER_OVERFLOW, name + "() result " + d + " overflows int");
        }
        return (long) d;
    }

    private static void arity(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new ThinkRuntimeException(Kind.INVALID_ARGUMENT,
                    name + "() expects " + expected + " argument" + (expected == 1 ? "" : "s") + ", got " + args.size());
        }
    }

    private static List<Value> requireList(String name, Value v) {
        if (v.type != Value.Type.LIST) {
            throw new ThinkRuntimeException(Kind.TYPE_MISMATCH, name + "() expects a list, got " + v.typeName());
        }
        return v.asList();
    }

    private static long requireInt(String name, Value v) {
        if (v.type != Value.Type.INT) {
            throw new ThinkRuntimeException(Kind.TYPE_MISMATCH, name + "() expects an int, got " + v.typeName());
        }
        return v.asInt();
    }

    private static Value requireNumber(String name, Value v) {
        if (!v.isNumber()) {
            throw new ThinkRuntimeException(Kind.TYPE_MISMATCH, name + "() expects a number, got " + v.typeName());
        }
        return v;
    }
}
