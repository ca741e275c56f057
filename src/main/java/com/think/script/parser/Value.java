package com.think.script.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime value: a type tag plus the backing Java object.
 *
 * INT holds a Long, FLOAT a Double, LIST a List of Values and DICT an
 * insertion-ordered Map from String to Value. Lists and dicts are copied
 * whenever a value is bound to a variable, see {@link #copy()}.
 */
public class Value {
    public enum Type { INT, FLOAT, STRING, BOOL, LIST, DICT, NONE }

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.INT, l); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value list(List<Value> items) { return new Value(Type.LIST, items); }
    public static Value dict(Map<String, Value> entries) { return new Value(Type.DICT, entries); }
    public static Value none() { return NONE; }

    public Type getType() { return type; }

    public boolean isNumber() { return type == Type.INT || type == Type.FLOAT; }

    public long asInt() {
        if (type != Type.INT) throw new IllegalStateException("Expected int, got " + type);
        return (Long) value;
    }

    /** Numeric view of an INT or FLOAT. */
    public double asNumber() {
        if (type == Type.INT) return (Long) value;
        if (type == Type.FLOAT) return (Double) value;
        throw new IllegalStateException("Expected number, got " + type);
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw new IllegalStateException("Expected list, got " + type);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asDict() {
        if (type != Type.DICT) throw new IllegalStateException("Expected dict, got " + type);
        return (Map<String, Value>) value;
    }

    /** Name of the type as the language spells it in error messages. */
    public String typeName() {
        switch (type) {
            case INT:    return "int";
            case FLOAT:  return "float";
            case STRING: return "str";
            case BOOL:   return "bool";
            case LIST:   return "list";
            case DICT:   return "dict";
            default:     return "None";
        }
    }

    public boolean isTruthy() {
        switch (type) {
            case NONE:   return false;
            case BOOL:   return asBool();
            case INT:    return asInt() != 0L;
            case FLOAT:  return asNumber() != 0.0;
            case STRING: return !asString().isEmpty();
            case LIST:   return !asList().isEmpty();
            case DICT:   return !asDict().isEmpty();
            default:     return true;
        }
    }

    /**
     * Deep copy for lists and dicts; scalars are immutable and returned as is.
     * Assignment and loop-variable binding go through here.
     */
    public Value copy() {
        switch (type) {
            case LIST: {
                List<Value> src = asList();
                List<Value> out = new ArrayList<>(src.size());
                for (Value item : src) out.add(item.copy());
                return Value.list(out);
            }
            case DICT: {
                Map<String, Value> src = asDict();
                Map<String, Value> out = new LinkedHashMap<>();
                for (Map.Entry<String, Value> e : src.entrySet()) out.put(e.getKey(), e.getValue().copy());
                return Value.dict(out);
            }
            default:
                return this;
        }
    }

    /** Read-only view used by snapshots handed to the host. */
    public Value frozen() {
        switch (type) {
            case LIST: {
                List<Value> out = new ArrayList<>();
                for (Value item : asList()) out.add(item.frozen());
                return Value.list(Collections.unmodifiableList(out));
            }
            case DICT: {
                Map<String, Value> out = new LinkedHashMap<>();
                for (Map.Entry<String, Value> e : asDict().entrySet()) out.put(e.getKey(), e.getValue().frozen());
                return Value.dict(Collections.unmodifiableMap(out));
            }
            default:
                return this;
        }
    }

    /** Text produced by print(): strings bare, everything else as {@link #repr()}. */
    public String str() {
        if (type == Type.STRING) return asString();
        return repr();
    }

    /** Literal-like rendering: strings quoted, as they appear inside lists. */
    public String repr() {
        switch (type) {
            case INT:
                return Long.toString(asInt());
            case FLOAT:
                return formatFloat(asNumber());
            case STRING:
                return quote(asString());
            case BOOL:
                return asBool() ? "True" : "False";
            case LIST: {
                StringBuilder sb = new StringBuilder("[");
                Iterator<Value> it = asList().iterator();
                while (it.hasNext()) {
                    sb.append(it.next().repr());
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append(']').toString();
            }
            case DICT: {
                StringBuilder sb = new StringBuilder("{");
                Iterator<Map.Entry<String, Value>> it = asDict().entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, Value> e = it.next();
                    sb.append(quote(e.getKey())).append(": ").append(e.getValue().repr());
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append('}').toString();
            }
            default:
                return "None";
        }
    }

    private static String quote(String s) {
        if (s.indexOf('\'') >= 0 && s.indexOf('"') < 0) return '"' + s + '"';
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * Shortest round-trip decimal form: always shows a fraction ("85.0") and
     * switches to exponent notation below 1e-4 or from 1e16 on ("3e-05").
     */
    static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return (1.0 / d < 0) ? "-0.0" : "0.0";

        String s = Double.toString(d);
        double abs = Math.abs(d);
        if (abs >= 1e-4 && abs < 1e16) {
            if (s.indexOf('E') < 0) return s;
            String plain = new BigDecimal(s).stripTrailingZeros().toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }

        // Exponent form: mantissa without a trailing ".0", exponent signed and two digits wide
        BigDecimal bd = new BigDecimal(s);
        int exponent = bd.precision() - bd.scale() - 1;
        BigDecimal mantissa = bd.movePointLeft(exponent).stripTrailingZeros();
        String m = mantissa.toPlainString();
        String e = Integer.toString(Math.abs(exponent));
        if (e.length() < 2) e = "0" + e;
        return m + "e" + (exponent < 0 ? "-" : "+") + e;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (isNumber() && other.isNumber()) {
            if (type == Type.INT && other.type == Type.INT) return asInt() == other.asInt();
            return asNumber() == other.asNumber();
        }
        if (type != other.type) return false;
        if (type == Type.NONE) return true;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        if (isNumber()) {
            double d = asNumber();
            if (d == Math.rint(d) && !Double.isInfinite(d)) return Long.hashCode((long) d);
            return Double.hashCode(d);
        }
        return value == null ? 0 : value.hashCode();
    }

    @Override
    public String toString() {
        return repr();
    }
}
