package net.ox.target.python;

/**
 * Compile-time evaluation of operators on Python-like constants.
 * The values handled are Long (int), Double (float), Boolean (bool,
 * which counts as an int in arithmetic), String (str), and null (None).
 * Anything whose result cannot be determined statically (identity tests,
 * division by zero, integer overflow, unsupported operand types) yields
 * NO_VALUE.
 */
final class PyValues {

    static final Object NO_VALUE = new Object() {
        public String toString() {
            return "NO_VALUE";
        }
    };

    private PyValues() {}

    static boolean isInt(Object v) {
        return v instanceof Long || v instanceof Boolean;
    }

    static boolean isNumber(Object v) {
        return isInt(v) || v instanceof Double;
    }

    static long toLong(Object v) {
        if (v instanceof Boolean) return ((Boolean) v) ? 1 : 0;
        return (Long) v;
    }

    static double toDouble(Object v) {
        if (v instanceof Double) return (Double) v;
        return toLong(v);
    }

    static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof Long) return (Long) v != 0;
        if (v instanceof Double) return (Double) v != 0.0;
        if (v instanceof String) return ! ((String) v).isEmpty();
        return true;
    }

    static Object evaluate(PyUnaryOp op, Object v) {
        if (op == PyUnaryOp.NOT) return ! truthy(v);
        if (! isNumber(v)) return NO_VALUE;
        switch (op) {
            case POS:
                return (v instanceof Double) ? v : (Object) toLong(v);
            case NEG:
                if (v instanceof Double) return -((Double) v);
                if (toLong(v) == Long.MIN_VALUE) return NO_VALUE;
                return - toLong(v);
            case INVERT:
                if (v instanceof Double) return NO_VALUE;
                return ~ toLong(v);
            default:
                return NO_VALUE;
        }
    }

    static Object evaluate(PyBinaryOp op, Object l, Object r) {
        switch (op) {
            case AND:
                return truthy(l) ? r : l;
            case OR:
                return truthy(l) ? l : r;
            case EQ:
                return equal(l, r);
            case NE:
                return ! equal(l, r);
            case LT: case LE: case GT: case GE:
                return compare(op, l, r);
            case IN: case NOT_IN:
                if (! (l instanceof String && r instanceof String))
                    return NO_VALUE;
                boolean found = ((String) r).contains((String) l);
                return found == (op == PyBinaryOp.IN);
            case ADD:
                if (l instanceof String && r instanceof String)
                    return (String) l + r;
                return arithmetic(op, l, r);
            case MUL:
                if (l instanceof String && isInt(r))
                    return repeat((String) l, toLong(r));
                if (isInt(l) && r instanceof String)
                    return repeat((String) r, toLong(l));
                return arithmetic(op, l, r);
            case SUB: case DIV: case FLOOR_DIV: case MOD: case POW:
                return arithmetic(op, l, r);
            case BIT_OR: case XOR: case BIT_AND: case LSHIFT: case RSHIFT:
                return bitwise(op, l, r);
            default:
                return NO_VALUE;
        }
    }

    private static boolean equal(Object l, Object r) {
        if (isNumber(l) && isNumber(r)) {
            if (isInt(l) && isInt(r)) return toLong(l) == toLong(r);
            return toDouble(l) == toDouble(r);
        }
        return (l == null) ? r == null : l.equals(r);
    }

    private static Object compare(PyBinaryOp op, Object l, Object r) {
        int c;
        if (isInt(l) && isInt(r)) {
            c = Long.compare(toLong(l), toLong(r));
        } else if (isNumber(l) && isNumber(r)) {
            double a = toDouble(l), b = toDouble(r);
            if (Double.isNaN(a) || Double.isNaN(b)) return false;
            c = Double.compare(a, b);
        } else if (l instanceof String && r instanceof String) {
            c = ((String) l).compareTo((String) r);
        } else {
            return NO_VALUE;
        }
        switch (op) {
            case LT: return c < 0;
            case LE: return c <= 0;
            case GT: return c > 0;
            default: return c >= 0;
        }
    }

    private static Object repeat(String s, long count) {
        if (count <= 0) return "";
        if (s.length() * count > Integer.MAX_VALUE) return NO_VALUE;
        StringBuilder sb = new StringBuilder((int) (s.length() * count));
        for (long i = 0; i < count; i++) sb.append(s);
        return sb.toString();
    }

    private static Object arithmetic(PyBinaryOp op, Object l, Object r) {
        if (! isNumber(l) || ! isNumber(r)) return NO_VALUE;
        if (isInt(l) && isInt(r)) return integer(op, toLong(l), toLong(r));
        double a = toDouble(l), b = toDouble(r);
        switch (op) {
            case ADD:
                return a + b;
            case SUB:
                return a - b;
            case MUL:
                return a * b;
            case DIV:
                if (b == 0) return NO_VALUE;
                return a / b;
            case FLOOR_DIV:
                if (b == 0) return NO_VALUE;
                return Math.floor(a / b);
            case MOD:
                if (b == 0) return NO_VALUE;
                return a - b * Math.floor(a / b);
            case POW:
                if (a == 0 && b < 0) return NO_VALUE;
                if (a < 0 && b != Math.rint(b)) return NO_VALUE;
                return Math.pow(a, b);
            default:
                return NO_VALUE;
        }
    }

    private static Object integer(PyBinaryOp op, long a, long b) {
        try {
            switch (op) {
                case ADD:
                    return Math.addExact(a, b);
                case SUB:
                    return Math.subtractExact(a, b);
                case MUL:
                    return Math.multiplyExact(a, b);
                case DIV:
                    if (b == 0) return NO_VALUE;
                    return (double) a / b;
                case FLOOR_DIV:
                    if (b == 0) return NO_VALUE;
                    return Math.floorDiv(a, b);
                case MOD:
                    if (b == 0) return NO_VALUE;
                    return Math.floorMod(a, b);
                case POW:
                    if (b < 0) {
                        if (a == 0) return NO_VALUE;
                        return Math.pow(a, b);
                    }
                    if (a == 0 || a == 1) return (b == 0) ? 1L : a;
                    if (a == -1) return (b % 2 == 0) ? 1L : -1L;
                    long ret = 1;
                    for (long i = 0; i < b; i++) {
                        ret = Math.multiplyExact(ret, a);
                    }
                    return ret;
                default:
                    return NO_VALUE;
            }
        } catch (ArithmeticException exc) {
            // Python integers do not overflow; leave the expression alone.
            return NO_VALUE;
        }
    }

    private static Object bitwise(PyBinaryOp op, Object l, Object r) {
        if (! isInt(l) || ! isInt(r)) return NO_VALUE;
        long a = toLong(l), b = toLong(r);
        boolean bools = (l instanceof Boolean && r instanceof Boolean);
        switch (op) {
            case BIT_OR:
                return bools ? (Object) ((a | b) != 0) : (Object) (a | b);
            case XOR:
                return bools ? (Object) ((a ^ b) != 0) : (Object) (a ^ b);
            case BIT_AND:
                return bools ? (Object) ((a & b) != 0) : (Object) (a & b);
            case LSHIFT:
                if (b < 0 || b >= 63) return NO_VALUE;
                long shifted = a << b;
                if ((shifted >> b) != a) return NO_VALUE;
                return shifted;
            case RSHIFT:
                if (b < 0) return NO_VALUE;
                return a >> Math.min(b, 63);
            default:
                return NO_VALUE;
        }
    }

}
