package net.ox.ast;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Conversion of AST elements to and from JSON.
 * Nodes are represented as {"type": ..., "tag": ..., "children": [...],
 * "attrs": {...}}, leaves as {"type": ..., "value": ...}, tokens as
 * {"type": "Token", "tokenType": ..., "value": ...}, and trees as
 * {"type": "Tree", "tag": ..., "children": [...]}. Enumeration tags are
 * stored by constant name; attributes whose values JSON cannot represent
 * are skipped.
 */
public final class AstJson {

    private AstJson() {}

    public static JSONObject toJSON(Ast node) {
        JSONObject ret = new JSONObject();
        ret.put("type", node.getType().getName());
        if (node instanceof Token) {
            Token tok = (Token) node;
            ret.put("tokenType", tok.getTokenType());
            ret.put("value", scalar(tok.getValue()));
        } else if (node instanceof Leaf) {
            ret.put("value", scalar(((Leaf) node).getValue()));
        } else {
            if (node.getTag() != null)
                ret.put("tag", scalar(node.getTag()));
            JSONArray children = new JSONArray();
            for (Ast child : node.getChildren()) {
                children.put(toJSON(child));
            }
            ret.put("children", children);
        }
        JSONObject attrs = new JSONObject();
        for (Map.Entry<String, Object> ent :
                 node.getAttributes().entrySet()) {
            Object v = ent.getValue();
            if (v instanceof String || v instanceof Number ||
                    v instanceof Boolean)
                attrs.put(ent.getKey(), v);
        }
        if (attrs.length() != 0) ret.put("attrs", attrs);
        return ret;
    }

    private static Object scalar(Object value) {
        if (value == null) return JSONObject.NULL;
        if (value instanceof Enum<?>) return ((Enum<?>) value).name();
        if (value instanceof String || value instanceof Number ||
                value instanceof Boolean)
            return value;
        return value.toString();
    }

    /**
     * Rebuild an element from its JSON form.
     * Types are looked up by name in h, falling back to the generic
     * syntax hierarchy for trees and tokens.
     */
    public static Ast fromJSON(Hierarchy h, JSONObject obj) {
        String typeName;
        try {
            typeName = obj.getString("type");
        } catch (JSONException exc) {
            throw new ConstructionException("JSON AST element has no type",
                                            exc);
        }
        AstType type = h.getType(typeName);
        if (type == null) type = Syntax.getHierarchy().getType(typeName);
        if (type == null || type.isAbstract())
            throw new ConstructionException("Unknown AST type " + typeName +
                " in hierarchy " + h.getRoot().getName());
        Ast ret;
        if (type == Token.TYPE) {
            ret = new Token(value(obj.opt("value")),
                            obj.optString("tokenType", Token.DEFAULT_TYPE));
        } else if (type.isLeaf()) {
            ret = type.create(new Object[] {
                leafValue(type, value(obj.opt("value"))) });
        } else {
            List<Ast> children = new ArrayList<Ast>();
            JSONArray arr = obj.optJSONArray("children");
            if (arr != null) {
                for (int i = 0; i < arr.length(); i++) {
                    children.add(fromJSON(h, arr.getJSONObject(i)));
                }
            }
            if (type.getKind() == AstType.Kind.TREE) {
                ret = type.create(value(obj.opt("tag")), children);
            } else {
                ret = createNode(type, obj, children);
            }
        }
        JSONObject attrs = obj.optJSONObject("attrs");
        if (attrs != null) {
            for (String key : attrs.keySet()) {
                ret.setAttribute(key, value(attrs.get(key)));
            }
        }
        return ret;
    }

    private static Ast createNode(AstType type, JSONObject obj,
                                  List<Ast> children) {
        Object[] args = new Object[type.getMinArity()];
        int ci = 0;
        for (AstType.Field f : type.getFields()) {
            if (f.getIndex() >= args.length) break;
            if (f.getRole() == AstType.FieldRole.TAG) {
                args[f.getIndex()] = tagValue(f.getType(),
                                              value(obj.opt("tag")));
            } else if (f.getRole() == AstType.FieldRole.CHILD) {
                if (ci >= children.size())
                    throw new ConstructionException("JSON AST element of " +
                        "type " + type.getName() + " has too few children");
                args[f.getIndex()] = children.get(ci++);
            }
        }
        if (ci != children.size())
            throw new ConstructionException("JSON AST element of type " +
                type.getName() + " has too many children");
        return type.create(args);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object tagValue(Class<?> cls, Object raw) {
        if (cls.isEnum() && raw instanceof String)
            return Enum.valueOf((Class<? extends Enum>) cls, (String) raw);
        return raw;
    }

    private static Object leafValue(AstType type, Object raw) {
        Class<?> vt = AstType.box(type.getValueType());
        if (vt.isEnum()) return tagValue(vt, raw);
        if (raw instanceof Number && ! vt.isInstance(raw)) {
            Number n = (Number) raw;
            if (vt == Long.class) return n.longValue();
            if (vt == Integer.class) return n.intValue();
            if (vt == Double.class) return n.doubleValue();
        }
        return raw;
    }

    private static Object value(Object raw) {
        if (raw == null || raw == JSONObject.NULL) return null;
        if (raw instanceof Integer) return Long.valueOf((Integer) raw);
        if (raw instanceof BigDecimal) return ((BigDecimal) raw).doubleValue();
        return raw;
    }

}
