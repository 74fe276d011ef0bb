package net.ox.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.ox.api.NamedValue;

/**
 * The descriptor of an AST type.
 * An AstType is built once per Java class of AST elements (conventionally
 * stored in a static TYPE field of that class) and records which kind of
 * element the type describes (NODE, LEAF, or TREE; abstract types have
 * none), its parent type and hierarchy root, its fields, and how instances
 * are created, printed, and addressed symbolically.
 * The fields of a node type are classified once, when the descriptor is
 * built: a leading field whose declared type is not an AST type is the tag
 * (e.g. an operator enumeration); the remaining fields are children if
 * their declared type is an AST type and attributes otherwise. Children
 * must be contiguous, i.e. either all leading or all trailing among the
 * non-tag fields.
 * Descriptors are immutable except for the hierarchy they are attached to,
 * which is set exactly once when the hierarchy is built.
 */
public final class AstType implements NamedValue {

    /**
     * The shape of the instances of a (non-abstract) AstType.
     */
    public enum Kind {
        /** Fixed-arity element with named fields. */
        NODE,
        /** Childless element holding a single value. */
        LEAF,
        /** Labeled element with any amount of children. */
        TREE
    }

    /**
     * How a field of a node is stored.
     */
    public enum FieldRole {
        /** The discriminant of the node (at most one, always first). */
        TAG,
        /** An owned child AST element. */
        CHILD,
        /** A non-AST value kept in the attribute map. */
        ATTRIBUTE
    }

    /**
     * A declared field of a node type.
     */
    public static final class Field implements NamedValue {

        private final String name;
        private final Class<?> type;
        private final FieldRole role;
        private final int index;

        private Field(String name, Class<?> type, FieldRole role,
                      int index) {
            this.name = name;
            this.type = type;
            this.role = role;
            this.index = index;
        }

        public String toString() {
            return String.format("%s:%s(%s)", name, type.getSimpleName(),
                                 role);
        }

        public String getName() {
            return name;
        }

        /**
         * The declared type of values of this field.
         */
        public Class<?> getType() {
            return type;
        }

        public FieldRole getRole() {
            return role;
        }

        /**
         * The position of this field among all fields of its type.
         */
        public int getIndex() {
            return index;
        }

        /**
         * Whether value is acceptable for this field.
         * Attributes may be null; tags and children may not.
         */
        public boolean accepts(Object value) {
            if (value == null) return (role == FieldRole.ATTRIBUTE);
            return box(type).isInstance(value);
        }

    }

    /**
     * Instance factory of a (non-abstract) type.
     * The arguments have already been validated against the type's fields
     * when create() is invoked; omitted trailing attributes are null.
     */
    public interface Factory {

        /**
         * Create an instance of the type from the given field values.
         */
        Ast create(Object[] args);

    }

    /**
     * Staged construction of an AstType.
     */
    public static final class Builder {

        private final String name;
        private final Class<? extends Ast> javaClass;
        private final AstType parent;
        private Kind kind;
        private boolean abstractType;
        private boolean root;
        private final List<String> fieldNames;
        private final List<Class<?>> fieldTypes;
        private Class<?> valueType;
        private final List<Class<?>> represented;
        private String template;
        private Factory factory;
        private final Map<Object, SExprConstructor> symbols;

        private Builder(String name, Class<? extends Ast> javaClass,
                        AstType parent, Kind kind) {
            if (name == null || javaClass == null)
                throw new NullPointerException(
                    "AST type name and class must not be null");
            this.name = name;
            this.javaClass = javaClass;
            this.parent = parent;
            this.kind = kind;
            this.fieldNames = new ArrayList<String>();
            this.fieldTypes = new ArrayList<Class<?>>();
            this.represented = new ArrayList<Class<?>>();
            this.symbols = new LinkedHashMap<Object, SExprConstructor>();
        }

        /**
         * Declare the next field of a node type.
         */
        public Builder field(String name, Class<?> type) {
            if (fieldNames.contains(name))
                throw new DeclarationException("Duplicate field " + name +
                    " in AST type " + this.name);
            fieldNames.add(name);
            fieldTypes.add(type);
            return this;
        }

        /**
         * Declare the host types whose values the (leaf) type represents;
         * the hierarchy coerces such values into instances of this type.
         */
        public Builder represents(Class<?>... types) {
            represented.addAll(Arrays.asList(types));
            return this;
        }

        /**
         * Set the printing template of a node type.
         */
        public Builder template(String text) {
            template = text;
            return this;
        }

        public Builder factory(Factory f) {
            factory = f;
            return this;
        }

        /**
         * Register the default constructor of this type under the given
         * S-expression head as well.
         */
        public Builder symbol(Object head) {
            symbols.put(head, null);
            return this;
        }

        /**
         * Register a custom constructor under the given S-expression head.
         */
        public Builder symbol(Object head, SExprConstructor ctor) {
            if (ctor == null)
                throw new NullPointerException(
                    "Symbol constructor must not be null");
            symbols.put(head, ctor);
            return this;
        }

        /**
         * Declare this type abstract.
         * Abstract types can still declare fields and templates for their
         * concrete descendants' Java classes, but cannot be instantiated.
         */
        public Builder makeAbstract() {
            abstractType = true;
            return this;
        }

        public AstType build() {
            if (root && parent != null)
                throw new DeclarationException("Root AST type " + name +
                    " must not have a parent");
            if (! root && parent == null)
                throw new DeclarationException("AST type " + name +
                    " must have a parent type");
            if (kind != Kind.NODE && ! fieldNames.isEmpty())
                throw new DeclarationException("Only node types may " +
                    "declare fields (in " + name + ")");
            if (kind != Kind.LEAF && ! represented.isEmpty())
                throw new DeclarationException("Only leaf types may " +
                    "represent host types (in " + name + ")");
            if (kind == null && ! abstractType)
                throw new DeclarationException("AST type " + name +
                    " has no kind and must be abstract");
            if (! abstractType && factory == null)
                throw new DeclarationException("Concrete AST type " + name +
                    " has no factory");
            return new AstType(this);
        }

    }

    private final String name;
    private final Class<? extends Ast> javaClass;
    private final AstType parent;
    private final AstType root;
    private final Kind kind;
    private final boolean abstractType;
    private final List<Field> fields;
    private final Map<String, Field> fieldsByName;
    private final Field tagField;
    private final List<Field> childFields;
    private final List<Field> attrFields;
    private final Class<?> valueType;
    private final List<Class<?>> represented;
    private final Template template;
    private final Factory factory;
    private final Map<Object, SExprConstructor> symbols;
    private Hierarchy hierarchy;

    private AstType(Builder b) {
        name = b.name;
        javaClass = b.javaClass;
        parent = b.parent;
        root = (b.root) ? this : b.parent.getRoot();
        kind = b.kind;
        abstractType = b.abstractType;
        valueType = b.valueType;
        represented = Collections.unmodifiableList(
            new ArrayList<Class<?>>(b.represented));
        factory = b.factory;
        symbols = Collections.unmodifiableMap(
            new LinkedHashMap<Object, SExprConstructor>(b.symbols));
        List<Field> fieldList = new ArrayList<Field>();
        List<Field> children = new ArrayList<Field>();
        List<Field> attrs = new ArrayList<Field>();
        Map<String, Field> byName = new LinkedHashMap<String, Field>();
        Field tag = null;
        int lastChild = -1, firstChild = -1;
        for (int i = 0; i < b.fieldNames.size(); i++) {
            Class<?> type = b.fieldTypes.get(i);
            FieldRole role;
            if (Ast.class.isAssignableFrom(type)) {
                role = FieldRole.CHILD;
                if (firstChild == -1) firstChild = i;
                lastChild = i;
            } else if (i == 0) {
                role = FieldRole.TAG;
            } else {
                role = FieldRole.ATTRIBUTE;
            }
            Field f = new Field(b.fieldNames.get(i), type, role, i);
            fieldList.add(f);
            byName.put(f.getName(), f);
            switch (role) {
                case TAG: tag = f; break;
                case CHILD: children.add(f); break;
                default: attrs.add(f); break;
            }
        }
        if (firstChild != -1) {
            int start = (tag == null) ? 0 : 1;
            if (lastChild - firstChild + 1 != children.size() ||
                    (firstChild != start &&
                     lastChild != fieldList.size() - 1))
                throw new DeclarationException("Children fields of AST " +
                    "type " + name + " must be contiguous and either " +
                    "leading or trailing: " + fieldList);
        }
        fields = Collections.unmodifiableList(fieldList);
        fieldsByName = Collections.unmodifiableMap(byName);
        tagField = tag;
        childFields = Collections.unmodifiableList(children);
        attrFields = Collections.unmodifiableList(attrs);
        if (b.template == null) {
            template = null;
        } else {
            template = Template.parse(b.template);
            for (String fn : template.getFieldNames()) {
                if (! fieldsByName.containsKey(fn))
                    throw new DeclarationException("Template \"" +
                        b.template + "\" of AST type " + name +
                        " names unknown field " + fn);
            }
        }
    }

    public String toString() {
        return String.format("%s@%h[name=%s,kind=%s,abstract=%s]",
            getClass().getName(), this, name, kind, abstractType);
    }

    public String getName() {
        return name;
    }

    /**
     * The Java class (or interface) instances of this type belong to.
     */
    public Class<? extends Ast> getJavaClass() {
        return javaClass;
    }

    /**
     * The parent type, or null for a root.
     */
    public AstType getParent() {
        return parent;
    }

    public AstType getRoot() {
        return root;
    }

    public boolean isRoot() {
        return root == this;
    }

    /**
     * The kind of the instances of this type, or null for abstract types
     * that do not declare one.
     */
    public Kind getKind() {
        return kind;
    }

    public boolean isAbstract() {
        return abstractType;
    }

    public boolean isNode() {
        return kind == Kind.NODE;
    }

    public boolean isLeaf() {
        return kind == Kind.LEAF;
    }

    /**
     * Whether this type is other or one of its descendants.
     */
    public boolean isSubtypeOf(AstType other) {
        for (AstType t = this; t != null; t = t.getParent()) {
            if (t == other) return true;
        }
        return false;
    }

    public List<Field> getFields() {
        return fields;
    }

    /**
     * The field with the given name, or null.
     */
    public Field getField(String name) {
        return fieldsByName.get(name);
    }

    /**
     * The tag field, or null.
     */
    public Field getTagField() {
        return tagField;
    }

    public List<Field> getChildFields() {
        return childFields;
    }

    public List<Field> getAttributeFields() {
        return attrFields;
    }

    /**
     * The minimum amount of arguments a constructor call must supply (the
     * tag and all children).
     */
    public int getMinArity() {
        return childFields.size() + ((tagField == null) ? 0 : 1);
    }

    /**
     * The type of the values held by instances of a leaf type.
     */
    public Class<?> getValueType() {
        return valueType;
    }

    /**
     * The host types a leaf type is coerced from.
     */
    public List<Class<?>> getRepresentedTypes() {
        return represented;
    }

    /**
     * The printing template, or null.
     */
    public Template getTemplate() {
        return template;
    }

    /**
     * The S-expression heads declared by this type, mapped to their
     * custom constructors (or to null for the default constructor).
     */
    public Map<Object, SExprConstructor> getSymbols() {
        return symbols;
    }

    /**
     * The hierarchy this type has been registered in, or null.
     */
    public synchronized Hierarchy getHierarchy() {
        return hierarchy;
    }

    synchronized void attach(Hierarchy h) {
        if (hierarchy == h) return;
        if (hierarchy != null)
            throw new DeclarationException("AST type " + name +
                " is already registered in another hierarchy");
        hierarchy = h;
    }

    /**
     * Verify that args is an acceptable argument list for this type and
     * return it padded to the full field count.
     */
    Object[] checkArguments(Object[] args) {
        if (abstractType)
            throw new AbstractInstantiationException(
                "Cannot instantiate abstract AST type " + name);
        switch (kind) {
            case LEAF:
                if (args.length != 1)
                    throw new ConstructionException("Leaf type " + name +
                        " expects exactly one value, got " + args.length);
                return args;
            case TREE:
                return args;
        }
        if (args.length < getMinArity())
            throw new ConstructionException("AST type " + name +
                " expects at least " + getMinArity() + " argument(s), got " +
                args.length);
        if (args.length > fields.size())
            throw new ConstructionException("AST type " + name +
                " expects at most " + fields.size() + " argument(s), got " +
                args.length);
        for (int i = 0; i < args.length; i++) {
            Field f = fields.get(i);
            if (! f.accepts(args[i]))
                throw new ConstructionException("Invalid value for field " +
                    f.getName() + " of " + name + ": expected " +
                    f.getType().getSimpleName() + ", got " +
                    describe(args[i]));
        }
        return (args.length == fields.size()) ? args :
            Arrays.copyOf(args, fields.size());
    }

    /**
     * Create an instance of this type from the given arguments.
     * For nodes, the arguments are the field values in order (trailing
     * attributes may be omitted); for leaves, the single value; for trees,
     * the tag followed by the children (or by a list thereof).
     */
    public Ast create(Object... args) {
        return factory.create(checkArguments(args));
    }

    static String describe(Object value) {
        if (value == null) return "null";
        return value.getClass().getName();
    }

    static Class<?> box(Class<?> cls) {
        if (! cls.isPrimitive()) return cls;
        if (cls == int.class) return Integer.class;
        if (cls == long.class) return Long.class;
        if (cls == double.class) return Double.class;
        if (cls == boolean.class) return Boolean.class;
        if (cls == char.class) return Character.class;
        if (cls == float.class) return Float.class;
        if (cls == short.class) return Short.class;
        if (cls == byte.class) return Byte.class;
        return Void.class;
    }

    /**
     * Start building a hierarchy root.
     * Roots are always abstract.
     */
    public static Builder root(String name, Class<? extends Ast> cls) {
        Builder ret = new Builder(name, cls, null, null);
        ret.root = true;
        ret.abstractType = true;
        return ret;
    }

    /**
     * Start building an abstract intermediate type without a kind.
     */
    public static Builder abstractType(String name,
            Class<? extends Ast> cls, AstType parent) {
        return new Builder(name, cls, parent, null).makeAbstract();
    }

    public static Builder node(String name, Class<? extends Ast> cls,
                               AstType parent) {
        return new Builder(name, cls, parent, Kind.NODE);
    }

    public static Builder leaf(String name, Class<? extends Ast> cls,
                               AstType parent, Class<?> valueType) {
        Builder ret = new Builder(name, cls, parent, Kind.LEAF);
        ret.valueType = valueType;
        return ret;
    }

    public static Builder tree(String name, Class<? extends Ast> cls,
                               AstType parent) {
        return new Builder(name, cls, parent, Kind.TREE);
    }

}
