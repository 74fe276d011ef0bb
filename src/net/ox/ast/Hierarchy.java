package net.ox.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import net.ox.util.Logging;

/**
 * The registry of a family of AST types sharing one root.
 * A Hierarchy holds the symbol table mapping S-expression heads to
 * constructors and the coercion table converting host values into members
 * of the hierarchy; exactly one of each exists per root. Hierarchies are
 * built in one pass over all member types by a Builder.
 * Lookups are lock-free; registrations after construction are serialized
 * and publish copied tables, so a Hierarchy may be read from multiple
 * threads while types are (rarely) registered.
 * When a head is registered more than once, the first registration wins;
 * later ones are ignored and logged.
 */
public final class Hierarchy {

    /**
     * Operations of the expression wrapper that are delegated to
     * hierarchy-specific heads.
     */
    public enum Role {
        /** Attribute access (x.name). */
        GETATTR,
        /** Subscription (x[key]). */
        GETITEM,
        /** Function call (x(args)). */
        FCALL
    }

    /**
     * A conversion of host values of some class into hierarchy members.
     */
    public interface Coercion {

        /**
         * Convert value (which is an instance of the class this was
         * registered for).
         */
        Ast coerce(Object value);

    }

    /**
     * Staged construction of a Hierarchy.
     */
    public static final class Builder {

        private final AstType root;
        private final List<AstType> types;
        private final Map<Role, Object> roles;
        private final Map<Class<?>, Coercion> coercions;

        private Builder(AstType root) {
            if (! root.isRoot())
                throw new DeclarationException("AST type " + root.getName() +
                    " is not a hierarchy root");
            this.root = root;
            this.types = new ArrayList<AstType>();
            this.roles = new EnumMap<Role, Object>(Role.class);
            this.coercions = new LinkedHashMap<Class<?>, Coercion>();
        }

        /**
         * Add member types (abstract or concrete) to the hierarchy.
         */
        public Builder add(AstType... members) {
            types.addAll(Arrays.asList(members));
            return this;
        }

        /**
         * Bind a wrapper role to an S-expression head.
         */
        public Builder role(Role role, Object head) {
            roles.put(role, head);
            return this;
        }

        /**
         * Register a coercion for host values of the given class.
         */
        public Builder coercion(Class<?> cls, Coercion c) {
            coercions.put(cls, c);
            return this;
        }

        public Hierarchy build() {
            return new Hierarchy(this);
        }

    }

    private static final Logger LOGGER = Logging.getLogger("Hierarchy");

    private final AstType root;
    private final List<AstType> types;
    private final Map<String, AstType> typesByName;
    private final Map<Role, Object> roles;
    private volatile Map<Object, SExprConstructor> symbols;
    private volatile Map<Class<?>, Coercion> coercions;

    private Hierarchy(Builder b) {
        root = b.root;
        roles = Collections.unmodifiableMap(
            new EnumMap<Role, Object>(b.roles));
        symbols = Collections.emptyMap();
        coercions = Collections.emptyMap();
        List<AstType> members = new ArrayList<AstType>();
        Map<String, AstType> byName = new LinkedHashMap<String, AstType>();
        members.add(root);
        members.addAll(b.types);
        for (AstType t : members) {
            if (t.getRoot() != root)
                throw new DeclarationException("AST type " + t.getName() +
                    " does not belong to the hierarchy rooted at " +
                    root.getName());
            if (byName.containsKey(t.getName()) && byName.get(t.getName()) != t)
                throw new DeclarationException("Duplicate AST type name " +
                    t.getName() + " in hierarchy " + root.getName());
            byName.put(t.getName(), t);
        }
        types = Collections.unmodifiableList(
            new ArrayList<AstType>(byName.values()));
        typesByName = Collections.unmodifiableMap(byName);
        for (AstType t : types) t.attach(this);
        for (AstType t : types) {
            if (t.isAbstract()) continue;
            SExprConstructor ctor = defaultConstructor(t);
            register(t, ctor);
            register(t.getJavaClass(), ctor);
            for (Map.Entry<Object, SExprConstructor> ent :
                     t.getSymbols().entrySet()) {
                register(ent.getKey(), (ent.getValue() == null) ? ctor :
                                       ent.getValue());
            }
            for (Class<?> cls : t.getRepresentedTypes()) {
                registerCoercion(cls, leafCoercion(t));
            }
        }
        for (Map.Entry<Class<?>, Coercion> ent : b.coercions.entrySet()) {
            registerCoercion(ent.getKey(), ent.getValue());
        }
        LOGGER.fine("Built hierarchy " + root.getName() + " with " +
                    types.size() + " types and " + symbols.size() +
                    " symbols");
    }

    public String toString() {
        return String.format("%s@%h[root=%s]", getClass().getName(), this,
                             root.getName());
    }

    public AstType getRoot() {
        return root;
    }

    /**
     * All member types, the root first.
     */
    public List<AstType> getTypes() {
        return types;
    }

    /**
     * The member type with the given name, or null.
     */
    public AstType getType(String name) {
        return typesByName.get(name);
    }

    /**
     * The concrete member types of the given kind.
     */
    public List<AstType> getTypes(AstType.Kind kind) {
        List<AstType> ret = new ArrayList<AstType>();
        for (AstType t : types) {
            if (! t.isAbstract() && t.getKind() == kind) ret.add(t);
        }
        return ret;
    }

    /**
     * Whether the given element's type belongs to this hierarchy.
     */
    public boolean contains(Ast node) {
        return node.getType().getHierarchy() == this;
    }

    /**
     * An immutable snapshot of the symbol table.
     */
    public Map<Object, SExprConstructor> getSymbols() {
        return symbols;
    }

    /**
     * The constructor registered for head, or null.
     */
    public SExprConstructor getConstructor(Object head) {
        return symbols.get(head);
    }

    /**
     * The head bound to the given wrapper role, or null.
     */
    public Object getRole(Role role) {
        return roles.get(role);
    }

    /**
     * Register ctor under head.
     * If head is already registered, nothing changes and false is
     * returned.
     */
    public synchronized boolean register(Object head, SExprConstructor ctor) {
        if (head == null || ctor == null)
            throw new NullPointerException(
                "Symbol head and constructor must not be null");
        SExprConstructor old = symbols.get(head);
        if (old != null) {
            if (old != ctor)
                LOGGER.fine("Ignoring duplicate registration of symbol " +
                    head + " in hierarchy " + root.getName() + " (" + ctor +
                    "); keeping " + old);
            return false;
        }
        Map<Object, SExprConstructor> copy =
            new LinkedHashMap<Object, SExprConstructor>(symbols);
        copy.put(head, ctor);
        symbols = Collections.unmodifiableMap(copy);
        return true;
    }

    /**
     * Register a coercion for host values of the given class.
     * As with symbols, the first registration for a class wins.
     */
    public synchronized boolean registerCoercion(Class<?> cls, Coercion c) {
        if (coercions.containsKey(cls)) {
            LOGGER.fine("Ignoring duplicate coercion for " + cls.getName() +
                        " in hierarchy " + root.getName());
            return false;
        }
        Map<Class<?>, Coercion> copy =
            new LinkedHashMap<Class<?>, Coercion>(coercions);
        copy.put(cls, c);
        coercions = Collections.unmodifiableMap(copy);
        return true;
    }

    /**
     * Construct an element from an S-expression with positional arguments
     * only.
     */
    public Ast construct(Object head, Object... args) {
        return construct(head, Arrays.asList(args),
                         Collections.<String, Object>emptyMap());
    }

    /**
     * Construct an element from an S-expression.
     * If head is not registered but is a SExprConstructor, it is invoked
     * directly; otherwise, an InvalidHeadException is raised.
     */
    public Ast construct(Object head, List<?> args,
                         Map<String, ?> kwargs) {
        SExprConstructor ctor = (head == null) ? null : symbols.get(head);
        if (ctor == null) {
            if (! (head instanceof SExprConstructor))
                throw new InvalidHeadException("Invalid S-expression head " +
                    head + " for hierarchy " + root.getName());
            ctor = (SExprConstructor) head;
        }
        return ctor.construct(this, args, kwargs);
    }

    /**
     * Construct the element bound to the given wrapper role.
     */
    public Ast constructRole(Role role, List<?> args,
                             Map<String, ?> kwargs) {
        Object head = roles.get(role);
        if (head == null)
            throw new InvalidHeadException("Hierarchy " + root.getName() +
                " does not support " + role);
        return construct(head, args, kwargs);
    }

    /**
     * Convert value into a member of this hierarchy.
     * Wrappers are unwrapped; members are returned as they are; other
     * values are converted by the coercion registered for the nearest of
     * their class, superclasses, and interfaces (null counts as an
     * instance of Void).
     */
    public Ast coerce(Object value) {
        if (value instanceof Wrapper) value = ((Wrapper) value).unwrap();
        if (value instanceof Ast) {
            Ast node = (Ast) value;
            if (contains(node)) return node;
            throw new CoercionException("Cannot coerce " +
                node.getType().getName() + " element into hierarchy " +
                root.getName());
        }
        Class<?> cls = (value == null) ? Void.class : value.getClass();
        Coercion c = findCoercion(cls);
        if (c == null)
            throw new CoercionException("Cannot coerce " + cls.getName() +
                " into hierarchy " + root.getName());
        return c.coerce(value);
    }

    /**
     * Coerce value and verify that the result is an instance of cls.
     */
    public <T extends Ast> T coerce(Object value, Class<T> cls) {
        Ast ret = coerce(value);
        if (! cls.isInstance(ret))
            throw new CoercionException("Cannot coerce " +
                AstType.describe(value) + " into " + cls.getSimpleName() +
                " (got " + ret.getType().getName() + ")");
        return cls.cast(ret);
    }

    private Coercion findCoercion(Class<?> cls) {
        Map<Class<?>, Coercion> table = coercions;
        Deque<Class<?>> queue = new ArrayDeque<Class<?>>();
        Set<Class<?>> seen = new HashSet<Class<?>>();
        queue.add(cls);
        while (! queue.isEmpty()) {
            Class<?> c = queue.poll();
            if (! seen.add(c)) continue;
            Coercion ret = table.get(c);
            if (ret != null) return ret;
            if (c.getSuperclass() != null) queue.add(c.getSuperclass());
            queue.addAll(Arrays.asList(c.getInterfaces()));
        }
        return null;
    }

    private static Coercion leafCoercion(final AstType type) {
        return new Coercion() {
            public Ast coerce(Object value) {
                return type.create(new Object[] {value});
            }
            public String toString() {
                return "coercion to " + type.getName();
            }
        };
    }

    /**
     * The constructor registered under a concrete type itself.
     * Positional arguments fill the fields in order; keyword arguments fill
     * fields by name, and unknown keywords become attributes. Child
     * arguments that are not AST elements are coerced.
     */
    public static SExprConstructor defaultConstructor(final AstType type) {
        return new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                return constructDefault(type, h, args, kwargs);
            }
            public String toString() {
                return "default constructor of " + type.getName();
            }
        };
    }

    static Ast constructDefault(AstType type, Hierarchy h, List<?> args,
                                Map<String, ?> kwargs) {
        if (type.getKind() != AstType.Kind.NODE) {
            if (! kwargs.isEmpty())
                throw new ConstructionException("AST type " +
                    type.getName() + " does not accept keyword arguments");
            if (type.getKind() == AstType.Kind.TREE) {
                List<Object> items = new ArrayList<Object>(args);
                for (int i = 1; i < items.size(); i++) {
                    if (! (items.get(i) instanceof Ast) &&
                            ! (items.get(i) instanceof List<?>))
                        items.set(i, h.coerce(items.get(i)));
                }
                return type.create(items.toArray());
            }
            return type.create(args.toArray());
        }
        List<AstType.Field> fields = type.getFields();
        if (args.size() > fields.size())
            throw new ConstructionException("AST type " + type.getName() +
                " expects at most " + fields.size() + " argument(s), got " +
                args.size());
        Object[] values = new Object[fields.size()];
        int length = args.size();
        for (int i = 0; i < args.size(); i++) values[i] = args.get(i);
        Map<String, Object> extra = new LinkedHashMap<String, Object>();
        for (Map.Entry<String, ?> ent : kwargs.entrySet()) {
            AstType.Field f = type.getField(ent.getKey());
            if (f == null) {
                extra.put(ent.getKey(), ent.getValue());
                continue;
            }
            if (f.getIndex() < args.size())
                throw new ConstructionException("AST type " +
                    type.getName() + " got multiple values for field " +
                    f.getName());
            values[f.getIndex()] = ent.getValue();
            length = Math.max(length, f.getIndex() + 1);
        }
        for (AstType.Field f : type.getChildFields()) {
            Object v = values[f.getIndex()];
            if (f.getIndex() < length && v != null && ! (v instanceof Ast))
                values[f.getIndex()] = h.coerce(v);
        }
        Ast ret = type.create(Arrays.copyOf(values, length));
        for (Map.Entry<String, Object> ent : extra.entrySet()) {
            ret.setAttribute(ent.getKey(), ent.getValue());
        }
        return ret;
    }

    public static Builder builder(AstType root) {
        return new Builder(root);
    }

}
