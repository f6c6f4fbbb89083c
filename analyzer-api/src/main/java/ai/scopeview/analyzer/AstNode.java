package ai.scopeview.analyzer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;

/**
 * A semantic node derived from the concrete syntax tree.
 *
 * <p>String-typed accessors never return null: missing data is the empty string. {@link #children()} and
 * {@link #parameters()} are never null either. These guarantees are part of the serialized schema contract, so the
 * constructor coerces rather than rejects nulls.
 *
 * <p>{@link #id()} is the node's pre-order index inside the tree it was built with; it is how symbols and compression
 * plans refer back to nodes without holding on to them.
 */
public final class AstNode {
    private final int id;
    private final NodeType type;
    private final String name;
    private final String qualifiedName;
    private final String docstring;
    private final String signature;
    private final String returnType;
    private final List<Parameter> parameters;
    private final String path;
    private final boolean system;
    private final SourceRange range;
    private final String rawContent;
    private final Map<String, String> attributes;
    private final List<AstNode> children;

    private AstNode(Builder b, int id, List<AstNode> children) {
        this.id = id;
        this.type = Objects.requireNonNullElse(b.type, NodeType.UNKNOWN);
        this.name = Objects.requireNonNullElse(b.name, "");
        this.qualifiedName = Objects.requireNonNullElse(b.qualifiedName, "");
        this.docstring = Objects.requireNonNullElse(b.docstring, "");
        this.signature = Objects.requireNonNullElse(b.signature, "");
        this.returnType = Objects.requireNonNullElse(b.returnType, "");
        this.parameters = ImmutableList.copyOf(b.parameters);
        this.path = Objects.requireNonNullElse(b.path, "");
        this.system = b.system;
        this.range = Objects.requireNonNullElse(b.range, SourceRange.UNKNOWN);
        this.rawContent = Objects.requireNonNullElse(b.rawContent, "");
        this.attributes = ImmutableSortedMap.copyOf(b.attributes);
        this.children = ImmutableList.copyOf(children);
    }

    public static Builder builder(NodeType type) {
        return new Builder(type);
    }

    public int id() {
        return id;
    }

    public NodeType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    public String docstring() {
        return docstring;
    }

    public String signature() {
        return signature;
    }

    public String returnType() {
        return returnType;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public String path() {
        return path;
    }

    /** True for nodes that refer to system/library code, e.g. {@code #include <stdio.h>}. */
    public boolean isSystem() {
        return system;
    }

    public SourceRange range() {
        return range;
    }

    public String rawContent() {
        return rawContent;
    }

    /** Language-specific markers (async, decorators, access, static, template, ...), sorted by key. */
    public Map<String, String> attributes() {
        return attributes;
    }

    public String attribute(String key) {
        return attributes.getOrDefault(key, "");
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public List<AstNode> children() {
        return children;
    }

    /** This node and all its descendants in pre-order, which is also id order. */
    public Stream<AstNode> stream() {
        var out = new ArrayList<AstNode>();
        var stack = new ArrayDeque<AstNode>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            out.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return out.stream();
    }

    public Optional<AstNode> find(Predicate<AstNode> predicate) {
        return stream().filter(predicate).findFirst();
    }

    public Optional<AstNode> findByQualifiedName(String fqName) {
        return find(n -> n.qualifiedName.equals(fqName));
    }

    public int size() {
        return (int) stream().count();
    }

    /** Returns a builder initialised with this node's fields (children excluded). */
    public Builder toBuilder() {
        var b = new Builder(type)
                .name(name)
                .qualifiedName(qualifiedName)
                .docstring(docstring)
                .signature(signature)
                .returnType(returnType)
                .parameters(parameters)
                .path(path)
                .system(system)
                .range(range)
                .rawContent(rawContent);
        b.attributes.putAll(attributes);
        return b;
    }

    /** Structural equality (ids included), used to check determinism of parsing. */
    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof AstNode other)) return false;
        return id == other.id
                && system == other.system
                && type == other.type
                && name.equals(other.name)
                && qualifiedName.equals(other.qualifiedName)
                && docstring.equals(other.docstring)
                && signature.equals(other.signature)
                && returnType.equals(other.returnType)
                && parameters.equals(other.parameters)
                && path.equals(other.path)
                && range.equals(other.range)
                && rawContent.equals(other.rawContent)
                && attributes.equals(other.attributes)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, qualifiedName, range);
    }

    @Override
    public String toString() {
        return "AstNode[#" + id + " " + type + " " + (qualifiedName.isEmpty() ? name : qualifiedName) + "]";
    }

    /**
     * Mutable builder. Trees are assembled from builders and frozen in one pass by {@link #build()}, which assigns
     * pre-order ids.
     */
    public static final class Builder {
        private @Nullable NodeType type;
        private @Nullable String name;
        private @Nullable String qualifiedName;
        private @Nullable String docstring;
        private @Nullable String signature;
        private @Nullable String returnType;
        private final List<Parameter> parameters = new ArrayList<>();
        private @Nullable String path;
        private boolean system;
        private @Nullable SourceRange range;
        private @Nullable String rawContent;
        private final Map<String, String> attributes = new TreeMap<>();
        private final List<Builder> children = new ArrayList<>();

        private Builder(@Nullable NodeType type) {
            this.type = type;
        }

        public Builder type(@Nullable NodeType type) {
            this.type = type;
            return this;
        }

        public Builder name(@Nullable String name) {
            this.name = name;
            return this;
        }

        public Builder qualifiedName(@Nullable String qualifiedName) {
            this.qualifiedName = qualifiedName;
            return this;
        }

        public Builder docstring(@Nullable String docstring) {
            this.docstring = docstring;
            return this;
        }

        public Builder signature(@Nullable String signature) {
            this.signature = signature;
            return this;
        }

        public Builder returnType(@Nullable String returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder parameters(@Nullable List<Parameter> parameters) {
            this.parameters.clear();
            if (parameters != null) {
                for (var p : parameters) {
                    if (p != null) {
                        this.parameters.add(p);
                    }
                }
            }
            return this;
        }

        public Builder addParameter(Parameter parameter) {
            parameters.add(parameter);
            return this;
        }

        public Builder path(@Nullable String path) {
            this.path = path;
            return this;
        }

        public Builder system(boolean system) {
            this.system = system;
            return this;
        }

        public Builder range(@Nullable SourceRange range) {
            this.range = range;
            return this;
        }

        public Builder rawContent(@Nullable String rawContent) {
            this.rawContent = rawContent;
            return this;
        }

        public Builder attribute(String key, @Nullable String value) {
            if (value != null) {
                attributes.put(key, value);
            }
            return this;
        }

        public Builder addChild(Builder child) {
            children.add(child);
            return this;
        }

        public NodeType type() {
            return Objects.requireNonNullElse(type, NodeType.UNKNOWN);
        }

        public String name() {
            return Objects.requireNonNullElse(name, "");
        }

        public String qualifiedName() {
            return Objects.requireNonNullElse(qualifiedName, "");
        }

        public String docstring() {
            return Objects.requireNonNullElse(docstring, "");
        }

        public List<Builder> children() {
            return children;
        }

        /** Freezes this builder and its subtree, numbering nodes in pre-order starting at zero. */
        public AstNode build() {
            return build(new int[] {0});
        }

        private AstNode build(int[] nextId) {
            int myId = nextId[0]++;
            var built = new ArrayList<AstNode>(children.size());
            for (var child : children) {
                built.add(child.build(nextId));
            }
            return new AstNode(this, myId, built);
        }
    }
}
