package com.vaceline.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds nodes from a kind tag and a plain field map, the way a rewrite synthesizes fragments
 * without a lexer. Built nodes carry no location and are usable anywhere a parsed node is.
 *
 * <pre>{@code
 * Statement log = (Statement) Nodes.build(NodeKind.LOG_STATEMENT,
 *     Map.of("content", new StringLiteral("\"entered\"")));
 * }</pre>
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    /**
     * Builds a node of the given kind from its non-location fields.
     *
     * @throws IllegalArgumentException if a required field is missing or has the wrong type
     */
    public static Node build(NodeKind kind, Map<String, ?> fields) {
        Fields f = new Fields(kind, fields);
        return switch (kind) {
            case PROGRAM -> new Program(null, f.comments(), f.list("body", Statement.class));

            case BOOLEAN_LITERAL -> new BooleanLiteral(f.string("value"));
            case STRING_LITERAL -> new StringLiteral(f.string("value"));
            case MULTILINE_LITERAL -> new MultilineLiteral(f.string("value"));
            case DURATION_LITERAL -> new DurationLiteral(f.string("value"));
            case NUMERIC_LITERAL -> new NumericLiteral(f.string("value"));

            case IDENTIFIER -> new Identifier(f.string("name"));
            case HEADER -> new Header(f.string("name"));
            case IP -> new Ip(f.string("value"), f.optional("cidr", Integer.class));
            case MEMBER -> new Member(f.node("base", Expression.class), f.node("member", Expression.class));
            case VALUE_PAIR -> new ValuePair(f.node("base", Expression.class), f.node("name", Identifier.class));
            case BOOLEAN_EXPRESSION -> new BooleanExpression(f.node("body", Expression.class));
            case UNARY_EXPRESSION -> new UnaryExpression(f.string("operator"), f.node("argument", Expression.class));
            case FUN_CALL_EXPRESSION -> new FunCallExpression(
                f.node("callee", Expression.class), f.list("arguments", Expression.class));
            case CONCAT_EXPRESSION -> new ConcatExpression(f.list("body", Expression.class));
            case BINARY_EXPRESSION -> new BinaryExpression(
                f.node("left", Expression.class), f.string("operator"), f.node("right", Expression.class));
            case LOGICAL_EXPRESSION -> new LogicalExpression(
                f.node("left", Expression.class), f.string("operator"), f.node("right", Expression.class));

            case EXPRESSION_STATEMENT -> new ExpressionStatement(null, f.comments(), f.node("body", Expression.class));
            case INCLUDE_STATEMENT -> new IncludeStatement(null, f.comments(), f.node("module", StringLiteral.class));
            case IMPORT_STATEMENT -> new ImportStatement(null, f.comments(), f.node("module", Identifier.class));
            case CALL_STATEMENT -> new CallStatement(null, f.comments(), f.node("subroutine", Identifier.class));
            case DECLARE_STATEMENT -> new DeclareStatement(
                null, f.comments(), f.node("id", Expression.class), f.string("valueType"));
            case ADD_STATEMENT -> new AddStatement(null, f.comments(),
                f.node("left", Expression.class), f.string("operator"), f.node("right", Expression.class));
            case SET_STATEMENT -> new SetStatement(null, f.comments(),
                f.node("left", Expression.class), f.string("operator"), f.node("right", Expression.class));
            case UNSET_STATEMENT -> new UnsetStatement(null, f.comments(), f.node("id", Expression.class));
            case RETURN_STATEMENT -> new ReturnStatement(null, f.comments(), f.string("action"));
            case ERROR_STATEMENT -> new ErrorStatement(null, f.comments(),
                f.node("status", Literal.class), f.optional("message", Expression.class));
            case RESTART_STATEMENT -> new RestartStatement(null, f.comments());
            case SYNTHETIC_STATEMENT -> new SyntheticStatement(null, f.comments(), f.node("response", Expression.class));
            case LOG_STATEMENT -> new LogStatement(null, f.comments(), f.node("content", Expression.class));
            case IF_STATEMENT -> new IfStatement(null, f.comments(),
                f.node("test", Expression.class),
                f.list("consequent", Statement.class),
                f.optional("alternate", IfStatement.class),
                f.optionalList("alternateBody", Statement.class));
            case SUBROUTINE_STATEMENT -> new SubroutineStatement(null, f.comments(),
                f.node("id", Identifier.class), f.list("body", Statement.class));
            case ACL_STATEMENT -> new AclStatement(null, f.comments(),
                f.node("id", Identifier.class), f.list("body", Ip.class));
            case BACKEND_STATEMENT -> new BackendStatement(null, f.comments(),
                f.node("id", Identifier.class), f.list("body", BackendDefinition.class));
            case TABLE_STATEMENT -> new TableStatement(null, f.comments(),
                f.node("id", Identifier.class), f.list("body", TableDefinition.class));

            case BACKEND_DEFINITION -> new BackendDefinition(null, f.string("key"),
                f.optional("value", Expression.class), f.optionalList("body", BackendDefinition.class));
            case TABLE_DEFINITION -> new TableDefinition(f.string("key"), f.string("value"));
        };
    }

    /**
     * Returns a mutable copy of {@code list}, so a node never shares its children with the caller
     * or with another node.
     */
    static <T> List<T> mutable(List<T> list) {
        if (list == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(list);
    }

    private static final class Fields {
        private final NodeKind kind;
        private final Map<String, ?> values;

        Fields(NodeKind kind, Map<String, ?> values) {
            this.kind = kind;
            this.values = values == null ? Map.of() : values;
        }

        String string(String name) {
            return node(name, String.class);
        }

        Comments comments() {
            return optional("comments", Comments.class);
        }

        <T> T node(String name, Class<T> type) {
            T value = optional(name, type);
            if (value == null) {
                throw new IllegalArgumentException(kind.typeName() + " requires field '" + name + "'");
            }
            return value;
        }

        <T> T optional(String name, Class<T> type) {
            Object value = values.get(name);
            if (value == null) {
                return null;
            }
            if (!type.isInstance(value)) {
                throw new IllegalArgumentException(kind.typeName() + "." + name + " must be a "
                    + type.getSimpleName() + " but was " + value.getClass().getSimpleName());
            }
            return type.cast(value);
        }

        <T> List<T> list(String name, Class<T> elementType) {
            List<T> list = optionalList(name, elementType);
            if (list == null) {
                throw new IllegalArgumentException(kind.typeName() + " requires list field '" + name + "'");
            }
            return list;
        }

        <T> List<T> optionalList(String name, Class<T> elementType) {
            Object value = values.get(name);
            if (value == null) {
                return null;
            }
            if (!(value instanceof List<?> raw)) {
                throw new IllegalArgumentException(kind.typeName() + "." + name + " must be a list");
            }
            List<T> copy = new ArrayList<>(raw.size());
            for (Object element : raw) {
                if (!elementType.isInstance(element)) {
                    throw new IllegalArgumentException(kind.typeName() + "." + name + " may only contain "
                        + elementType.getSimpleName() + " elements");
                }
                copy.add(elementType.cast(element));
            }
            return copy;
        }
    }
}
