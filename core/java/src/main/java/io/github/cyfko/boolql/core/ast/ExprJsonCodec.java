package io.github.cyfko.boolql.core.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.boolql.core.exception.ExpressionDecodingException;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Tagged-union JSON serialization of BoolQL trees.
 * <p>
 * Every node becomes an object whose {@code "type"} member names its kind, followed by
 * its fields; children are serialized the same way:
 * </p>
 * <pre>{@code
 * {"type":"Or",
 *  "left":{"type":"Var","name":"A"},
 *  "right":{"type":"Not","expr":{"type":"BoolLit","value":false}}}
 * }</pre>
 *
 * <table>
 *   <caption>Node encodings</caption>
 *   <tr><th>Node</th><th>Tag</th><th>Fields</th></tr>
 *   <tr><td>{@link Variable}</td><td>{@code Var}</td><td>{@code name} (string)</td></tr>
 *   <tr><td>{@link BooleanLiteral}</td><td>{@code BoolLit}</td><td>{@code value} (boolean)</td></tr>
 *   <tr><td>{@link Not}</td><td>{@code Not}</td><td>{@code expr} (node)</td></tr>
 *   <tr><td>{@link And}</td><td>{@code And}</td><td>{@code left}, {@code right} (nodes)</td></tr>
 *   <tr><td>{@link Or}</td><td>{@code Or}</td><td>{@code left}, {@code right} (nodes)</td></tr>
 * </table>
 *
 * <p>Decoding also accepts the tags {@code Variable} and {@code BooleanLiteral}.
 * Decoding a serialized tree always yields a tree equal to the original.</p>
 *
 * <p>Both directions walk the tree recursively and stop at {@value #MAX_DEPTH} levels, the
 * root counting as level 1. This matches Jackson's default nesting limit for reading and
 * writing documents.</p>
 *
 * @since 1.0.0
 */
public final class ExprJsonCodec {

    public static final String TYPE_FIELD = "type";

    /**
     * Deepest tree accepted by {@link #toJsonNode(Expr)} and {@link #fromJsonNode(JsonNode)}.
     */
    public static final int MAX_DEPTH = 1000;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExprJsonCodec() {}

    /**
     * Serializes a tree to compact JSON text.
     *
     * @param expr the tree
     * @return JSON text
     * @throws IllegalArgumentException if the tree is deeper than {@value #MAX_DEPTH} levels
     */
    public static String toJson(Expr expr) {
        try {
            return MAPPER.writeValueAsString(toJsonNode(expr));
        } catch (JsonProcessingException e) {
            // Tree-model nodes within MAX_DEPTH always serialize
            throw new IllegalStateException("Unable to serialize expression tree", e);
        }
    }

    /**
     * Serializes a tree to a Jackson tree model.
     *
     * @param expr the tree
     * @return the root JSON object
     * @throws IllegalArgumentException if the tree is deeper than {@value #MAX_DEPTH} levels
     */
    public static ObjectNode toJsonNode(Expr expr) {
        Objects.requireNonNull(expr, "Expression is required");
        return expr.accept(new Encoder());
    }

    /**
     * Decodes JSON text into a tree.
     *
     * @param json JSON text produced by {@link #toJson(Expr)} or an equivalent producer
     * @return the decoded tree
     * @throws ExpressionDecodingException if the text is not valid JSON or not a valid tree
     */
    public static Expr fromJson(String json) {
        Objects.requireNonNull(json, "JSON text is required");
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExpressionDecodingException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        return fromJsonNode(root);
    }

    /**
     * Decodes a Jackson tree model into a tree.
     *
     * @param node the root JSON object
     * @return the decoded tree
     * @throws ExpressionDecodingException if the node does not describe a valid tree
     */
    public static Expr fromJsonNode(JsonNode node) {
        return decode(node, 1);
    }

    private static Expr decode(JsonNode node, int depth) {
        if (depth > MAX_DEPTH) {
            throw new ExpressionDecodingException("Expression tree deeper than " + MAX_DEPTH + " levels");
        }
        if (node == null || !node.isObject()) {
            throw new ExpressionDecodingException("Expected a JSON object for an expression node, got: " + node);
        }

        JsonNode tag = node.get(TYPE_FIELD);
        if (tag == null || !tag.isTextual()) {
            throw new ExpressionDecodingException("Missing '" + TYPE_FIELD + "' field in node: " + node);
        }

        switch (tag.asText()) {
            case "Var":
            case "Variable":
                return new Variable(requireField(node, "name", JsonNode::isTextual, "a string").asText());
            case "BoolLit":
            case "BooleanLiteral":
                return BooleanLiteral.of(requireField(node, "value", JsonNode::isBoolean, "a boolean").asBoolean());
            case "Not":
                return new Not(child(node, "expr", depth));
            case "And":
                return new And(child(node, "left", depth), child(node, "right", depth));
            case "Or":
                return new Or(child(node, "left", depth), child(node, "right", depth));
            default:
                throw new ExpressionDecodingException("Unknown node type: " + tag.asText());
        }
    }

    private static Expr child(JsonNode node, String field, int depth) {
        return decode(requireField(node, field, JsonNode::isObject, "an object"), depth + 1);
    }

    private static JsonNode requireField(JsonNode node, String field,
                                         Predicate<JsonNode> check, String description) {
        JsonNode value = node.get(field);
        if (value == null) {
            throw new ExpressionDecodingException(String.format(
                    "Missing field '%s' in %s node", field, node.get(TYPE_FIELD).asText()));
        }
        if (!check.test(value)) {
            throw new ExpressionDecodingException(String.format(
                    "Field '%s' of %s node must be %s, got: %s", field, node.get(TYPE_FIELD).asText(), description, value));
        }
        return value;
    }

    private static final class Encoder implements ExprVisitor<ObjectNode> {

        private int depth = 1;

        @Override
        public ObjectNode visitVariable(Variable expr) {
            return tagged("Var").put("name", expr.name());
        }

        @Override
        public ObjectNode visitBooleanLiteral(BooleanLiteral expr) {
            return tagged("BoolLit").put("value", expr.value());
        }

        @Override
        public ObjectNode visitNot(Not expr) {
            ObjectNode node = tagged("Not");
            node.set("expr", nested(expr.operand()));
            return node;
        }

        @Override
        public ObjectNode visitAnd(And expr) {
            return binary("And", expr.left(), expr.right());
        }

        @Override
        public ObjectNode visitOr(Or expr) {
            return binary("Or", expr.left(), expr.right());
        }

        private ObjectNode binary(String tag, Expr left, Expr right) {
            ObjectNode node = tagged(tag);
            node.set("left", nested(left));
            node.set("right", nested(right));
            return node;
        }

        private ObjectNode nested(Expr child) {
            if (++depth > MAX_DEPTH) {
                throw new IllegalArgumentException("Expression tree deeper than " + MAX_DEPTH + " levels");
            }
            try {
                return child.accept(this);
            } finally {
                depth--;
            }
        }

        private ObjectNode tagged(String tag) {
            return MAPPER.createObjectNode().put(TYPE_FIELD, tag);
        }
    }
}
