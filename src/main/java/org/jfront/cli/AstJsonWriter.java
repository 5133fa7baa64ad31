package org.jfront.cli;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jfront.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Renders a syntax tree as JSON. Every node object carries a {@code node} property with the simple
 * name of its record type; absent optional children are left out.
 */
public class AstJsonWriter {

    private final ObjectMapper objectMapper;

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
    private interface AstNodeMixin {
        @JsonIgnore
        List<AstNode> getChildren();
    }

    public AstJsonWriter() {
        this.objectMapper = new ObjectMapper()
                .addMixIn(AstNode.class, AstNodeMixin.class)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * @param node The root of the tree to render.
     * @param pretty Whether to indent the output.
     * @return The JSON text.
     * @throws JsonProcessingException if the tree cannot be serialized.
     */
    public String write(AstNode node, boolean pretty) throws JsonProcessingException {
        if (pretty) {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        }
        return objectMapper.writeValueAsString(node);
    }

    /**
     * @param node The root of the tree to render.
     * @return The tree as a Jackson tree model.
     */
    public JsonNode toTree(AstNode node) {
        return objectMapper.valueToTree(node);
    }
}
