package io.github.drompincen.sprintplanner.runtime.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class RichText {

    static final String BULLET = "• ";

    private static final DocNode EMPTY = new DocNode.Container("doc", List.of());

    private RichText() {}

    /** Reads a description field: a rich-document object, a plain string, or nothing. */
    public static DocNode parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (node.isTextual()) {
            return new DocNode.Text(node.asText());
        }
        if (node.isArray()) {
            return new DocNode.Container("", parseChildren(node));
        }
        if (!node.isObject()) {
            return new DocNode.Text(node.asText(""));
        }

        String type = node.path("type").asText("");
        List<DocNode> children = parseChildren(node.path("content"));
        return switch (type) {
            case "text" -> new DocNode.Text(node.path("text").asText(""));
            case "paragraph" -> new DocNode.Paragraph(children);
            case "listItem" -> new DocNode.ListItem(children);
            case "bulletList" -> new DocNode.BulletList(children);
            case "orderedList" -> new DocNode.OrderedList(children);
            default -> new DocNode.Container(type, children);
        };
    }

    private static List<DocNode> parseChildren(JsonNode content) {
        if (content == null || !content.isArray()) {
            return List.of();
        }
        List<DocNode> children = new ArrayList<>(content.size());
        for (JsonNode child : content) {
            children.add(parse(child));
        }
        return children;
    }

    public static String extractPlainText(JsonNode node) {
        return extractPlainText(parse(node));
    }

    public static String extractPlainText(DocNode node) {
        if (node == null) {
            return "";
        }
        if (node instanceof DocNode.Text text) {
            return text.text() != null ? text.text() : "";
        }
        if (node instanceof DocNode.Paragraph paragraph) {
            return concat(paragraph.content(), "");
        }
        if (node instanceof DocNode.ListItem item) {
            return concat(item.content(), "");
        }
        if (node instanceof DocNode.BulletList list) {
            return bullets(list.content());
        }
        if (node instanceof DocNode.OrderedList list) {
            return bullets(list.content());
        }
        DocNode.Container container = (DocNode.Container) node;
        return concat(container.content(), " ");
    }

    private static String concat(List<DocNode> children, String separator) {
        if (children == null || children.isEmpty()) {
            return "";
        }
        return children.stream()
                .map(RichText::extractPlainText)
                .collect(Collectors.joining(separator));
    }

    private static String bullets(List<DocNode> children) {
        if (children == null || children.isEmpty()) {
            return "";
        }
        return children.stream()
                .map(child -> BULLET + extractPlainText(child))
                .collect(Collectors.joining("\n"));
    }
}
