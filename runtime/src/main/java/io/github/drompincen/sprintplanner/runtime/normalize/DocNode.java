package io.github.drompincen.sprintplanner.runtime.normalize;

import java.util.List;

/**
 * Node of the tracker's rich-document description tree. Node types the planner
 * does not know about are kept as {@link Container} so their text survives.
 */
public sealed interface DocNode {

    record Text(String text) implements DocNode {}

    record Paragraph(List<DocNode> content) implements DocNode {}

    record ListItem(List<DocNode> content) implements DocNode {}

    record BulletList(List<DocNode> content) implements DocNode {}

    record OrderedList(List<DocNode> content) implements DocNode {}

    record Container(String type, List<DocNode> content) implements DocNode {}
}
