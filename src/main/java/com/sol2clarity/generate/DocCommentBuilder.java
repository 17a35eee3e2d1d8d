package com.sol2clarity.generate;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects {@code ;; @tag text} documentation lines for one definition.
 */
class DocCommentBuilder {

    private final List<String> lines = new ArrayList<>();

    DocCommentBuilder desc(String text) {
        return tag("desc", text);
    }

    DocCommentBuilder key(String type) {
        return tag("key", type);
    }

    DocCommentBuilder value(String type) {
        return tag("value", type);
    }

    DocCommentBuilder param(String name, String type) {
        return tag("param", name + " " + type);
    }

    /**
     * Documents a response whose error type is never produced.
     */
    DocCommentBuilder returns(String successType) {
        return tag("returns", "(response " + successType + " none)");
    }

    DocCommentBuilder fields(String text) {
        return tag("fields", text);
    }

    private DocCommentBuilder tag(String tag, String text) {
        lines.add(";; @" + tag + " " + text);
        return this;
    }

    String build() {
        return String.join("\n", lines) + "\n";
    }
}
