package com.sol2clarity.model.source;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * A dotted identifier chain such as {@code count} or {@code msg.sender}.
 */
@Value
public class MemberAccess implements Expression {

    @NonNull
    List<String> path;

    public static MemberAccess of(String... segments) {
        return new MemberAccess(List.of(segments));
    }

    public boolean isSimpleName() {
        return path.size() == 1;
    }

    public String getFirst() {
        return path.get(0);
    }

    public String getLast() {
        return path.get(path.size() - 1);
    }

    @Override
    public String describe() {
        return String.join(".", path);
    }
}
