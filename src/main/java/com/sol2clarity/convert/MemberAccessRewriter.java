package com.sol2clarity.convert;

import java.util.Map;
import java.util.stream.Collectors;

import com.sol2clarity.model.source.MemberAccess;
import com.sol2clarity.model.target.ScalarType;
import com.sol2clarity.util.NamingUtil;

import lombok.experimental.UtilityClass;

/**
 * Caller-context accessors with a Clarity keyword equivalent. Any other chain is
 * kebab-cased segment by segment and joined with {@code -}.
 */
@UtilityClass
public class MemberAccessRewriter {

    private static final Map<String, String> KEYWORDS = Map.of(
            "msg.sender", "tx-sender",
            "tx.origin", "tx-sender",
            "block.number", "block-height");

    private static final Map<String, ScalarType> KEYWORD_TYPES = Map.of(
            "msg.sender", ScalarType.PRINCIPAL,
            "tx.origin", ScalarType.PRINCIPAL,
            "block.number", ScalarType.UINT);

    public String rewrite(MemberAccess access) {
        String keyword = KEYWORDS.get(access.describe());
        if (keyword != null) {
            return keyword;
        }
        return access.getPath().stream()
                .map(NamingUtil::toKebabCase)
                .collect(Collectors.joining("-"));
    }

    /**
     * Type of a substituted accessor, or {@code null} when the chain is not in the table.
     */
    public ScalarType knownType(MemberAccess access) {
        return KEYWORD_TYPES.get(access.describe());
    }
}
