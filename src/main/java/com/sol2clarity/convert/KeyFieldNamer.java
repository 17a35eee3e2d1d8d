package com.sol2clarity.convert;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sol2clarity.model.source.Assignment;
import com.sol2clarity.model.source.BinaryOperation;
import com.sol2clarity.model.source.ContractDefinition;
import com.sol2clarity.model.source.EmitStatement;
import com.sol2clarity.model.source.Expression;
import com.sol2clarity.model.source.ExpressionStatement;
import com.sol2clarity.model.source.FunctionDefinition;
import com.sol2clarity.model.source.IndexAccess;
import com.sol2clarity.model.source.MappingType;
import com.sol2clarity.model.source.MemberAccess;
import com.sol2clarity.model.source.Parameter;
import com.sol2clarity.model.source.ReturnStatement;
import com.sol2clarity.model.source.StateVariable;
import com.sol2clarity.model.source.Statement;
import com.sol2clarity.util.NamingUtil;

/**
 * Chooses tuple field names for flattened nested mappings.
 *
 * <p>Every index expression written against a mapping votes, per key position, with
 * the kebab-cased last identifier of the expression ({@code owner},
 * {@code msg.sender -> sender}). Literals and compound expressions do not vote. A
 * position takes its name when exactly one name was seen there and no other position
 * of the same mapping resolved to that name; otherwise it falls back to {@code key-<n>}.
 */
public class KeyFieldNamer {

    private static final Logger log = LoggerFactory.getLogger(KeyFieldNamer.class);

    /**
     * @return field names per nested mapping (depth two or more), keyed by Solidity variable name
     */
    public Map<String, List<String>> nameKeyFields(ContractDefinition contract) {
        Map<String, Integer> depths = new LinkedHashMap<>();
        for (StateVariable variable : contract.getStateVariables()) {
            if (variable.getType() instanceof MappingType mapping && mapping.getDepth() > 1) {
                depths.put(variable.getName(), mapping.getDepth());
            }
        }

        Map<String, List<Set<String>>> votes = new LinkedHashMap<>();
        depths.forEach((name, depth) -> {
            List<Set<String>> positions = new ArrayList<>();
            for (int i = 0; i < depth; i++) {
                positions.add(new LinkedHashSet<>());
            }
            votes.put(name, positions);
        });
        if (votes.isEmpty()) {
            return Map.of();
        }

        for (FunctionDefinition function : contract.getFunctions()) {
            Set<String> shadowed = new HashSet<>();
            for (Parameter parameter : function.getParameters()) {
                shadowed.add(parameter.getName());
            }
            for (Statement statement : function.getBody()) {
                collectFromStatement(statement, shadowed, votes);
            }
        }

        Map<String, List<String>> result = new LinkedHashMap<>();
        votes.forEach((name, positions) -> {
            List<String> fields = resolve(positions);
            log.debug("Key fields for {}: {}", name, fields);
            result.put(name, fields);
        });
        return result;
    }

    private void collectFromStatement(Statement statement, Set<String> shadowed,
                                      Map<String, List<Set<String>>> votes) {
        if (statement instanceof Assignment assignment) {
            collect(assignment.getTarget(), shadowed, votes);
            collect(assignment.getValue(), shadowed, votes);
        } else if (statement instanceof ReturnStatement ret && ret.getValue() != null) {
            collect(ret.getValue(), shadowed, votes);
        } else if (statement instanceof EmitStatement emit) {
            emit.getArguments().forEach(argument -> collect(argument, shadowed, votes));
        } else if (statement instanceof ExpressionStatement expression) {
            collect(expression.getExpression(), shadowed, votes);
        }
    }

    private void collect(Expression expression, Set<String> shadowed, Map<String, List<Set<String>>> votes) {
        if (expression instanceof BinaryOperation operation) {
            collect(operation.getLeft(), shadowed, votes);
            collect(operation.getRight(), shadowed, votes);
        } else if (expression instanceof IndexAccess access) {
            MemberAccess base = access.getBase();
            List<Set<String>> positions = base.isSimpleName() && !shadowed.contains(base.getFirst())
                    ? votes.get(base.getFirst())
                    : null;
            for (int i = 0; i < access.getIndices().size(); i++) {
                Expression index = access.getIndices().get(i);
                if (positions != null && i < positions.size() && index instanceof MemberAccess name) {
                    positions.get(i).add(NamingUtil.toKebabCase(name.getLast()));
                }
                collect(index, shadowed, votes);
            }
        }
    }

    private static List<String> resolve(List<Set<String>> positions) {
        List<String> candidates = new ArrayList<>();
        for (Set<String> seen : positions) {
            candidates.add(seen.size() == 1 ? seen.iterator().next() : null);
        }

        List<String> fields = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            boolean unique = candidate != null
                    && candidates.stream().filter(candidate::equals).count() == 1;
            fields.add(unique ? candidate : fallbackName(i));
        }

        // A derived name may still equal another position's fallback.
        if (new HashSet<>(fields).size() != fields.size()) {
            fields.clear();
            for (int i = 0; i < positions.size(); i++) {
                fields.add(fallbackName(i));
            }
        }
        return List.copyOf(fields);
    }

    static String fallbackName(int position) {
        return "key-" + (position + 1);
    }
}
